package db.parts.catalog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable data carrier for a table schema.
 * Column order is the declaration order and drives both SELECT lists and row decoding.
 */
public record TableSchema(String name, List<ColumnSchema> columns) {
    public TableSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name required");
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns empty");
        columns = List.copyOf(columns);
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (seen.put(columns.get(i).name(), i) != null) {
                throw new IllegalArgumentException("Duplicate column '" + columns.get(i).name() + "' in " + name);
            }
        }
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSchema::name).toList();
    }

    /** Position of the column, or -1 when the table does not declare it. */
    public int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(column)) return i;
        }
        return -1;
    }
}

package db.parts.query;

import java.util.List;

/**
 * Logical SELECT over a single table.
 * columns: empty list means SELECT *.
 * where: null => no WHERE.
 */
public record SelectQuery(String tableName, List<String> columns, WhereClause where) {
    public SelectQuery {
        if (tableName == null || tableName.isBlank()) throw new IllegalArgumentException("tableName required");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public String toSql() {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(columns.isEmpty() ? "*" : String.join(",", columns));
        sb.append(" FROM ").append(tableName);
        if (where != null) sb.append(" WHERE ").append(where.toSql());
        return sb.toString();
    }

    @Override
    public String toString() { return toSql(); }
}

package db.parts.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class TableSchemaTest {

    @Test
    void columnNamesKeepDeclarationOrder() {
        TableSchema ts = new TableSchema("t", List.of(
            new ColumnSchema("b", DataType.STRING),
            new ColumnSchema("a", DataType.UINT8),
            new ColumnSchema("c", DataType.DATETIME)
        ));
        assertEquals(List.of("b", "a", "c"), ts.columnNames());
        assertEquals(1, ts.indexOf("a"));
        assertEquals(-1, ts.indexOf("missing"));
    }

    @Test
    void rejectsDuplicateAndEmptyColumns() {
        assertThrows(IllegalArgumentException.class, () -> new TableSchema("t", List.of(
            new ColumnSchema("a", DataType.STRING),
            new ColumnSchema("a", DataType.UINT8)
        )));
        assertThrows(IllegalArgumentException.class, () -> new TableSchema("t", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ColumnSchema("x", null));
    }
}

package db.parts.query;

/**
 * Builds ALTER TABLE statements for partition manipulations:
 * <pre>
 * ALTER TABLE `db`.`table` OPERATION PARTITION 'partition'[ FROM path]
 * </pre>
 * The source path is appended verbatim; FETCH refuses to build without one.
 */
public final class PartitionSql {
    private PartitionSql() {}

    public static String build(String operation, String database, String table, String partition) {
        return build(PartitionOperation.fromName(operation), database, table, partition, null);
    }

    public static String build(String operation, String database, String table, String partition, String sourcePath) {
        return build(PartitionOperation.fromName(operation), database, table, partition, sourcePath);
    }

    public static String build(PartitionOperation operation, String database, String table, String partition, String sourcePath) {
        if (operation == null) throw new IllegalArgumentException("operation must not be null");
        requireText(database, "database");
        requireText(table, "table");
        requireText(partition, "partition");
        if (operation.requiresSourcePath() && (sourcePath == null || sourcePath.isBlank())) {
            throw new IllegalArgumentException(operation + " requires a source path");
        }
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
            .append(SqlLiterals.quoteIdentifier(database)).append('.').append(SqlLiterals.quoteIdentifier(table))
            .append(' ').append(operation.name())
            .append(" PARTITION ").append(SqlLiterals.quoteString(partition));
        if (sourcePath != null) sql.append(" FROM ").append(sourcePath);
        return sql.toString();
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isEmpty()) throw new IllegalArgumentException(what + " must not be empty");
    }
}

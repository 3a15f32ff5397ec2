package db.parts.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import db.parts.catalog.ColumnSchema;
import db.parts.catalog.DataType;
import db.parts.catalog.TableSchema;
import db.parts.client.Database;
import db.parts.config.PartsConfig;
import db.parts.query.Condition;
import db.parts.query.PartitionOperation;
import db.parts.query.PartitionSql;
import db.parts.query.SelectQuery;
import db.parts.query.WhereClause;
import db.parts.storage.Record;

/**
 * Read-only view of one row of system.parts: a data part of a MergeTree-family table.
 * Instances only come from decoding server rows; there is no public constructor and nothing is mutable.
 *
 * <p>The partition methods build an ALTER TABLE statement for this part's partition,
 * run it through the given {@link Database} and return the SQL that was sent.
 */
public final class SystemPart {
    public static final String TABLE_NAME = "system.parts";

    /** Columns in declaration order. SELECT lists and row decoding both follow this order. */
    public static final TableSchema SCHEMA = new TableSchema(TABLE_NAME, List.of(
        new ColumnSchema("database", DataType.STRING),
        new ColumnSchema("table", DataType.STRING),
        new ColumnSchema("engine", DataType.STRING),
        new ColumnSchema("partition", DataType.STRING),
        new ColumnSchema("name", DataType.STRING),
        new ColumnSchema("replicated", DataType.UINT8),
        new ColumnSchema("active", DataType.UINT8),
        new ColumnSchema("marks", DataType.UINT64),
        new ColumnSchema("bytes", DataType.UINT64),
        new ColumnSchema("modification_time", DataType.DATETIME),
        new ColumnSchema("remove_time", DataType.DATETIME),
        new ColumnSchema("refcount", DataType.UINT32)
    ));

    private final String database;
    private final String table;
    private final String engine;
    private final String partition;
    private final String name;
    private final boolean replicated;
    private final boolean active;
    private final long marks;
    private final long bytes;
    private final LocalDateTime modificationTime;
    private final LocalDateTime removeTime; // null while the part is active
    private final long refcount;

    private SystemPart(Record r) {
        this.database = (String) r.get(0);
        this.table = (String) r.get(1);
        this.engine = (String) r.get(2);
        this.partition = (String) r.get(3);
        this.name = (String) r.get(4);
        this.replicated = flag(r.get(5), "replicated");
        this.active = flag(r.get(6), "active");
        this.marks = number(r.get(7), "marks");
        this.bytes = number(r.get(8), "bytes");
        this.modificationTime = (LocalDateTime) r.get(9);
        this.removeTime = (LocalDateTime) r.get(10);
        this.refcount = number(r.get(11), "refcount");
    }

    /**
     * Build a part from a row decoded against {@link #SCHEMA}.
     * @throws IllegalArgumentException if the row does not match the schema
     */
    public static SystemPart fromRecord(Record record) {
        if (record == null) throw new IllegalArgumentException("record must not be null");
        if (record.size() != SCHEMA.columns().size()) {
            throw new IllegalArgumentException("Expected " + SCHEMA.columns().size() + " values for " + TABLE_NAME + " but got " + record.size());
        }
        try {
            return new SystemPart(record);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("Row does not match " + TABLE_NAME + " column types: " + record, e);
        }
    }

    // UInt8 flags: 0 or 1 only.
    private static boolean flag(Object value, String column) {
        if (!(value instanceof Integer i) || (i != 0 && i != 1)) {
            throw new IllegalArgumentException("Column '" + column + "' must be 0 or 1, got: " + value);
        }
        return i == 1;
    }

    private static long number(Object value, String column) {
        if (!(value instanceof Number n)) throw new IllegalArgumentException("Column '" + column + "' must be numeric, got: " + value);
        return n.longValue();
    }

    public String database() { return database; }
    public String table() { return table; }
    public String engine() { return engine; }
    public String partition() { return partition; }
    public String name() { return name; }
    public boolean replicated() { return replicated; }
    public boolean active() { return active; }
    public long marks() { return marks; }
    public long bytes() { return bytes; }
    /** Directory modification time, in UTC. */
    public LocalDateTime modificationTime() { return modificationTime; }
    /** Time the part became inactive, in UTC; null for active parts. */
    public LocalDateTime removeTime() { return removeTime; }
    public long refcount() { return refcount; }

    public long approximateRows() {
        return approximateRows(PartsConfig.DEFAULT_INDEX_GRANULARITY);
    }

    /** @throws ArithmeticException if the estimate does not fit in a long */
    public long approximateRows(long indexGranularity) {
        if (indexGranularity <= 0) throw new IllegalArgumentException("indexGranularity must be positive: " + indexGranularity);
        return Math.multiplyExact(marks, indexGranularity);
    }

    public boolean isInUse() {
        return isInUse(PartsConfig.DEFAULT_IN_USE_REFCOUNT);
    }

    public boolean isInUse(long threshold) {
        return refcount > threshold;
    }

    public String key() {
        return database + "." + table + "/" + partition + "/" + name;
    }

    // Partition manipulations

    public String detach(Database db, Map<String, String> settings) {
        return partitionOperation(db, PartitionOperation.DETACH, settings, null);
    }

    public String drop(Database db, Map<String, String> settings) {
        return partitionOperation(db, PartitionOperation.DROP, settings, null);
    }

    public String attach(Database db, Map<String, String> settings) {
        return partitionOperation(db, PartitionOperation.ATTACH, settings, null);
    }

    public String freeze(Database db, Map<String, String> settings) {
        return partitionOperation(db, PartitionOperation.FREEZE, settings, null);
    }

    /**
     * Download this partition from another replica.
     * @param sourcePath coordination-service path of the donor table, appended verbatim after FROM
     */
    public String fetch(Database db, String sourcePath, Map<String, String> settings) {
        return partitionOperation(db, PartitionOperation.FETCH, settings, sourcePath);
    }

    private String partitionOperation(Database db, PartitionOperation op, Map<String, String> settings, String sourcePath) {
        requireDatabase(db);
        String sql = PartitionSql.build(op, db.dbName(), table, partition, sourcePath);
        db.execute(sql, settings);
        return sql;
    }

    // Queries

    public static SelectQuery activeQuery(String dbName) {
        return new SelectQuery(TABLE_NAME, SCHEMA.columnNames(),
            WhereClause.allOf(Condition.isTrue("active"), Condition.eq("database", dbName)));
    }

    public static SelectQuery allQuery(String dbName) {
        return new SelectQuery(TABLE_NAME, SCHEMA.columnNames(), WhereClause.allOf(Condition.eq("database", dbName)));
    }

    /** Active parts of every table in the connection's database. */
    public static List<SystemPart> fetchActive(Database db) {
        requireDatabase(db);
        return db.select(activeQuery(db.dbName()).toSql(), SCHEMA, SystemPart::fromRecord);
    }

    /** All parts, active or not, of the connection's database. */
    public static List<SystemPart> fetchAll(Database db) {
        requireDatabase(db);
        return db.select(allQuery(db.dbName()).toSql(), SCHEMA, SystemPart::fromRecord);
    }

    private static void requireDatabase(Database db) {
        if (db == null) throw new IllegalArgumentException("database must be a Database instance");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SystemPart other)) return false;
        return Objects.equals(database, other.database) && Objects.equals(table, other.table)
            && Objects.equals(partition, other.partition) && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, table, partition, name);
    }

    @Override
    public String toString() {
        return "SystemPart{" + key() + ", engine=" + engine + ", active=" + active + ", marks=" + marks
            + ", bytes=" + bytes + ", refcount=" + refcount + "}";
    }
}

package db.parts.client;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import db.parts.catalog.TableSchema;
import db.parts.storage.Record;

/**
 * Connection to a database server. The transport (HTTP, native) lives outside this library;
 * implementations execute SQL text as given and surface server errors unchanged.
 */
public interface Database {

    /** Name of the database this connection works against. */
    String dbName();

    /**
     * Zone the server renders DATETIME text in. Implementations decode rows with
     * {@code Record.fromTsv(line, columns, serverZone())} so every DATETIME comes out in UTC.
     */
    default ZoneId serverZone() {
        return ZoneOffset.UTC;
    }

    /**
     * Execute a statement that returns no rows.
     * settings: per-request server settings, passed through as given; may be null.
     */
    void execute(String sql, Map<String, String> settings);

    /**
     * Run a query and decode every returned row against schema, in server order.
     */
    List<Record> query(String sql, TableSchema schema);

    default <T> List<T> select(String sql, TableSchema schema, RowMapper<T> mapper) {
        List<Record> records = query(sql, schema);
        List<T> out = new ArrayList<>(records.size());
        for (Record r : records) out.add(mapper.map(r));
        return out;
    }
}

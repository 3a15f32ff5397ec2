package db.parts.client;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import db.parts.catalog.TableSchema;
import db.parts.storage.Record;

/**
 * In-memory Database for tests: records every statement and answers queries
 * from canned TabSeparated lines.
 */
public class RecordingDatabase implements Database {
    public record Executed(String sql, Map<String, String> settings) {}

    private final String dbName;
    private final ZoneId serverZone;
    private final List<String> tsvRows;
    private final List<Executed> executed = new ArrayList<>();
    private final List<String> queries = new ArrayList<>();

    public RecordingDatabase(String dbName, String... tsvRows) {
        this(dbName, ZoneOffset.UTC, tsvRows);
    }

    public RecordingDatabase(String dbName, ZoneId serverZone, String... tsvRows) {
        this.dbName = dbName;
        this.serverZone = serverZone;
        this.tsvRows = List.of(tsvRows);
    }

    @Override
    public String dbName() { return dbName; }

    @Override
    public ZoneId serverZone() { return serverZone; }

    @Override
    public void execute(String sql, Map<String, String> settings) {
        executed.add(new Executed(sql, settings));
    }

    @Override
    public List<Record> query(String sql, TableSchema schema) {
        queries.add(sql);
        List<Record> out = new ArrayList<>();
        for (String line : tsvRows) out.add(Record.fromTsv(line, schema.columns(), serverZone));
        return out;
    }

    public List<Executed> executed() { return executed; }
    public List<String> queries() { return queries; }
}

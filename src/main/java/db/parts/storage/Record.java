package db.parts.storage;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import db.parts.catalog.ColumnSchema;

/**
 * One decoded result row. Values are held in schema order and already converted
 * to their Java types by {@link db.parts.catalog.DataType#parse(String, ZoneId)}.
 */
public class Record {
    private final List<Object> values;

    public Record(List<Object> values) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public static Record fromTsv(String line, List<ColumnSchema> columns) {
        return fromTsv(line, columns, ZoneOffset.UTC);
    }

    // Decode one TabSeparated line (no trailing newline). DATETIME text is read in serverZone.
    public static Record fromTsv(String line, List<ColumnSchema> columns, ZoneId serverZone) {
        if (line == null) throw new IllegalArgumentException("line must not be null");
        List<String> fields = splitTsv(line);
        if (fields.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " fields but got " + fields.size() + ": " + line);
        }
        List<Object> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            values.add(columns.get(i).type().parse(fields.get(i), serverZone));
        }
        return new Record(values);
    }

    public static Record fromJson(String json, List<ColumnSchema> columns) {
        return fromJson(json, columns, ZoneOffset.UTC);
    }

    // Decode one JSONEachRow object. Columns are looked up by name; extra keys are ignored.
    public static Record fromJson(String json, List<ColumnSchema> columns, ZoneId serverZone) {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        JsonObject obj;
        try {
            obj = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed JSON row: " + json, e);
        }
        List<Object> values = new ArrayList<>(columns.size());
        for (ColumnSchema col : columns) {
            if (!obj.has(col.name())) throw new IllegalArgumentException("Missing column '" + col.name() + "' in row: " + json);
            JsonElement el = obj.get(col.name());
            if (el.isJsonNull()) {
                values.add(null);
            } else if (el.isJsonPrimitive()) {
                values.add(col.type().parse(el.getAsString(), serverZone));
            } else {
                throw new IllegalArgumentException("Column '" + col.name() + "' must be a scalar, got: " + el);
            }
        }
        return new Record(values);
    }

    // Split on unescaped tabs, then unescape each field. A bare \N is NULL.
    private static List<String> splitTsv(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean isNull = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\\' && i + 1 < line.length()) {
                char next = line.charAt(++i);
                if (next == 'N' && current.length() == 0 && (i + 1 == line.length() || line.charAt(i + 1) == '\t')) {
                    isNull = true;
                    continue;
                }
                current.append(unescape(next));
            } else if (ch == '\t') {
                out.add(isNull ? null : current.toString());
                current.setLength(0);
                isNull = false;
            } else {
                current.append(ch);
            }
        }
        out.add(isNull ? null : current.toString());
        return out;
    }

    private static char unescape(char ch) {
        return switch (ch) {
            case 't' -> '\t';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case '0' -> '\0';
            default -> ch; // \\ \' and any other escaped char stand for themselves
        };
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

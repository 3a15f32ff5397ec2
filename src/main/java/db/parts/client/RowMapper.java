package db.parts.client;

import db.parts.storage.Record;

/**
 * Turns one decoded row into a typed object.
 */
@FunctionalInterface
public interface RowMapper<T> {
    T map(Record record);
}

package db.parts.catalog;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Server column types used by the system tables this library reads.
 * Each constant knows how to turn one text-encoded value into its Java form.
 */
public enum DataType {
    STRING,
    UINT8,
    UINT32,
    UINT64,
    DATETIME;

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String ZERO_DATETIME = "0000-00-00 00:00:00";
    private static final long UINT32_MAX = 0xFFFFFFFFL;

    /**
     * Convert a text value as a UTC server renders it.
     * STRING -> String, UINT8 -> Integer, UINT32/UINT64 -> Long, DATETIME -> LocalDateTime in UTC.
     * A zero DATETIME maps to null.
     */
    public Object parse(String raw) {
        return parse(raw, ZoneOffset.UTC);
    }

    /**
     * Convert a text value as the server renders it.
     * serverZone: zone the server writes DATETIME text in. Text and epoch forms both decode to UTC.
     */
    public Object parse(String raw, ZoneId serverZone) {
        if (raw == null) return null;
        if (serverZone == null) throw new IllegalArgumentException("serverZone must not be null");
        try {
            return switch (this) {
                case STRING -> raw;
                case UINT8 -> checkRange(Integer.parseInt(raw.trim()), 0, 255, raw);
                case UINT32 -> checkRange(Long.parseLong(raw.trim()), 0, UINT32_MAX, raw);
                case UINT64 -> checkRange(Long.parseLong(raw.trim()), 0, Long.MAX_VALUE, raw);
                case DATETIME -> parseDateTime(raw.trim(), serverZone);
            };
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalArgumentException("Invalid " + this + " value: '" + raw + "'", e);
        }
    }

    private static <N extends Number> N checkRange(N value, long min, long max, String raw) {
        long v = value.longValue();
        if (v < min || v > max) throw new IllegalArgumentException("Value out of range [" + min + ", " + max + "]: " + raw);
        return value;
    }

    // Digits only => unix timestamp. Text is wall-clock time in serverZone.
    private static LocalDateTime parseDateTime(String raw, ZoneId serverZone) {
        if (raw.isEmpty() || raw.equals(ZERO_DATETIME)) return null;
        if (raw.chars().allMatch(Character::isDigit)) {
            long seconds = Long.parseLong(raw);
            if (seconds == 0) return null;
            return LocalDateTime.ofInstant(Instant.ofEpochSecond(seconds), ZoneOffset.UTC);
        }
        return LocalDateTime.parse(raw, DATETIME_FORMAT)
            .atZone(serverZone)
            .withZoneSameInstant(ZoneOffset.UTC)
            .toLocalDateTime();
    }
}

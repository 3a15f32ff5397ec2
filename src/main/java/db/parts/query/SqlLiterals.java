package db.parts.query;

/**
 * Quoting helpers for identifiers and string literals (backslash escaping).
 */
public final class SqlLiterals {
    private SqlLiterals() {}

    public static String quoteIdentifier(String identifier) {
        return '`' + escape(identifier, '`') + '`';
    }

    public static String quoteString(String value) {
        return '\'' + escape(value, '\'') + '\'';
    }

    // Renders a WHERE literal: strings quoted, numbers and booleans as-is.
    public static String literal(Object value) {
        if (value == null) throw new IllegalArgumentException("NULL literals are not supported");
        if (value instanceof String s) return quoteString(s);
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    private static String escape(String raw, char quote) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '\\' || ch == quote) sb.append('\\');
            sb.append(ch);
        }
        return sb.toString();
    }
}

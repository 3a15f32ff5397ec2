package db.parts.query;

/**
 * Single-column WHERE condition descriptor.
 * A condition without a literal is a bare boolean column (rendered as just its name).
 */
public class Condition {
    public enum Op {
        EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    private final String columnName;
    private final Op op;
    private final Object literalValue; // null for a bare boolean column
    private final boolean negated;

    public Condition(String columnName, Op op, Object literalValue) {
        this(columnName, op, literalValue, false);
    }

    public Condition(String columnName, Op op, Object literalValue, boolean negated) {
        if (columnName == null || columnName.isBlank()) throw new IllegalArgumentException("columnName required");
        if (literalValue != null && op == null) throw new IllegalArgumentException("operator required for literal comparison on " + columnName);
        this.columnName = columnName;
        this.op = op;
        this.literalValue = literalValue;
        this.negated = negated;
    }

    public static Condition isTrue(String columnName) {
        return new Condition(columnName, null, null, false);
    }

    public static Condition isFalse(String columnName) {
        return new Condition(columnName, null, null, true);
    }

    public static Condition eq(String columnName, Object literalValue) {
        if (literalValue == null) throw new IllegalArgumentException("literal required for " + columnName);
        return new Condition(columnName, Op.EQ, literalValue);
    }

    public String columnName() { return columnName; }
    public Op op() { return op; }
    public Object literalValue() { return literalValue; }
    public boolean negated() { return negated; }
    public boolean isBare() { return literalValue == null; }

    public String toSql() {
        String body = isBare() ? columnName : columnName + op.symbol() + SqlLiterals.literal(literalValue);
        return negated ? "NOT " + body : body;
    }

    @Override
    public String toString() { return toSql(); }
}

package db.parts.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a WHERE clause as a linear sequence of atomic Conditions combined by AND/OR.
 * connectors list size == conditions.size()-1. Each connector is either "AND" or "OR".
 * Rendering keeps the server's precedence (AND before OR); no parentheses are emitted.
 */
public class WhereClause {
    private final List<Condition> conditions;
    private final List<String> connectors;

    public WhereClause(List<Condition> conditions, List<String> connectors) {
        if (conditions == null || conditions.isEmpty()) throw new IllegalArgumentException("conditions empty");
        if (connectors == null || connectors.size() != conditions.size() - 1) throw new IllegalArgumentException("connectors mismatch");
        for (String c : connectors) {
            if (!c.equals("AND") && !c.equals("OR")) throw new IllegalArgumentException("Unsupported connector: " + c);
        }
        this.conditions = List.copyOf(conditions);
        this.connectors = List.copyOf(connectors);
    }

    public static WhereClause allOf(Condition... conditions) {
        List<String> connectors = new ArrayList<>();
        for (int i = 1; i < conditions.length; i++) connectors.add("AND");
        return new WhereClause(List.of(conditions), connectors);
    }

    public List<Condition> conditions() { return conditions; }
    public List<String> connectors() { return connectors; }
    public boolean isSingle() { return conditions.size() == 1; }

    public String toSql() {
        StringBuilder sb = new StringBuilder(conditions.get(0).toSql());
        for (int i = 1; i < conditions.size(); i++) {
            sb.append(' ').append(connectors.get(i - 1)).append(' ').append(conditions.get(i).toSql());
        }
        return sb.toString();
    }
}

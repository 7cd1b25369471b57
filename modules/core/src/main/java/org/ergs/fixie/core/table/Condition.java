package org.ergs.fixie.core.table;

import java.util.List;
import java.util.Objects;

/**
 * A row filter: {@code field op value}. Conditions on one query are combined
 * with AND.
 */
public record Condition(String field, Operator op, Object value) {

    public enum Operator {
        EQ("==", "="),
        NE("!=", "<>"),
        LT("<", "<"),
        LE("<=", "<="),
        GT(">", ">"),
        GE(">=", ">=");

        private final String symbol;
        private final String sql;

        Operator(String symbol, String sql) {
            this.symbol = symbol;
            this.sql = sql;
        }

        public String symbol() {
            return symbol;
        }

        String sql() {
            return sql;
        }

        /** Parses an operator symbol; {@code =} is accepted for equality. */
        public static Operator fromSymbol(String symbol) {
            if ("=".equals(symbol)) {
                return EQ;
            }
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown condition operator: " + symbol);
        }
    }

    public Condition {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
    }

    /**
     * Builds a condition from a {@code [field, op, value]} triple.
     *
     * @throws IllegalArgumentException if the triple is malformed
     */
    public static Condition of(List<?> triple) {
        if (triple == null || triple.size() != 3) {
            throw new IllegalArgumentException("Condition must be [field, op, value], got: " + triple);
        }
        if (!(triple.get(0) instanceof String field) || !(triple.get(1) instanceof String op)) {
            throw new IllegalArgumentException("Condition field and operator must be strings: " + triple);
        }
        return new Condition(field, Operator.fromSymbol(op), triple.get(2));
    }
}

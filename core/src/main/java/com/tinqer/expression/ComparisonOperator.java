package com.tinqer.expression;

/**
 * Comparison operators. Strict and loose source equality map to the same
 * operator.
 */
public enum ComparisonOperator {
    EQUAL("==", "="),
    NOT_EQUAL("!=", "!="),
    GREATER_THAN(">", ">"),
    GREATER_THAN_OR_EQUAL(">=", ">="),
    LESS_THAN("<", "<"),
    LESS_THAN_OR_EQUAL("<=", "<=");

    private final String symbol;
    private final String sql;

    ComparisonOperator(String symbol, String sql) {
        this.symbol = symbol;
        this.sql = sql;
    }

    public String symbol() {
        return symbol;
    }

    public String sql() {
        return sql;
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        return switch (symbol) {
            case "==", "===" -> EQUAL;
            case "!=", "!==" -> NOT_EQUAL;
            case ">" -> GREATER_THAN;
            case ">=" -> GREATER_THAN_OR_EQUAL;
            case "<" -> LESS_THAN;
            case "<=" -> LESS_THAN_OR_EQUAL;
            default -> null;
        };
    }
}

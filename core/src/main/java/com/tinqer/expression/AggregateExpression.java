package com.tinqer.expression;

import java.util.Objects;

/**
 * Aggregate over a group. A null expression means {@code COUNT(*)}.
 */
public record AggregateExpression(Function function, ValueExpression expression) implements ValueExpression {

    public enum Function {
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "function must not be null");
    }

    public static AggregateExpression countAll() {
        return new AggregateExpression(Function.COUNT, null);
    }
}

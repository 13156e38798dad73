package com.tinqer.expression;

import java.util.Objects;

public record LogicalExpression(LogicalOperator operator, BooleanExpression left, BooleanExpression right)
    implements BooleanExpression {

    public LogicalExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    public static LogicalExpression and(BooleanExpression left, BooleanExpression right) {
        return new LogicalExpression(LogicalOperator.AND, left, right);
    }

    public static LogicalExpression or(BooleanExpression left, BooleanExpression right) {
        return new LogicalExpression(LogicalOperator.OR, left, right);
    }
}

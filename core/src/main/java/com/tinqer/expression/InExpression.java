package com.tinqer.expression;

import java.util.Objects;

/**
 * Membership test. The list is either an inline {@link ArrayExpression} or a
 * {@link ParameterExpression} bound to an array at execution time.
 */
public record InExpression(ValueExpression value, Expression list) implements BooleanExpression {

    public InExpression {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(list, "list must not be null");
        if (!(list instanceof ArrayExpression) && !(list instanceof ParameterExpression)) {
            throw new IllegalArgumentException("IN list must be an array or a parameter");
        }
    }
}

package com.tinqer.expression;

import java.util.Objects;

/**
 * A parameter used directly as a predicate.
 */
public record BooleanParameterExpression(ParameterExpression parameter) implements BooleanExpression {

    public BooleanParameterExpression {
        Objects.requireNonNull(parameter, "parameter must not be null");
    }
}

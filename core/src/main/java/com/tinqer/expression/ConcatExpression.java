package com.tinqer.expression;

import java.util.Objects;

/**
 * String concatenation, produced when {@code +} has a string operand.
 */
public record ConcatExpression(ValueExpression left, ValueExpression right) implements ValueExpression {

    public ConcatExpression {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}

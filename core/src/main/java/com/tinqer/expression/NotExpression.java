package com.tinqer.expression;

import java.util.Objects;

public record NotExpression(BooleanExpression expression) implements BooleanExpression {

    public NotExpression {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}

package com.tinqer.expression;

import java.util.Objects;

public record IsNullExpression(ValueExpression expression, boolean negated) implements BooleanExpression {

    public IsNullExpression {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}

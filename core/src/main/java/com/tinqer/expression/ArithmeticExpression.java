package com.tinqer.expression;

import java.util.Objects;

public record ArithmeticExpression(ArithmeticOperator operator, ValueExpression left, ValueExpression right)
    implements ValueExpression {

    public ArithmeticExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}

package com.tinqer.expression;

import java.util.Objects;

public record ComparisonExpression(ComparisonOperator operator, ValueExpression left, ValueExpression right)
    implements BooleanExpression {

    public ComparisonExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}

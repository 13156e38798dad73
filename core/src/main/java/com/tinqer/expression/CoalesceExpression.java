package com.tinqer.expression;

import java.util.List;

public record CoalesceExpression(List<Expression> expressions) implements ValueExpression {

    public CoalesceExpression {
        expressions = List.copyOf(expressions);
        if (expressions.size() < 2) {
            throw new IllegalArgumentException("COALESCE requires at least two arguments");
        }
    }
}

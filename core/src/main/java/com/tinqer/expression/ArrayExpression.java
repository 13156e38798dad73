package com.tinqer.expression;

import java.util.List;

public record ArrayExpression(List<Expression> elements) implements Expression {

    public ArrayExpression {
        elements = List.copyOf(elements);
    }
}

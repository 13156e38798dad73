package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

public record AnyOperation(QueryOperation source, BooleanExpression predicate) implements TerminalOperation {

    public AnyOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "any";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new AnyOperation(newSource, predicate);
    }
}

package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

public record AllOperation(QueryOperation source, BooleanExpression predicate) implements TerminalOperation {

    public AllOperation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(predicate, "all() requires a predicate");
    }

    @Override
    public String operationType() {
        return "all";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new AllOperation(newSource, predicate);
    }
}

package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record AverageOperation(QueryOperation source, ValueExpression selector) implements TerminalOperation {

    public AverageOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "average";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new AverageOperation(newSource, selector);
    }
}

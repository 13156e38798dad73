package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record MaxOperation(QueryOperation source, ValueExpression selector) implements TerminalOperation {

    public MaxOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "max";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new MaxOperation(newSource, selector);
    }
}

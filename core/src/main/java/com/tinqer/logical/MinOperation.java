package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record MinOperation(QueryOperation source, ValueExpression selector) implements TerminalOperation {

    public MinOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "min";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new MinOperation(newSource, selector);
    }
}

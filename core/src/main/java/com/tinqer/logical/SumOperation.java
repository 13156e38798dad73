package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record SumOperation(QueryOperation source, ValueExpression selector) implements TerminalOperation {

    public SumOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "sum";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new SumOperation(newSource, selector);
    }
}

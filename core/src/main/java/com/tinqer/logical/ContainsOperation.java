package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record ContainsOperation(QueryOperation source, ValueExpression value) implements TerminalOperation {

    public ContainsOperation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String operationType() {
        return "contains";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new ContainsOperation(newSource, value);
    }
}

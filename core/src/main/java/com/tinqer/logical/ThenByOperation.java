package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record ThenByOperation(QueryOperation source, ValueExpression keySelector, boolean descending) implements QueryOperation {

    public ThenByOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "thenBy";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new ThenByOperation(newSource, keySelector, descending);
    }
}

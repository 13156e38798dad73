package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

public record OrderByOperation(QueryOperation source, ValueExpression keySelector, boolean descending) implements QueryOperation {

    public OrderByOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "orderBy";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new OrderByOperation(newSource, keySelector, descending);
    }
}

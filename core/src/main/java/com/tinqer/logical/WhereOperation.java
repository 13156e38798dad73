package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

public record WhereOperation(QueryOperation source, BooleanExpression predicate) implements QueryOperation {

    public WhereOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "where";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new WhereOperation(newSource, predicate);
    }
}

package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

/**
 * {@code single} / {@code singleOrDefault}, with an optional predicate.
 */
public record SingleOperation(QueryOperation source, BooleanExpression predicate, boolean orDefault)
    implements TerminalOperation {

    public SingleOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return orDefault ? "singleOrDefault" : "single";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new SingleOperation(newSource, predicate, orDefault);
    }
}

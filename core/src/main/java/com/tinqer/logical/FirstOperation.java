package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

/**
 * {@code first} / {@code firstOrDefault}, with an optional predicate.
 */
public record FirstOperation(QueryOperation source, BooleanExpression predicate, boolean orDefault)
    implements TerminalOperation {

    public FirstOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return orDefault ? "firstOrDefault" : "first";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new FirstOperation(newSource, predicate, orDefault);
    }
}

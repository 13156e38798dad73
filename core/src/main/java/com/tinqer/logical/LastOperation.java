package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

/**
 * {@code last} / {@code lastOrDefault}, with an optional predicate.
 */
public record LastOperation(QueryOperation source, BooleanExpression predicate, boolean orDefault)
    implements TerminalOperation {

    public LastOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return orDefault ? "lastOrDefault" : "last";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new LastOperation(newSource, predicate, orDefault);
    }
}

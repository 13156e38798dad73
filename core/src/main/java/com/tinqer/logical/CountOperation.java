package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

/**
 * {@code count} / {@code longCount}, with an optional predicate.
 */
public record CountOperation(QueryOperation source, BooleanExpression predicate, boolean longCount)
    implements TerminalOperation {

    public CountOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return longCount ? "longCount" : "count";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new CountOperation(newSource, predicate, longCount);
    }
}

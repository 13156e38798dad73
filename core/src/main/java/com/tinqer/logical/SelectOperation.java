package com.tinqer.logical;

import com.tinqer.expression.Expression;

import java.util.Objects;

/**
 * Projection. A null selector selects every column.
 */
public record SelectOperation(QueryOperation source, Expression selector) implements QueryOperation {

    public SelectOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "select";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new SelectOperation(newSource, selector);
    }
}

package com.tinqer.logical;

import java.util.Objects;

/**
 * Marks a collection whose empty result yields one row of nulls. Join
 * normalization turns it into a LEFT OUTER JOIN.
 */
public record DefaultIfEmptyOperation(QueryOperation source) implements QueryOperation {

    public DefaultIfEmptyOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "defaultIfEmpty";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new DefaultIfEmptyOperation(newSource);
    }
}

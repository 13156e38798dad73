package com.tinqer.logical;

import java.util.Objects;

public record DistinctOperation(QueryOperation source) implements QueryOperation {

    public DistinctOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "distinct";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new DistinctOperation(newSource);
    }
}

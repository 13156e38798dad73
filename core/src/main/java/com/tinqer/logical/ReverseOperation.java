package com.tinqer.logical;

import java.util.Objects;

public record ReverseOperation(QueryOperation source) implements QueryOperation {

    public ReverseOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "reverse";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new ReverseOperation(newSource);
    }
}

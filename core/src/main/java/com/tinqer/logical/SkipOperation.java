package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

/**
 * OFFSET. The count is usually an auto-parameter.
 */
public record SkipOperation(QueryOperation source, ValueExpression count) implements QueryOperation {

    public SkipOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "skip";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new SkipOperation(newSource, count);
    }
}

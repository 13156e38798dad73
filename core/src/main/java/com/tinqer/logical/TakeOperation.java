package com.tinqer.logical;

import com.tinqer.expression.ValueExpression;

import java.util.Objects;

/**
 * LIMIT. The count is usually an auto-parameter.
 */
public record TakeOperation(QueryOperation source, ValueExpression count) implements QueryOperation {

    public TakeOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "take";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new TakeOperation(newSource, count);
    }
}

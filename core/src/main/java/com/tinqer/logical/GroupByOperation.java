package com.tinqer.logical;

import com.tinqer.expression.Expression;

import java.util.Objects;

/**
 * GROUP BY. The key is a single value or an object of values.
 */
public record GroupByOperation(QueryOperation source, Expression keySelector) implements QueryOperation {

    public GroupByOperation {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String operationType() {
        return "groupBy";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new GroupByOperation(newSource, keySelector);
    }
}

package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;

import java.util.Objects;

/**
 * DELETE statement root.
 */
public record DeleteOperation(String table,
                              String schema,
                              BooleanExpression predicate,
                              boolean allowFullTableDelete) implements QueryOperation {

    public DeleteOperation {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static DeleteOperation from(String schema, String table) {
        return new DeleteOperation(table, schema, null, false);
    }

    public DeleteOperation withPredicate(BooleanExpression newPredicate) {
        return new DeleteOperation(table, schema, newPredicate, allowFullTableDelete);
    }

    public DeleteOperation withAllowFullTableDelete() {
        return new DeleteOperation(table, schema, predicate, true);
    }

    @Override
    public String operationType() {
        return "delete";
    }

    @Override
    public QueryOperation source() {
        return null;
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return this;
    }
}

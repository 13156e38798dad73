package com.tinqer.logical;

import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;

import java.util.Objects;

/**
 * UPDATE statement root.
 */
public record UpdateOperation(String table,
                              String schema,
                              ObjectExpression assignments,
                              BooleanExpression predicate,
                              boolean allowFullTableUpdate,
                              Expression returning) implements QueryOperation {

    public UpdateOperation {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static UpdateOperation of(String schema, String table) {
        return new UpdateOperation(table, schema, null, null, false, null);
    }

    public UpdateOperation withAssignments(ObjectExpression newAssignments) {
        return new UpdateOperation(table, schema, newAssignments, predicate, allowFullTableUpdate, returning);
    }

    public UpdateOperation withPredicate(BooleanExpression newPredicate) {
        return new UpdateOperation(table, schema, assignments, newPredicate, allowFullTableUpdate, returning);
    }

    public UpdateOperation withAllowFullTableUpdate() {
        return new UpdateOperation(table, schema, assignments, predicate, true, returning);
    }

    public UpdateOperation withReturning(Expression newReturning) {
        return new UpdateOperation(table, schema, assignments, predicate, allowFullTableUpdate, newReturning);
    }

    @Override
    public String operationType() {
        return "update";
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

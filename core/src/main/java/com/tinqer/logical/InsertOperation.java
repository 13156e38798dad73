package com.tinqer.logical;

import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;

import java.util.Objects;

/**
 * INSERT statement root.
 *
 * @param table target table
 * @param schema optional schema qualifier
 * @param values column to value, null until {@code values()} is called
 * @param onConflict optional upsert clause
 * @param returning optional RETURNING projection
 */
public record InsertOperation(String table,
                              String schema,
                              ObjectExpression values,
                              OnConflict onConflict,
                              Expression returning) implements QueryOperation {

    public InsertOperation {
        Objects.requireNonNull(table, "table must not be null");
    }

    public static InsertOperation into(String schema, String table) {
        return new InsertOperation(table, schema, null, null, null);
    }

    public InsertOperation withValues(ObjectExpression newValues) {
        return new InsertOperation(table, schema, newValues, onConflict, returning);
    }

    public InsertOperation withOnConflict(OnConflict newOnConflict) {
        return new InsertOperation(table, schema, values, newOnConflict, returning);
    }

    public InsertOperation withReturning(Expression newReturning) {
        return new InsertOperation(table, schema, values, onConflict, newReturning);
    }

    @Override
    public String operationType() {
        return "insert";
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

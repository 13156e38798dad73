package com.tinqer.expression;

import java.util.Objects;

/**
 * A column used directly as a predicate, e.g. {@code where(u => u.isActive)}.
 */
public record BooleanColumnExpression(ColumnExpression column) implements BooleanExpression {

    public BooleanColumnExpression {
        Objects.requireNonNull(column, "column must not be null");
    }
}

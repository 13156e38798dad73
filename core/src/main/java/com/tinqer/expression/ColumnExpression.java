package com.tinqer.expression;

import java.util.Objects;

/**
 * Column reference.
 *
 * @param name the physical column name
 * @param source where the column comes from
 * @param table explicit table name or alias, may be null
 */
public record ColumnExpression(String name, ColumnSource source, String table) implements ValueExpression {

    public ColumnExpression {
        Objects.requireNonNull(name, "name must not be null");
        source = source != null ? source : ColumnSource.DIRECT;
    }

    public static ColumnExpression of(String name) {
        return new ColumnExpression(name, ColumnSource.DIRECT, null);
    }

    public static ColumnExpression of(String name, ColumnSource source) {
        return new ColumnExpression(name, source, null);
    }

    @Override
    public String toString() {
        return "column(" + (table != null ? table + "." : "") + name + ")";
    }
}

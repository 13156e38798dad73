package com.tinqer.expression;

/**
 * Whole-row reference to one table of a join, rendered {@code "alias".*}.
 */
public record ReferenceExpression(ColumnSource source, String table) implements ValueExpression {

    public ReferenceExpression {
        source = source != null ? source : ColumnSource.DIRECT;
    }
}

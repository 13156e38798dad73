package com.tinqer.expression;

/**
 * {@code *}, e.g. from {@code select(u => u)} or a spread of the row.
 */
public record AllColumnsExpression() implements ValueExpression {

    public static final AllColumnsExpression INSTANCE = new AllColumnsExpression();
}

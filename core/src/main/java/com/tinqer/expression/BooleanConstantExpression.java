package com.tinqer.expression;

public record BooleanConstantExpression(boolean value) implements BooleanExpression {

    public static final BooleanConstantExpression TRUE = new BooleanConstantExpression(true);
    public static final BooleanConstantExpression FALSE = new BooleanConstantExpression(false);
}

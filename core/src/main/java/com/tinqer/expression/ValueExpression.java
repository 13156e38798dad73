package com.tinqer.expression;

/**
 * Expression producing a scalar value.
 */
public sealed interface ValueExpression extends Expression
    permits ColumnExpression, ExcludedColumnExpression, ConstantExpression, ParameterExpression,
            ArithmeticExpression, ConcatExpression, StringMethodExpression, CaseExpression,
            CoalesceExpression, AggregateExpression, WindowFunctionExpression,
            ReferenceExpression, AllColumnsExpression {
}

package com.tinqer.expression;

/**
 * Expression producing a truth value, used for predicates.
 */
public sealed interface BooleanExpression extends Expression
    permits ComparisonExpression, LogicalExpression, NotExpression, BooleanColumnExpression,
            BooleanConstantExpression, BooleanParameterExpression, BooleanMethodExpression,
            CaseInsensitiveFunctionExpression, InExpression, IsNullExpression {
}

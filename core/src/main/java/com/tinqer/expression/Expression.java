package com.tinqer.expression;

/**
 * Base of the expression IR: the scalar, boolean and structural
 * sub-expressions found inside query operations.
 *
 * <p>All implementations are immutable records, so trees may be shared freely
 * between plan states. A node's type fully determines which fields are set.
 *
 * @see ExpressionRewriter
 */
public sealed interface Expression
    permits ValueExpression, BooleanExpression, ObjectExpression, ArrayExpression {
}

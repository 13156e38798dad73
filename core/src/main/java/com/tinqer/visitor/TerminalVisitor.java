package com.tinqer.visitor;

import com.tinqer.ast.CallNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.AllOperation;
import com.tinqer.logical.AnyOperation;
import com.tinqer.logical.AverageOperation;
import com.tinqer.logical.ContainsOperation;
import com.tinqer.logical.CountOperation;
import com.tinqer.logical.FirstOperation;
import com.tinqer.logical.LastOperation;
import com.tinqer.logical.MaxOperation;
import com.tinqer.logical.MinOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.SelectOperation;
import com.tinqer.logical.SingleOperation;
import com.tinqer.logical.SumOperation;

/**
 * Visits terminal operations. Predicates are optional except for
 * {@code all}; aggregate selectors are optional when the chain already
 * projects a single value.
 */
class TerminalVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    TerminalVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    QueryOperation visit(QueryMethod method, QueryOperation source, CallNode call) {
        return switch (method) {
            case FIRST -> new FirstOperation(source, optionalPredicate(call), false);
            case FIRST_OR_DEFAULT -> new FirstOperation(source, optionalPredicate(call), true);
            case SINGLE -> new SingleOperation(source, optionalPredicate(call), false);
            case SINGLE_OR_DEFAULT -> new SingleOperation(source, optionalPredicate(call), true);
            case LAST -> new LastOperation(source, optionalPredicate(call), false);
            case LAST_OR_DEFAULT -> new LastOperation(source, optionalPredicate(call), true);
            case ANY -> new AnyOperation(source, optionalPredicate(call));
            case ALL -> {
                if (call.arguments().isEmpty()) {
                    throw new ParseStructureException("all() requires a predicate", ctx.errorContext());
                }
                yield new AllOperation(source, optionalPredicate(call));
            }
            case COUNT -> new CountOperation(source, optionalPredicate(call), false);
            case LONG_COUNT -> new CountOperation(source, optionalPredicate(call), true);
            case CONTAINS -> visitContains(source, call);
            case SUM -> new SumOperation(source, optionalSelector(call));
            case AVERAGE, AVG -> new AverageOperation(source, optionalSelector(call));
            case MIN -> new MinOperation(source, optionalSelector(call));
            case MAX -> new MaxOperation(source, optionalSelector(call));
            default -> throw new IllegalStateException("Not a terminal method: " + method);
        };
    }

    private BooleanExpression optionalPredicate(CallNode call) {
        if (call.arguments().isEmpty()) {
            return null;
        }
        return expressions.visitRowLambda(call.argument(0), call.methodName() + "()", expressions::visitBoolean);
    }

    private ValueExpression optionalSelector(CallNode call) {
        if (call.arguments().isEmpty()) {
            return null;
        }
        return expressions.visitRowLambda(call.argument(0), call.methodName() + "()", expressions::visitValue);
    }

    private QueryOperation visitContains(QueryOperation source, CallNode call) {
        if (call.arguments().size() != 1) {
            throw new ParseStructureException("contains() requires exactly one value", ctx.errorContext());
        }
        ColumnExpression related = source instanceof SelectOperation select
            && select.selector() instanceof ColumnExpression column ? column : null;
        return new ContainsOperation(source, expressions.visitValue(call.argument(0), related));
    }
}

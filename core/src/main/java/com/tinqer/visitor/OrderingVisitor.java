package com.tinqer.visitor;

import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.DistinctOperation;
import com.tinqer.logical.OrderByOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.ReverseOperation;
import com.tinqer.logical.SkipOperation;
import com.tinqer.logical.TakeOperation;
import com.tinqer.logical.ThenByOperation;

/**
 * Visits ordering and paging: {@code orderBy}, {@code thenBy} and their
 * descending forms, {@code reverse}, {@code distinct}, {@code take} and
 * {@code skip}.
 */
class OrderingVisitor {

    static final String LIMIT_FIELD = "LIMIT";
    static final String OFFSET_FIELD = "OFFSET";

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    OrderingVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    QueryOperation visitOrderBy(QueryOperation source, CallNode call, boolean descending) {
        return new OrderByOperation(source, keySelector(call), descending);
    }

    QueryOperation visitThenBy(QueryOperation source, CallNode call, boolean descending) {
        if (!(source instanceof OrderByOperation) && !(source instanceof ThenByOperation)) {
            throw new ParseStructureException(
                call.methodName() + "() must follow orderBy() or another thenBy()", ctx.errorContext());
        }
        return new ThenByOperation(source, keySelector(call), descending);
    }

    QueryOperation visitDistinct(QueryOperation source) {
        return new DistinctOperation(source);
    }

    QueryOperation visitReverse(QueryOperation source) {
        return new ReverseOperation(source);
    }

    QueryOperation visitTake(QueryOperation source, CallNode call) {
        return new TakeOperation(source, count(call, LIMIT_FIELD));
    }

    QueryOperation visitSkip(QueryOperation source, CallNode call) {
        return new SkipOperation(source, count(call, OFFSET_FIELD));
    }

    private ValueExpression keySelector(CallNode call) {
        String label = call.methodName() + "()";
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException(label + " requires a key selector", ctx.errorContext());
        }
        return expressions.visitRowLambda(call.argument(0), label, expressions::visitValue);
    }

    private ValueExpression count(CallNode call, String field) {
        String label = call.methodName() + "()";
        if (call.arguments().size() != 1) {
            throw new ParseStructureException(label + " requires exactly one argument", ctx.errorContext());
        }
        AstNode argument = call.argument(0);
        if (argument instanceof LiteralNode literal) {
            if (!(literal.value() instanceof Number number) || number.doubleValue() < 0) {
                throw new ParseStructureException(
                    label + " requires a non-negative number, got " + literal.value(), ctx.errorContext());
            }
            return ctx.createAutoParam(number, field, null);
        }
        return expressions.visitValue(argument);
    }
}

package com.tinqer.visitor;

import com.tinqer.ast.CallNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.Expression;
import com.tinqer.logical.GroupByOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.SelectOperation;

/**
 * Visits {@code select} and {@code groupBy}.
 *
 * <p>A projection ends the current row scope: after {@code select} later
 * lambdas see the projected columns, so the join shape and group key are
 * cleared. {@code groupBy} installs the key that {@code g.key} resolves to.
 */
class ProjectionVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    ProjectionVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    QueryOperation visitSelect(QueryOperation source, CallNode call) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("select() requires a selector", ctx.errorContext());
        }
        Expression selector = expressions.visitRowLambda(call.argument(0), "select()", expressions::visitExpression);
        ctx.setCurrentResultShape(null);
        ctx.setGroupKey(null);
        return new SelectOperation(source, selector);
    }

    QueryOperation visitGroupBy(QueryOperation source, CallNode call) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("groupBy() requires a key selector", ctx.errorContext());
        }
        if (ctx.getGroupKey() != null) {
            throw new ParseStructureException("groupBy() cannot be applied to a grouping", ctx.errorContext());
        }
        Expression key = expressions.visitRowLambda(call.argument(0), "groupBy()", expressions::visitExpression);
        ctx.setGroupKey(key);
        return new GroupByOperation(source, key);
    }
}

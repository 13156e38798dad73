package com.tinqer.visitor;

import com.tinqer.ast.CallNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.LogicalExpression;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.UpdateOperation;
import com.tinqer.logical.WhereOperation;

/**
 * Visits {@code where}. On a SELECT chain every call adds a WHERE
 * operation; on UPDATE and DELETE successive calls are AND-ed into the
 * statement predicate.
 */
class WhereVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    WhereVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    QueryOperation visit(QueryOperation source, CallNode call) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("where() requires a predicate", ctx.errorContext());
        }
        if (source instanceof UpdateOperation update) {
            if (update.allowFullTableUpdate()) {
                throw new ParseStructureException(
                    "Cannot call where() after allowFullTableUpdate()", ctx.errorContext());
            }
            return update.withPredicate(and(update.predicate(), predicate(call)));
        }
        if (source instanceof DeleteOperation delete) {
            if (delete.allowFullTableDelete()) {
                throw new ParseStructureException(
                    "Cannot call where() after allowFullTableDelete()", ctx.errorContext());
            }
            return delete.withPredicate(and(delete.predicate(), predicate(call)));
        }
        if (source instanceof InsertOperation) {
            throw new ParseStructureException("where() cannot be used on INSERT statements", ctx.errorContext());
        }
        return new WhereOperation(source, predicate(call));
    }

    private BooleanExpression predicate(CallNode call) {
        return expressions.visitRowLambda(call.argument(0), "where()", expressions::visitBoolean);
    }

    private static BooleanExpression and(BooleanExpression existing, BooleanExpression added) {
        return existing == null ? added : LogicalExpression.and(existing, added);
    }
}

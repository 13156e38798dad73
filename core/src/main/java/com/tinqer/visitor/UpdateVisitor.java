package com.tinqer.visitor;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.ObjectNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.logical.UpdateOperation;

/**
 * Visits the UPDATE builder methods: {@code set},
 * {@code allowFullTableUpdate} and {@code returning}. {@code where} is
 * handled by {@link WhereVisitor}.
 */
class UpdateVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    UpdateVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    UpdateOperation visitSet(UpdateOperation source, CallNode call) {
        if (source.assignments() != null && !source.assignments().properties().isEmpty()) {
            throw new ParseStructureException("set() can only be called once per UPDATE query", ctx.errorContext());
        }
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException(
                "set() must be an object literal or a lambda returning an object literal", ctx.errorContext());
        }

        AstNode argument = call.argument(0);
        ObjectExpression assignments;
        if (argument instanceof ObjectNode object) {
            assignments = expressions.visitAssignments(object, "set()");
        } else if (argument instanceof ArrowFunctionNode lambda) {
            if (lambda.param(0) == null) {
                throw new ParseStructureException("set() lambda must have a parameter", ctx.errorContext());
            }
            assignments = expressions.visitRowLambda(lambda, "set()", body -> {
                if (!(body instanceof ObjectNode object)) {
                    throw new ParseStructureException("set() lambda must return an object literal", ctx.errorContext());
                }
                return expressions.visitAssignments(object, "set()");
            });
        } else {
            throw new ParseStructureException(
                "set() must be an object literal or a lambda returning an object literal", ctx.errorContext());
        }

        if (assignments.properties().isEmpty()) {
            throw new ParseStructureException("set() must specify at least one column assignment", ctx.errorContext());
        }
        return source.withAssignments(assignments);
    }

    UpdateOperation visitAllowFullTableUpdate(UpdateOperation source) {
        if (source.predicate() != null) {
            throw new ParseStructureException(
                "Cannot call allowFullTableUpdate() after where()", ctx.errorContext());
        }
        return source.withAllowFullTableUpdate();
    }

    UpdateOperation visitReturning(UpdateOperation source, CallNode call) {
        return source.withReturning(InsertVisitor.returning(call, ctx, expressions));
    }
}

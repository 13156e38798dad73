package com.tinqer.visitor;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.ObjectNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.OnConflict;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Visits the INSERT builder methods: {@code values}, {@code onConflict},
 * {@code doNothing}, {@code doUpdateSet} and {@code returning}.
 */
class InsertVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;

    InsertVisitor(ExpressionVisitor expressions) {
        this.expressions = expressions;
        this.ctx = expressions.context();
    }

    InsertOperation visitValues(InsertOperation source, CallNode call) {
        if (source.values() != null) {
            throw new ParseStructureException("values() can only be called once per INSERT", ctx.errorContext());
        }
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("values() requires an object literal", ctx.errorContext());
        }
        AstNode argument = call.argument(0);
        ObjectNode object;
        if (argument instanceof ObjectNode node) {
            object = node;
        } else if (argument instanceof ArrowFunctionNode lambda
            && expressions.lambdaBody(lambda, "values()") instanceof ObjectNode node) {
            object = node;
        } else {
            throw new ParseStructureException("values() requires an object literal", ctx.errorContext());
        }
        return source.withValues(expressions.visitAssignments(object, "values()"));
    }

    InsertOperation visitOnConflict(InsertOperation source, CallNode call) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("onConflict() requires at least one column selector", ctx.errorContext());
        }
        if (source.onConflict() != null) {
            throw new ParseStructureException("onConflict() can only be called once per INSERT", ctx.errorContext());
        }
        List<String> columns = new ArrayList<>();
        for (AstNode argument : call.arguments()) {
            if (!(argument instanceof ArrowFunctionNode)) {
                throw new ParseStructureException("onConflict() requires lambda expressions", ctx.errorContext());
            }
            ValueExpression target = expressions.visitRowLambda(argument, "onConflict()", expressions::visitValue);
            if (!(target instanceof ColumnExpression column)) {
                throw new ParseStructureException(
                    "onConflict() selectors must return a column reference", ctx.errorContext());
            }
            if (column.table() != null || !(column.source() instanceof ColumnSource.Direct)) {
                throw new ParseStructureException(
                    "onConflict() selectors must be direct column access (e.g. row.id)", ctx.errorContext());
            }
            columns.add(column.name());
        }
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new ParseStructureException("onConflict() cannot include duplicate columns", ctx.errorContext());
        }
        return source.withOnConflict(new OnConflict(columns, null));
    }

    InsertOperation visitDoNothing(InsertOperation source) {
        OnConflict onConflict = requireOpenConflict(source, "doNothing()");
        return source.withOnConflict(onConflict.withAction(OnConflict.DoNothing.INSTANCE));
    }

    InsertOperation visitDoUpdateSet(InsertOperation source, CallNode call) {
        OnConflict onConflict = requireOpenConflict(source, "doUpdateSet()");
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("doUpdateSet() requires an object or lambda", ctx.errorContext());
        }

        AstNode argument = call.argument(0);
        ObjectExpression assignments;
        if (argument instanceof ObjectNode object) {
            assignments = expressions.visitAssignments(object, "doUpdateSet()");
        } else if (argument instanceof ArrowFunctionNode lambda) {
            assignments = visitUpsertLambda(lambda);
        } else {
            throw new ParseStructureException(
                "doUpdateSet() requires an object literal or lambda expression", ctx.errorContext());
        }
        if (assignments.properties().isEmpty()) {
            throw new ParseStructureException(
                "doUpdateSet() must specify at least one column assignment", ctx.errorContext());
        }
        return source.withOnConflict(onConflict.withAction(new OnConflict.DoUpdate(assignments)));
    }

    /**
     * Visits {@code (row, excluded) => ({ ... })}; {@code excluded.col} refers
     * to the value proposed for insertion.
     */
    private ObjectExpression visitUpsertLambda(ArrowFunctionNode lambda) {
        String row = lambda.param(0);
        String excluded = lambda.param(1);
        String params = lambda.param(2);
        if (row == null) {
            throw new ParseStructureException(
                "doUpdateSet() lambda must have at least one parameter", ctx.errorContext());
        }
        AstNode body = expressions.lambdaBody(lambda, "doUpdateSet()");
        if (!(body instanceof ObjectNode object)) {
            throw new ParseStructureException("doUpdateSet() must return an object literal", ctx.errorContext());
        }
        boolean addedParams = params != null && !ctx.isQueryParam(params);
        ctx.addTableParam(row);
        ctx.setUpsertExcludedParam(excluded);
        if (addedParams) {
            ctx.addQueryParam(params);
        }
        try {
            return expressions.visitAssignments(object, "doUpdateSet()");
        } finally {
            ctx.removeTableParam(row);
            ctx.setUpsertExcludedParam(null);
            if (addedParams) {
                ctx.removeQueryParam(params);
            }
        }
    }

    private OnConflict requireOpenConflict(InsertOperation source, String method) {
        if (source.onConflict() == null) {
            throw new ParseStructureException(method + " must be called after onConflict()", ctx.errorContext());
        }
        if (source.onConflict().action() != null) {
            throw new ParseStructureException(
                method + " cannot be used after an upsert action is already set", ctx.errorContext());
        }
        return source.onConflict();
    }

    InsertOperation visitReturning(InsertOperation source, CallNode call) {
        return source.withReturning(returning(call, ctx, expressions));
    }

    /**
     * Visits the projection of {@code returning()}, shared with UPDATE.
     */
    static Expression returning(CallNode call, VisitorContext ctx, ExpressionVisitor expressions) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("returning() requires a selector", ctx.errorContext());
        }
        return expressions.visitRowLambda(call.argument(0), "returning()", expressions::visitExpression);
    }
}

package com.tinqer.visitor;

import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.logical.FromOperation;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.UpdateOperation;

/**
 * Visits the root of a chain: {@code from}, {@code insertInto},
 * {@code update} or {@code deleteFrom}, each taking {@code ("table")} or
 * {@code ("schema", "table")}.
 */
class FromVisitor {

    private final VisitorContext ctx;

    FromVisitor(ExpressionVisitor expressions) {
        this.ctx = expressions.context();
    }

    QueryOperation visit(QueryMethod method, CallNode call) {
        String schema = null;
        String table;
        if (call.arguments().size() == 1) {
            table = stringArgument(call.argument(0), method);
        } else if (call.arguments().size() == 2) {
            schema = stringArgument(call.argument(0), method);
            table = stringArgument(call.argument(1), method);
        } else {
            throw new ParseStructureException(
                method.sourceName() + "() expects a table name or a schema and a table name", ctx.errorContext());
        }

        ctx.setCurrentTable(table);
        ctx.setCurrentResultShape(null);
        ctx.setGroupKey(null);

        return switch (method) {
            case FROM -> {
                ctx.setStatementKind("select");
                yield new FromOperation(table, schema, null, null);
            }
            case INSERT_INTO -> {
                ctx.setStatementKind("insert");
                yield InsertOperation.into(schema, table);
            }
            case UPDATE -> {
                ctx.setStatementKind("update");
                yield UpdateOperation.of(schema, table);
            }
            case DELETE_FROM -> {
                ctx.setStatementKind("delete");
                yield DeleteOperation.from(schema, table);
            }
            default -> throw new IllegalStateException("Not a root method: " + method);
        };
    }

    private String stringArgument(AstNode node, QueryMethod method) {
        if (node instanceof LiteralNode literal && literal.value() instanceof String value) {
            if (value.isEmpty()) {
                throw new ParseStructureException(
                    method.sourceName() + "() table name must not be empty", ctx.errorContext());
            }
            return value;
        }
        throw new ParseStructureException(
            method.sourceName() + "() requires string literal table names", ctx.errorContext());
    }
}

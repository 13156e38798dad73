package com.tinqer.visitor;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.IdentifierNode;
import com.tinqer.ast.MemberNode;
import com.tinqer.ast.ObjectNode;
import com.tinqer.ast.PropertyNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.DefaultIfEmptyOperation;
import com.tinqer.logical.GroupJoinOperation;
import com.tinqer.logical.JoinOperation;
import com.tinqer.logical.JoinType;
import com.tinqer.logical.Operations;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.ResultShape;
import com.tinqer.logical.SelectManyOperation;
import com.tinqer.logical.ShapeNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Visits {@code join}, {@code groupJoin}, {@code selectMany} and
 * {@code defaultIfEmpty}.
 *
 * <p>Tables are numbered in join order: the root is 0 and every join adds
 * the next index. Result selectors see the outer side as table 0 (or as the
 * accumulated join result) and the inner side under its new index; the
 * resulting {@link ResultShape} lets later lambdas resolve
 * {@code joined.u.name} back to the table it came from.
 */
class JoinVisitor {

    private final ExpressionVisitor expressions;
    private final VisitorContext ctx;
    private final QueryChainVisitor chains;

    JoinVisitor(ExpressionVisitor expressions, QueryChainVisitor chains) {
        this.expressions = expressions;
        this.ctx = expressions.context();
        this.chains = chains;
    }

    // ==================== join ====================

    QueryOperation visitJoin(QueryOperation source, CallNode call) {
        requireArguments(call, 4, "join(inner, outerKey, innerKey, resultSelector)");
        int innerIndex = Operations.tableCount(source);

        QueryOperation inner = visitSubChain(call.argument(0));
        ColumnExpression outerKey = outerKey(call.argument(1));
        ColumnExpression innerKey = innerKey(call.argument(2));

        ObjectExpression selector = resultSelector(call.argument(3), innerIndex, "join()");
        ResultShape shape = ShapeBuilder.fromSelector(selector, ctx.errorContext());

        ctx.setCurrentResultShape(shape);
        ctx.setGroupKey(null);
        return new JoinOperation(source, inner, outerKey.name(), innerKey.name(), tableIndex(outerKey),
            selector, shape, JoinType.INNER);
    }

    // ==================== groupJoin ====================

    QueryOperation visitGroupJoin(QueryOperation source, CallNode call) {
        requireArguments(call, 4, "groupJoin(inner, outerKey, innerKey, resultSelector)");
        int innerIndex = Operations.tableCount(source);

        QueryOperation inner = visitSubChain(call.argument(0));
        ColumnExpression outerKey = outerKey(call.argument(1));
        ColumnExpression innerKey = innerKey(call.argument(2));

        ArrowFunctionNode lambda = expressions.requireLambda(call.argument(3), "groupJoin()");
        String groupParam = lambda.param(1);
        AstNode body = expressions.lambdaBody(lambda, "groupJoin()");
        if (!(body instanceof ObjectNode object) || groupParam == null) {
            throw new ParseStructureException(
                "groupJoin() result selector must return an object literal of (outer, group)", ctx.errorContext());
        }

        Map<String, Expression> properties = new LinkedHashMap<>();
        Map<String, ShapeNode> fields = new LinkedHashMap<>();
        String groupProperty = withResultBindings(lambda.param(0), groupParam, innerIndex, () -> {
            String found = null;
            for (AstNode member : object.members()) {
                if (member instanceof PropertyNode property
                    && property.value() instanceof IdentifierNode id && id.name().equals(groupParam)) {
                    found = property.key();
                    properties.put(property.key(), expressions.visitValue(id));
                    fields.put(property.key(), new ShapeNode.Array(new ShapeNode.Reference(innerIndex)));
                } else {
                    ObjectExpression visited = expressions.visitObject(new ObjectNode(List.of(member)));
                    visited.properties().forEach((key, value) -> {
                        properties.put(key, value);
                        fields.put(key, ShapeBuilder.toShapeNode(key, value, ctx.errorContext()));
                    });
                }
            }
            return found;
        });
        if (groupProperty == null) {
            throw new ParseStructureException(
                "groupJoin() result selector must expose the group parameter '" + groupParam + "'",
                ctx.errorContext());
        }

        ResultShape shape = new ResultShape(fields);
        ctx.setCurrentResultShape(shape);
        ctx.setGroupKey(null);
        return new GroupJoinOperation(source, inner, outerKey.name(), innerKey.name(), tableIndex(outerKey),
            new ObjectExpression(properties), shape, groupProperty);
    }

    // ==================== selectMany ====================

    QueryOperation visitSelectMany(QueryOperation source, CallNode call) {
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException("selectMany() requires a collection selector", ctx.errorContext());
        }
        if (call.arguments().size() < 2) {
            throw new ParseStructureException(
                "selectMany() requires a result selector (outer, item) => ({ ... })", ctx.errorContext());
        }
        ArrowFunctionNode collectionLambda = expressions.requireLambda(call.argument(0), "selectMany()");
        AstNode collectionBody = expressions.lambdaBody(collectionLambda, "selectMany()");

        QueryOperation collection;
        int itemIndex;
        if (source instanceof GroupJoinOperation groupJoin) {
            collection = groupCollection(groupJoin, collectionLambda.param(0), collectionBody);
            itemIndex = Operations.tableCount(groupJoin.source());
        } else {
            collection = visitSubChain(collectionBody);
            itemIndex = Operations.tableCount(source);
        }

        ObjectExpression selector = resultSelector(call.argument(1), itemIndex, "selectMany()");
        ResultShape shape = ShapeBuilder.fromSelector(selector, ctx.errorContext());

        ctx.setCurrentResultShape(shape);
        ctx.setGroupKey(null);
        return new SelectManyOperation(source, collection, selector, shape);
    }

    /**
     * Resolves {@code g => g.orders} or {@code g => g.orders.defaultIfEmpty()}
     * to the inner query of the group join.
     */
    private QueryOperation groupCollection(GroupJoinOperation groupJoin, String param, AstNode body) {
        boolean defaultIfEmpty = false;
        AstNode target = body;
        if (body instanceof CallNode call && "defaultIfEmpty".equals(call.methodName()) && call.receiver() != null) {
            defaultIfEmpty = true;
            target = call.receiver();
        }
        if (!(target instanceof MemberNode member)
            || !(member.object() instanceof IdentifierNode id)
            || !id.name().equals(param)
            || !groupJoin.groupProperty().equals(member.propertyName())) {
            throw new ParseStructureException(
                "selectMany() after groupJoin() must select the group: " + param + "." + groupJoin.groupProperty(),
                ctx.errorContext());
        }
        return defaultIfEmpty ? new DefaultIfEmptyOperation(groupJoin.inner()) : groupJoin.inner();
    }

    // ==================== defaultIfEmpty ====================

    QueryOperation visitDefaultIfEmpty(QueryOperation source) {
        return new DefaultIfEmptyOperation(source);
    }

    // ==================== Helpers ====================

    private void requireArguments(CallNode call, int count, String usage) {
        if (call.arguments().size() != count) {
            throw new ParseStructureException(usage + " expects " + count + " arguments, got "
                + call.arguments().size(), ctx.errorContext());
        }
    }

    /**
     * Visits an independent query used as a join inner. The outer chain's
     * scope is restored afterwards.
     */
    private QueryOperation visitSubChain(AstNode node) {
        String table = ctx.getCurrentTable();
        String statementKind = ctx.getStatementKind();
        ResultShape shape = ctx.getCurrentResultShape();
        Expression groupKey = ctx.getGroupKey();
        String method = ctx.getCurrentMethod();
        try {
            return chains.visitChain(node);
        } finally {
            ctx.setCurrentTable(table);
            ctx.setStatementKind(statementKind);
            ctx.setCurrentResultShape(shape);
            ctx.setGroupKey(groupKey);
            ctx.setCurrentMethod(method);
        }
    }

    private ColumnExpression outerKey(AstNode argument) {
        ValueExpression key = expressions.visitRowLambda(argument, "outer key selector", expressions::visitValue);
        return requireColumn(key, "outer");
    }

    private ColumnExpression innerKey(AstNode argument) {
        ResultShape shape = ctx.getCurrentResultShape();
        Expression groupKey = ctx.getGroupKey();
        ctx.setCurrentResultShape(null);
        ctx.setGroupKey(null);
        try {
            ValueExpression key = expressions.visitRowLambda(argument, "inner key selector", expressions::visitValue);
            return requireColumn(key, "inner");
        } finally {
            ctx.setCurrentResultShape(shape);
            ctx.setGroupKey(groupKey);
        }
    }

    private ColumnExpression requireColumn(ValueExpression key, String side) {
        if (key instanceof ColumnExpression column) {
            return column;
        }
        throw new ParseStructureException(
            "Join " + side + " key selector must return a column, e.g. x => x.id", ctx.errorContext());
    }

    private static Integer tableIndex(ColumnExpression column) {
        ColumnSource source = column.source();
        if (source instanceof ColumnSource.JoinResult joinResult) {
            return joinResult.tableIndex();
        }
        if (source instanceof ColumnSource.Spread spread) {
            return spread.sourceIndex();
        }
        return null;
    }

    private ObjectExpression resultSelector(AstNode argument, int innerIndex, String label) {
        ArrowFunctionNode lambda = expressions.requireLambda(argument, label);
        AstNode body = expressions.lambdaBody(lambda, label);
        Expression selector = withResultBindings(lambda.param(0), lambda.param(1), innerIndex,
            () -> expressions.visitExpression(body));
        if (selector instanceof ObjectExpression object) {
            return object;
        }
        throw new ParseStructureException(
            label + " result selector must return an object literal, e.g. (u, d) => ({ u, d })", ctx.errorContext());
    }

    /**
     * Runs a visit with the outer parameter bound to table 0 (or to the
     * current join result) and the inner parameter bound to {@code innerIndex}.
     */
    private <T> T withResultBindings(String outer, String inner, int innerIndex, Supplier<T> visit) {
        boolean outerIsJoinResult = ctx.getCurrentResultShape() != null;
        if (outer != null) {
            if (outerIsJoinResult) {
                ctx.setJoinResultParam(outer);
            } else {
                ctx.addJoinParam(outer, 0);
            }
        }
        if (inner != null) {
            ctx.addJoinParam(inner, innerIndex);
        }
        try {
            return visit.get();
        } finally {
            if (outer != null) {
                if (outerIsJoinResult) {
                    ctx.setJoinResultParam(null);
                } else {
                    ctx.removeJoinParam(outer);
                }
            }
            if (inner != null) {
                ctx.removeJoinParam(inner);
            }
        }
    }
}

package com.tinqer.visitor;

import com.tinqer.ast.AstNode;
import com.tinqer.ast.IdentifierNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.ast.MemberNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.ExcludedColumnExpression;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.expression.ReferenceExpression;
import com.tinqer.logical.ResultShape;
import com.tinqer.logical.ShapeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves member chains such as {@code u.name}, {@code p.ids[0]},
 * {@code joined.u.name}, {@code g.key} or {@code excluded.email} to IR
 * expressions, according to what the root identifier is bound to.
 */
public class MemberAccessResolver {

    private static final Map<String, Object> NUMBER_CONSTANTS = Map.of(
        "MAX_SAFE_INTEGER", 9007199254740991L,
        "MIN_SAFE_INTEGER", -9007199254740991L,
        "MAX_VALUE", Double.MAX_VALUE,
        "MIN_VALUE", Double.MIN_VALUE,
        "EPSILON", Math.ulp(1.0));

    private final VisitorContext ctx;

    public MemberAccessResolver(VisitorContext ctx) {
        this.ctx = ctx;
    }

    /**
     * One step of a member chain: a property name or a numeric index.
     */
    private record Segment(String name, Integer index) {
        boolean isIndex() {
            return index != null;
        }
    }

    /**
     * Resolves a member chain.
     *
     * @param node the outermost member node
     * @return a value expression, or an {@link ObjectExpression} when the
     *         chain ends at a nested part of a join result
     */
    public Expression resolve(MemberNode node) {
        List<Segment> segments = new ArrayList<>();
        AstNode current = node;
        while (current instanceof MemberNode member) {
            segments.add(0, segment(member));
            current = member.object();
        }
        if (!(current instanceof IdentifierNode root)) {
            throw unsupported(node);
        }

        String name = root.name();
        if (ctx.isQueryParam(name)) {
            return resolveQueryParam(name, segments, node);
        }
        if (ctx.isRowFilterContextParam(name)) {
            if (segments.size() != 1 || segments.get(0).isIndex()) {
                throw new ParseStructureException(
                    "Row filter context parameters must use direct property access (ctx.key).",
                    ctx.errorContext());
            }
            return ParameterExpression.named(ctx.getRowFilterParamPrefix() + segments.get(0).name());
        }
        if (ctx.isUpsertExcludedParam(name)) {
            requireSingleProperty(segments, node);
            return new ExcludedColumnExpression(segments.get(0).name());
        }
        if (ctx.isGroupingParam(name)) {
            return resolveGroupAccess(segments, node);
        }
        if (ctx.isJoinResultParam(name)) {
            return resolveJoinResult(ctx.getCurrentResultShape(), segments, node);
        }
        Integer joinIndex = ctx.getJoinParamIndex(name);
        if (joinIndex != null) {
            requireSingleProperty(segments, node);
            return new ColumnExpression(segments.get(0).name(), ColumnSource.joinParam(joinIndex), null);
        }
        if (ctx.isTableParam(name)) {
            requireSingleProperty(segments, node);
            return ColumnExpression.of(segments.get(0).name());
        }
        if ("Number".equals(name) && segments.size() == 1 && NUMBER_CONSTANTS.containsKey(segments.get(0).name())) {
            return ctx.createAutoParam(NUMBER_CONSTANTS.get(segments.get(0).name()), null, null);
        }
        throw new ParseStructureException("Unknown identifier '" + name + "' in " + node, ctx.errorContext());
    }

    private Segment segment(MemberNode member) {
        String name = member.propertyName();
        if (name != null) {
            return new Segment(name, null);
        }
        if (member.property() instanceof LiteralNode lit && lit.value() instanceof Long index
            && index >= 0 && index <= Integer.MAX_VALUE) {
            return new Segment(null, index.intValue());
        }
        throw new ParseStructureException(
            "Computed member access must use a string or integer literal: " + member, ctx.errorContext());
    }

    private Expression resolveQueryParam(String name, List<Segment> segments, MemberNode node) {
        Segment first = segments.get(0);
        if (first.isIndex()) {
            if (segments.size() > 1) {
                throw unsupported(node);
            }
            return new ParameterExpression(name, null, first.index());
        }
        if (segments.size() == 1) {
            return new ParameterExpression(name, first.name(), null);
        }
        if (segments.size() == 2 && segments.get(1).isIndex()) {
            return new ParameterExpression(name, first.name(), segments.get(1).index());
        }
        throw unsupported(node);
    }

    private Expression resolveGroupAccess(List<Segment> segments, MemberNode node) {
        if (!"key".equals(segments.get(0).name())) {
            throw new ParseStructureException(
                "Only key and aggregate methods are available on a group: " + node, ctx.errorContext());
        }
        Expression key = ctx.getGroupKey();
        if (segments.size() == 1) {
            return key;
        }
        if (segments.size() == 2 && key instanceof ObjectExpression object) {
            Expression property = object.get(segments.get(1).name());
            if (property != null) {
                return property;
            }
        }
        throw new ParseStructureException("Unknown group key property: " + node, ctx.errorContext());
    }

    private Expression resolveJoinResult(ResultShape shape, List<Segment> segments, MemberNode node) {
        ShapeNode current = shape.get(segments.get(0).name());
        if (current == null && segments.size() == 1
            && shape.get(ObjectExpression.SPREAD_KEY) instanceof ShapeNode.Reference spread) {
            return new ColumnExpression(segments.get(0).name(), new ColumnSource.Spread(spread.sourceTable()), null);
        }
        if (current == null) {
            throw new ParseStructureException(
                "Join result has no property '" + segments.get(0).name() + "': " + node, ctx.errorContext());
        }
        for (int i = 1; i < segments.size(); i++) {
            String property = segments.get(i).name();
            if (current instanceof ShapeNode.Nested nested && property != null) {
                current = nested.properties().get(property);
                if (current == null) {
                    throw new ParseStructureException(
                        "Join result has no property '" + property + "': " + node, ctx.errorContext());
                }
            } else if (current instanceof ShapeNode.Reference reference && property != null && i == segments.size() - 1) {
                return new ColumnExpression(property, ColumnSource.joinResult(reference.sourceTable()), null);
            } else {
                throw unsupported(node);
            }
        }
        return shapeToExpression(current, node);
    }

    /**
     * Converts a join result shape node back into the expression it denotes.
     */
    public Expression shapeToExpression(ShapeNode shapeNode, AstNode origin) {
        if (shapeNode instanceof ShapeNode.Column column) {
            return new ColumnExpression(column.columnName(), ColumnSource.joinResult(column.sourceTable()), null);
        }
        if (shapeNode instanceof ShapeNode.Reference reference) {
            return new ReferenceExpression(ColumnSource.joinResult(reference.sourceTable()), null);
        }
        if (shapeNode instanceof ShapeNode.Nested nested) {
            Map<String, Expression> properties = new LinkedHashMap<>();
            nested.properties().forEach((key, value) -> properties.put(key, shapeToExpression(value, origin)));
            return new ObjectExpression(properties);
        }
        throw new ParseStructureException(
            "Collections from a group join can only be flattened with selectMany(): " + origin, ctx.errorContext());
    }

    public ObjectExpression shapeToObject(ResultShape shape, AstNode origin) {
        Map<String, Expression> properties = new LinkedHashMap<>();
        shape.fields().forEach((key, value) -> properties.put(key, shapeToExpression(value, origin)));
        return new ObjectExpression(properties);
    }

    private void requireSingleProperty(List<Segment> segments, MemberNode node) {
        if (segments.size() != 1 || segments.get(0).isIndex()) {
            throw new ParseStructureException(
                "Nested property access is not supported: " + node, ctx.errorContext());
        }
    }

    private ParseStructureException unsupported(AstNode node) {
        return new ParseStructureException("Unsupported member access: " + node, ctx.errorContext());
    }
}

package com.tinqer.visitor;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.AllColumnsExpression;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ReferenceExpression;
import com.tinqer.logical.ResultShape;
import com.tinqer.logical.ShapeNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the {@link ResultShape} of a join or selectMany from the
 * expression its result selector produced.
 */
final class ShapeBuilder {

    private ShapeBuilder() {
    }

    static ResultShape fromSelector(ObjectExpression selector, ErrorContext errorContext) {
        Map<String, ShapeNode> fields = new LinkedHashMap<>();
        selector.properties().forEach((key, value) -> fields.put(key, toShapeNode(key, value, errorContext)));
        return new ResultShape(fields);
    }

    static ShapeNode toShapeNode(String key, Expression expr, ErrorContext errorContext) {
        if (expr instanceof ColumnExpression column) {
            return new ShapeNode.Column(tableIndex(column.source()), column.name());
        }
        if (expr instanceof ReferenceExpression reference) {
            return new ShapeNode.Reference(tableIndex(reference.source()));
        }
        if (expr instanceof AllColumnsExpression) {
            return new ShapeNode.Reference(0);
        }
        if (expr instanceof ObjectExpression object) {
            Map<String, ShapeNode> properties = new LinkedHashMap<>();
            object.properties().forEach((k, v) -> properties.put(k, toShapeNode(k, v, errorContext)));
            return new ShapeNode.Nested(properties);
        }
        throw new ParseStructureException(
            "Join result property '" + key + "' must be a column, a table or an object of those", errorContext);
    }

    private static int tableIndex(ColumnSource source) {
        if (source instanceof ColumnSource.JoinParam joinParam) {
            return joinParam.paramIndex();
        }
        if (source instanceof ColumnSource.JoinResult joinResult) {
            return joinResult.tableIndex();
        }
        if (source instanceof ColumnSource.Spread spread) {
            return spread.sourceIndex();
        }
        return 0;
    }
}

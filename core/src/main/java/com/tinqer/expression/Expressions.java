package com.tinqer.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only traversal helpers for the expression IR.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Returns the direct children of a node.
     */
    public static List<Expression> children(Expression expr) {
        List<Expression> children = new ArrayList<>();
        if (expr instanceof ArithmeticExpression e) {
            children.add(e.left());
            children.add(e.right());
        } else if (expr instanceof ConcatExpression e) {
            children.add(e.left());
            children.add(e.right());
        } else if (expr instanceof StringMethodExpression e) {
            children.add(e.object());
        } else if (expr instanceof CaseExpression e) {
            for (CaseExpression.WhenClause clause : e.conditions()) {
                children.add(clause.when());
                children.add(clause.then());
            }
            children.add(e.elseResult());
        } else if (expr instanceof CoalesceExpression e) {
            children.addAll(e.expressions());
        } else if (expr instanceof AggregateExpression e) {
            if (e.expression() != null) {
                children.add(e.expression());
            }
        } else if (expr instanceof WindowFunctionExpression e) {
            children.addAll(e.partitionBy());
            for (WindowFunctionExpression.WindowOrder order : e.orderBy()) {
                children.add(order.expression());
            }
        } else if (expr instanceof ComparisonExpression e) {
            children.add(e.left());
            children.add(e.right());
        } else if (expr instanceof LogicalExpression e) {
            children.add(e.left());
            children.add(e.right());
        } else if (expr instanceof NotExpression e) {
            children.add(e.expression());
        } else if (expr instanceof BooleanColumnExpression e) {
            children.add(e.column());
        } else if (expr instanceof BooleanParameterExpression e) {
            children.add(e.parameter());
        } else if (expr instanceof BooleanMethodExpression e) {
            children.add(e.object());
            children.add(e.argument());
        } else if (expr instanceof CaseInsensitiveFunctionExpression e) {
            children.add(e.left());
            children.add(e.right());
        } else if (expr instanceof InExpression e) {
            children.add(e.value());
            children.add(e.list());
        } else if (expr instanceof IsNullExpression e) {
            children.add(e.expression());
        } else if (expr instanceof ObjectExpression e) {
            children.addAll(e.properties().values());
        } else if (expr instanceof ArrayExpression e) {
            children.addAll(e.elements());
        }
        return children;
    }

    /**
     * Returns true if any node in the tree (including the root) matches.
     */
    public static boolean anyMatch(Expression expr, Predicate<Expression> predicate) {
        if (expr == null) {
            return false;
        }
        if (predicate.test(expr)) {
            return true;
        }
        for (Expression child : children(expr)) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsWindowFunction(Expression expr) {
        return anyMatch(expr, e -> e instanceof WindowFunctionExpression);
    }

    public static boolean containsAggregate(Expression expr) {
        return anyMatch(expr, e -> e instanceof AggregateExpression);
    }

    /**
     * Collects every parameter placeholder in the tree, in visit order.
     */
    public static List<ParameterExpression> parameters(Expression expr) {
        List<ParameterExpression> result = new ArrayList<>();
        collectParameters(expr, result);
        return result;
    }

    private static void collectParameters(Expression expr, List<ParameterExpression> result) {
        if (expr == null) {
            return;
        }
        if (expr instanceof ParameterExpression param) {
            result.add(param);
            return;
        }
        for (Expression child : children(expr)) {
            collectParameters(child, result);
        }
    }
}

package com.tinqer.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed rewrite fold over the expression IR.
 *
 * <p>Each node kind has a {@code rewriteX} method that rewrites the children
 * and rebuilds the node. Subclasses override the kinds they care about and
 * delegate to {@code super} for the rest. The base implementation returns an
 * equal tree.
 */
public abstract class ExpressionRewriter {

    public Expression rewrite(Expression expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof ValueExpression value) {
            return rewriteValue(value);
        }
        if (expr instanceof BooleanExpression bool) {
            return rewriteBoolean(bool);
        }
        if (expr instanceof ObjectExpression object) {
            return rewriteObject(object);
        }
        return rewriteArray((ArrayExpression) expr);
    }

    public ValueExpression rewriteValue(ValueExpression expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof ColumnExpression column) {
            return rewriteColumn(column);
        }
        if (expr instanceof ExcludedColumnExpression excluded) {
            return rewriteExcludedColumn(excluded);
        }
        if (expr instanceof ConstantExpression constant) {
            return rewriteConstant(constant);
        }
        if (expr instanceof ParameterExpression param) {
            return rewriteParameter(param);
        }
        if (expr instanceof ArithmeticExpression arithmetic) {
            return new ArithmeticExpression(arithmetic.operator(),
                rewriteValue(arithmetic.left()), rewriteValue(arithmetic.right()));
        }
        if (expr instanceof ConcatExpression concat) {
            return new ConcatExpression(rewriteValue(concat.left()), rewriteValue(concat.right()));
        }
        if (expr instanceof StringMethodExpression method) {
            return new StringMethodExpression(rewriteValue(method.object()), method.method());
        }
        if (expr instanceof CaseExpression caseExpr) {
            List<CaseExpression.WhenClause> clauses = new ArrayList<>();
            for (CaseExpression.WhenClause clause : caseExpr.conditions()) {
                clauses.add(new CaseExpression.WhenClause(rewriteBoolean(clause.when()), rewrite(clause.then())));
            }
            return new CaseExpression(clauses, rewrite(caseExpr.elseResult()));
        }
        if (expr instanceof CoalesceExpression coalesce) {
            return new CoalesceExpression(rewriteAll(coalesce.expressions()));
        }
        if (expr instanceof AggregateExpression aggregate) {
            return new AggregateExpression(aggregate.function(), rewriteValue(aggregate.expression()));
        }
        if (expr instanceof WindowFunctionExpression window) {
            List<ValueExpression> partitions = new ArrayList<>();
            for (ValueExpression partition : window.partitionBy()) {
                partitions.add(rewriteValue(partition));
            }
            List<WindowFunctionExpression.WindowOrder> orders = new ArrayList<>();
            for (WindowFunctionExpression.WindowOrder order : window.orderBy()) {
                orders.add(new WindowFunctionExpression.WindowOrder(rewriteValue(order.expression()), order.descending()));
            }
            return new WindowFunctionExpression(window.function(), partitions, orders);
        }
        if (expr instanceof ReferenceExpression reference) {
            return rewriteReference(reference);
        }
        return expr;
    }

    public BooleanExpression rewriteBoolean(BooleanExpression expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof ComparisonExpression comparison) {
            return new ComparisonExpression(comparison.operator(),
                rewriteValue(comparison.left()), rewriteValue(comparison.right()));
        }
        if (expr instanceof LogicalExpression logical) {
            return new LogicalExpression(logical.operator(),
                rewriteBoolean(logical.left()), rewriteBoolean(logical.right()));
        }
        if (expr instanceof NotExpression not) {
            return new NotExpression(rewriteBoolean(not.expression()));
        }
        if (expr instanceof BooleanColumnExpression column) {
            return rewriteBooleanColumn(column);
        }
        if (expr instanceof BooleanParameterExpression param) {
            ValueExpression rewritten = rewriteParameter(param.parameter());
            if (rewritten instanceof ParameterExpression p) {
                return new BooleanParameterExpression(p);
            }
            BooleanExpression predicate = asPredicate(rewritten);
            return predicate != null ? predicate : param;
        }
        if (expr instanceof BooleanMethodExpression method) {
            return new BooleanMethodExpression(rewriteValue(method.object()), method.method(),
                rewriteValue(method.argument()));
        }
        if (expr instanceof CaseInsensitiveFunctionExpression function) {
            return new CaseInsensitiveFunctionExpression(function.function(),
                rewriteValue(function.left()), rewriteValue(function.right()));
        }
        if (expr instanceof InExpression in) {
            return new InExpression(rewriteValue(in.value()), rewrite(in.list()));
        }
        if (expr instanceof IsNullExpression isNull) {
            return new IsNullExpression(rewriteValue(isNull.expression()), isNull.negated());
        }
        return expr;
    }

    protected Expression rewriteObject(ObjectExpression expr) {
        Map<String, Expression> properties = new LinkedHashMap<>();
        expr.properties().forEach((key, value) -> properties.put(key, rewrite(value)));
        return new ObjectExpression(properties);
    }

    protected Expression rewriteArray(ArrayExpression expr) {
        return new ArrayExpression(rewriteAll(expr.elements()));
    }

    protected ValueExpression rewriteColumn(ColumnExpression expr) {
        return expr;
    }

    protected ValueExpression rewriteExcludedColumn(ExcludedColumnExpression expr) {
        return expr;
    }

    protected ValueExpression rewriteConstant(ConstantExpression expr) {
        return expr;
    }

    protected ValueExpression rewriteParameter(ParameterExpression expr) {
        return expr;
    }

    protected ValueExpression rewriteReference(ReferenceExpression expr) {
        return expr;
    }

    protected BooleanExpression rewriteBooleanColumn(BooleanColumnExpression expr) {
        BooleanExpression predicate = asPredicate(rewriteColumn(expr.column()));
        return predicate != null ? predicate : expr;
    }

    /**
     * Uses a value as a predicate after a rewrite replaced a boolean column or
     * parameter. Only columns and parameters can stand alone as a predicate;
     * for any other value this returns null and the caller keeps the original.
     */
    protected static BooleanExpression asPredicate(ValueExpression value) {
        if (value instanceof ColumnExpression column) {
            return new BooleanColumnExpression(column);
        }
        if (value instanceof ParameterExpression param) {
            return new BooleanParameterExpression(param);
        }
        return null;
    }

    private List<Expression> rewriteAll(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression e : expressions) {
            result.add(rewrite(e));
        }
        return result;
    }
}

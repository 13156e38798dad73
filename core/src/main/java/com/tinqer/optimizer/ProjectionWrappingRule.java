package com.tinqer.optimizer;

import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.Expression;
import com.tinqer.expression.Expressions;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.logical.AllOperation;
import com.tinqer.logical.AnyOperation;
import com.tinqer.logical.CountOperation;
import com.tinqer.logical.FirstOperation;
import com.tinqer.logical.FromOperation;
import com.tinqer.logical.LastOperation;
import com.tinqer.logical.OperationRewriter;
import com.tinqer.logical.OrderByOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.SelectOperation;
import com.tinqer.logical.SingleOperation;
import com.tinqer.logical.ThenByOperation;
import com.tinqer.logical.WhereOperation;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Moves a projection into a derived table when a later operation filters or
 * sorts on a value the projection computes.
 *
 * <pre>
 *   Where(Select(src, rowNumber() AS rn), rn = 1)
 *     -> Where(From((SELECT ..., ROW_NUMBER() OVER (...) AS "rn" FROM ...) AS "__tinqer_window"), rn = 1)
 *
 *   Where(Select(src, { a: age }), a > 3)
 *     -> Where(From((SELECT "age" AS "a" FROM ...) AS "__tinqer_projection"), a > 3)
 * </pre>
 *
 * <p>SQL evaluates WHERE before the projection, so a window function or a
 * renamed column is only visible under its alias one level up. Projections
 * that keep a column under its own name are left in place.
 */
public class ProjectionWrappingRule extends OperationRewriter implements NormalizationRule {

    public static final String WINDOW_ALIAS = "__tinqer_window";
    public static final String PROJECTION_ALIAS = "__tinqer_projection";

    @Override
    public QueryOperation apply(QueryOperation operation) {
        return rewrite(operation);
    }

    @Override
    protected QueryOperation rewriteDefault(QueryOperation operation) {
        QueryOperation source = operation.source();
        if (source == null) {
            return operation;
        }
        QueryOperation rewrittenSource = rewrite(source);
        Expression filter = filterOrSortKey(operation);
        if (filter != null) {
            SelectOperation select = nearestProjection(rewrittenSource);
            if (select != null && Expressions.containsWindowFunction(select.selector())) {
                rewrittenSource = FromOperation.subquery(rewrittenSource, WINDOW_ALIAS);
            } else if (select != null && readsComputedProperty(select.selector(), filter)) {
                rewrittenSource = FromOperation.subquery(rewrittenSource, PROJECTION_ALIAS);
            }
        }
        return operation.withSource(rewrittenSource);
    }

    private static Expression filterOrSortKey(QueryOperation operation) {
        if (operation instanceof WhereOperation where) {
            return where.predicate();
        }
        if (operation instanceof OrderByOperation orderBy) {
            return orderBy.keySelector();
        }
        if (operation instanceof ThenByOperation thenBy) {
            return thenBy.keySelector();
        }
        if (operation instanceof FirstOperation first) {
            return first.predicate();
        }
        if (operation instanceof SingleOperation single) {
            return single.predicate();
        }
        if (operation instanceof LastOperation last) {
            return last.predicate();
        }
        if (operation instanceof AnyOperation any) {
            return any.predicate();
        }
        if (operation instanceof AllOperation all) {
            return all.predicate();
        }
        if (operation instanceof CountOperation count) {
            return count.predicate();
        }
        return null;
    }

    /**
     * Nearest projection of the chain. The walk stops at the chain root,
     * including a derived table.
     */
    private static SelectOperation nearestProjection(QueryOperation operation) {
        QueryOperation current = operation;
        while (current != null && !(current instanceof FromOperation)) {
            if (current instanceof SelectOperation select) {
                return select;
            }
            current = current.source();
        }
        return null;
    }

    /**
     * Returns true if the filter reads a property that the projection does not
     * pass through as the unqualified column of the same name.
     */
    private static boolean readsComputedProperty(Expression selector, Expression filter) {
        if (!(selector instanceof ObjectExpression)) {
            return false;
        }
        Set<String> read = new HashSet<>();
        Expressions.anyMatch(filter, e -> {
            if (e instanceof ColumnExpression column && column.table() == null) {
                read.add(column.name());
            }
            return false;
        });
        for (Map.Entry<String, Expression> property : ((ObjectExpression) selector).properties().entrySet()) {
            if (read.contains(property.getKey()) && !passesThrough(property.getKey(), property.getValue())) {
                return true;
            }
        }
        return false;
    }

    private static boolean passesThrough(String key, Expression value) {
        return value instanceof ColumnExpression column
            && column.name().equals(key)
            && column.table() == null
            && column.source() instanceof ColumnSource.Direct;
    }
}

package com.tinqer.generator;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.exception.TinqerException;
import com.tinqer.expression.AllColumnsExpression;
import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.ConstantExpression;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.AllOperation;
import com.tinqer.logical.AnyOperation;
import com.tinqer.logical.AverageOperation;
import com.tinqer.logical.ContainsOperation;
import com.tinqer.logical.CountOperation;
import com.tinqer.logical.DefaultIfEmptyOperation;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.logical.DistinctOperation;
import com.tinqer.logical.FirstOperation;
import com.tinqer.logical.FromOperation;
import com.tinqer.logical.GroupByOperation;
import com.tinqer.logical.GroupJoinOperation;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.JoinOperation;
import com.tinqer.logical.JoinType;
import com.tinqer.logical.LastOperation;
import com.tinqer.logical.MaxOperation;
import com.tinqer.logical.MinOperation;
import com.tinqer.logical.OnConflict;
import com.tinqer.logical.Operations;
import com.tinqer.logical.OrderByOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.ReverseOperation;
import com.tinqer.logical.SelectManyOperation;
import com.tinqer.logical.SelectOperation;
import com.tinqer.logical.SingleOperation;
import com.tinqer.logical.SkipOperation;
import com.tinqer.logical.SumOperation;
import com.tinqer.logical.TakeOperation;
import com.tinqer.logical.TerminalOperation;
import com.tinqer.logical.ThenByOperation;
import com.tinqer.logical.UpdateOperation;
import com.tinqer.logical.WhereOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.tinqer.generator.SQLQuoting.quoteColumn;
import static com.tinqer.generator.SQLQuoting.quoteIdentifier;
import static com.tinqer.generator.SQLQuoting.quoteTable;

/**
 * Generates one SQL statement from a finalized operation tree.
 *
 * <p>A SELECT chain is flattened root first and assembled clause by clause:
 * projection, FROM, joins, WHERE, GROUP BY, ORDER BY, LIMIT/OFFSET. Derived
 * tables and join inners are generated recursively, each with its own alias
 * scope. {@code any}, {@code all} and {@code contains} compile to
 * {@code SELECT CASE WHEN [NOT] EXISTS(...) THEN 1 ELSE 0 END}.
 *
 * <p>Subclasses supply the dialect's placeholder syntax. Generators hold no
 * per-call state, so one instance can serve any number of threads.
 *
 * <p>Example usage:
 * <pre>
 *   FinalizedPlan plan = handle.finalize(Map.of("minAge", 18));
 *   String sql = PostgresSQLGenerator.INSTANCE.generate(plan.operation(), plan.params());
 * </pre>
 */
public abstract class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    static final String CONTAINS_ALIAS = "__tinqer_contains";
    static final String CONTAINS_COLUMN = "__tinqer_value";
    static final String DISTINCT_ALIAS = "__tinqer_distinct";

    /**
     * Returns the placeholder that binds the named parameter.
     */
    protected abstract String formatParameter(String name);

    /**
     * Dialect name used in log output.
     */
    public abstract String dialectName();

    /**
     * Renders a skip without a take. PostgreSQL accepts a bare OFFSET.
     */
    protected String offsetWithoutLimit(String offset) {
        return "OFFSET " + offset;
    }

    /**
     * Generates SQL for an operation tree.
     *
     * @param operation the finalized operation tree
     * @param params the parameters the statement will be bound with; array
     *               values drive IN list expansion and absent keys count as
     *               undefined for INSERT and UPDATE
     * @return the SQL text
     * @throws TinqerException if the tree cannot be expressed safely
     */
    public String generate(QueryOperation operation, Map<String, ?> params) {
        Objects.requireNonNull(operation, "operation must not be null");
        Map<String, Object> bound = params != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
            : Collections.emptyMap();
        try {
            String sql = statement(operation, bound);
            logger.debug("Generated {} SQL for {}: {}", dialectName(), operation.operationType(), sql);
            return sql;
        } catch (TinqerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SemanticPolicyException("Unexpected error during SQL generation", e,
                ErrorContext.of(operation.operationType(), tableOf(operation), "generate"));
        }
    }

    private String statement(QueryOperation operation, Map<String, Object> params) {
        if (operation instanceof InsertOperation) {
            return insert((InsertOperation) operation, params);
        }
        if (operation instanceof UpdateOperation) {
            return update((UpdateOperation) operation, params);
        }
        if (operation instanceof DeleteOperation) {
            return delete((DeleteOperation) operation, params);
        }
        return select(operation, params);
    }

    // ==================== SELECT ====================

    private String select(QueryOperation operation, Map<String, Object> params) {
        List<QueryOperation> ops = executionOrder(operation);
        if (!(ops.get(0) instanceof FromOperation)) {
            throw policy("Query must have a FROM operation", operation);
        }
        FromOperation from = (FromOperation) ops.get(0);
        List<JoinOperation> joins = new ArrayList<>();
        for (QueryOperation op : ops) {
            if (op instanceof JoinOperation) {
                joins.add((JoinOperation) op);
            } else if (op instanceof GroupJoinOperation) {
                throw policy("groupJoin() must be flattened with selectMany() before generating SQL", op);
            } else if (op instanceof SelectManyOperation || op instanceof DefaultIfEmptyOperation) {
                throw policy(op.operationType() + "() is only supported as part of a join pattern", op);
            }
        }

        String rootAlias = from.subquery() != null
            ? (from.aliasHint() != null ? from.aliasHint() : "t0")
            : null;
        GenerationContext ctx = new GenerationContext(params, this::formatParameter, !joins.isEmpty(), rootAlias);
        ExpressionGenerator exprs = new ExpressionGenerator(ctx);

        QueryOperation last = ops.get(ops.size() - 1);
        if (last instanceof CountOperation && find(ops, DistinctOperation.class) != null) {
            return distinctCount((CountOperation) last, params);
        }
        if (last instanceof AnyOperation || last instanceof AllOperation) {
            return exists(ops, from, joins, last, ctx, exprs);
        }
        if (last instanceof ContainsOperation) {
            return contains(ops, from, joins, (ContainsOperation) last, ctx, exprs);
        }
        TerminalOperation terminal = last instanceof TerminalOperation ? (TerminalOperation) last : null;
        validateOrdering(ops, terminal);

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(projection(ops, joins, terminal, exprs));
        appendFrom(sql, from, joins, ctx, exprs);

        List<String> predicates = wherePredicates(ops, exprs);
        BooleanExpression terminalPredicate = terminalPredicate(terminal);
        if (terminalPredicate != null) {
            predicates.add(exprs.bool(terminalPredicate));
        }
        appendWhere(sql, predicates);

        GroupByOperation groupBy = find(ops, GroupByOperation.class);
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(groupKeys(groupBy.keySelector(), exprs, false));
        }

        appendOrderBy(sql, ops, terminal, exprs);
        appendLimit(sql, ops, terminal, exprs);
        return sql.toString();
    }

    /**
     * {@code distinct().count()} counts the distinct rows in a derived table;
     * a count predicate then reads the projected columns.
     */
    private String distinctCount(CountOperation count, Map<String, Object> params) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM (")
            .append(select(count.source(), params))
            .append(") AS ").append(quoteIdentifier(DISTINCT_ALIAS));
        if (count.predicate() != null) {
            ExpressionGenerator exprs = new ExpressionGenerator(
                new GenerationContext(params, this::formatParameter, false, DISTINCT_ALIAS));
            sql.append(" WHERE ").append(exprs.bool(count.predicate()));
        }
        return sql.toString();
    }

    private String projection(List<QueryOperation> ops, List<JoinOperation> joins,
                              TerminalOperation terminal, ExpressionGenerator exprs) {
        SelectOperation select = findLast(ops, SelectOperation.class);
        if (terminal instanceof CountOperation) {
            return "COUNT(*)";
        } else if (terminal instanceof SumOperation) {
            return "SUM(" + aggregateArgument(((SumOperation) terminal).selector(), select, terminal, exprs) + ")";
        } else if (terminal instanceof AverageOperation) {
            return "AVG(" + aggregateArgument(((AverageOperation) terminal).selector(), select, terminal, exprs) + ")";
        } else if (terminal instanceof MinOperation) {
            return "MIN(" + aggregateArgument(((MinOperation) terminal).selector(), select, terminal, exprs) + ")";
        } else if (terminal instanceof MaxOperation) {
            return "MAX(" + aggregateArgument(((MaxOperation) terminal).selector(), select, terminal, exprs) + ")";
        }

        String distinct = find(ops, DistinctOperation.class) != null ? "DISTINCT " : "";
        if (select != null) {
            return distinct + exprs.projection(select.selector());
        }
        for (JoinOperation join : joins) {
            if (join.resultSelector() != null) {
                throw policy("JOIN with result selector requires explicit SELECT projection. "
                    + "Add .select() to specify which columns to return. "
                    + "Example: .select(joined => ({ userName: joined.u.name, deptName: joined.d.name }))", join);
            }
        }
        GroupByOperation groupBy = find(ops, GroupByOperation.class);
        if (groupBy != null) {
            // SELECT * is not valid with GROUP BY, project the key instead
            return distinct + groupKeys(groupBy.keySelector(), exprs, true);
        }
        return distinct + "*";
    }

    /**
     * Argument of SUM/AVG/MIN/MAX: the terminal's own selector, or the scalar
     * projection of a preceding {@code select()}.
     */
    private String aggregateArgument(ValueExpression selector, SelectOperation select,
                                     TerminalOperation terminal, ExpressionGenerator exprs) {
        if (selector != null) {
            return exprs.value(selector);
        }
        if (select != null && select.selector() instanceof ValueExpression
            && !(select.selector() instanceof AllColumnsExpression)) {
            return exprs.value((ValueExpression) select.selector());
        }
        throw policy(terminal.operationType() + "() requires a selector or a preceding scalar select()", terminal);
    }

    private static String groupKeys(Expression key, ExpressionGenerator exprs, boolean aliased) {
        if (key instanceof ObjectExpression) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Expression> property : ((ObjectExpression) key).properties().entrySet()) {
                String rendered = exprs.expression(property.getValue());
                parts.add(aliased ? rendered + " AS " + quoteIdentifier(property.getKey()) : rendered);
            }
            return String.join(", ", parts);
        }
        return exprs.expression(key);
    }

    private void appendFrom(StringBuilder sql, FromOperation from, List<JoinOperation> joins,
                            GenerationContext ctx, ExpressionGenerator exprs) {
        sql.append(" FROM ").append(source(from, ctx.tableAlias(0), ctx.params()));
        for (int i = 0; i < joins.size(); i++) {
            JoinOperation join = joins.get(i);
            int innerIndex = i + 1;
            String innerAlias = ctx.tableAlias(innerIndex);
            sql.append(' ').append(join.joinType().sql()).append(' ');
            if (join.inner() instanceof FromOperation) {
                sql.append(source((FromOperation) join.inner(), innerAlias, ctx.params()));
            } else {
                sql.append('(').append(statement(join.inner(), ctx.params())).append(") AS ")
                   .append(quoteIdentifier(innerAlias));
            }
            if (join.joinType() != JoinType.CROSS) {
                int outerIndex = join.outerKeySource() != null ? join.outerKeySource() : 0;
                sql.append(" ON ")
                   .append(quoteColumn(ctx.tableAlias(outerIndex), join.outerKey()))
                   .append(" = ")
                   .append(quoteColumn(innerAlias, join.innerKey()));
            }
        }
    }

    private String source(FromOperation from, String alias, Map<String, Object> params) {
        if (from.subquery() != null) {
            return "(" + statement(from.subquery(), params) + ") AS " + quoteIdentifier(alias);
        }
        String table = quoteTable(from.schema(), from.table());
        return alias != null ? table + " AS " + quoteIdentifier(alias) : table;
    }

    private static List<String> wherePredicates(List<QueryOperation> ops, ExpressionGenerator exprs) {
        List<String> predicates = new ArrayList<>();
        for (QueryOperation op : ops) {
            if (op instanceof WhereOperation) {
                predicates.add(exprs.bool(((WhereOperation) op).predicate()));
            }
        }
        return predicates;
    }

    private static void appendWhere(StringBuilder sql, List<String> predicates) {
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
    }

    private static BooleanExpression terminalPredicate(TerminalOperation terminal) {
        if (terminal instanceof FirstOperation) {
            return ((FirstOperation) terminal).predicate();
        } else if (terminal instanceof SingleOperation) {
            return ((SingleOperation) terminal).predicate();
        } else if (terminal instanceof LastOperation) {
            return ((LastOperation) terminal).predicate();
        } else if (terminal instanceof CountOperation) {
            return ((CountOperation) terminal).predicate();
        }
        return null;
    }

    /**
     * Rejects orderings that a single SELECT level cannot express: an odd
     * number of {@code reverse()} calls after take/skip, and {@code last()}
     * after take/skip.
     */
    private void validateOrdering(List<QueryOperation> ops, TerminalOperation terminal) {
        int firstLimit = -1;
        int lastReverse = -1;
        int reverses = 0;
        for (int i = 0; i < ops.size(); i++) {
            QueryOperation op = ops.get(i);
            if ((op instanceof TakeOperation || op instanceof SkipOperation) && firstLimit < 0) {
                firstLimit = i;
            } else if (op instanceof ReverseOperation) {
                reverses++;
                lastReverse = i;
            }
        }
        if (firstLimit >= 0 && reverses % 2 == 1 && lastReverse > firstLimit) {
            throw policy("reverse() after take/skip is not supported. Apply reverse() before take/skip.",
                ops.get(lastReverse));
        }
        if (firstLimit >= 0 && terminal instanceof LastOperation) {
            throw policy(terminal.operationType() + "() after take/skip is not supported.", terminal);
        }
    }

    /**
     * ORDER BY, flipped once per odd {@code reverse()} count and once more for
     * {@code last}. The last {@code orderBy} wins; {@code thenBy} calls extend it.
     */
    private static void appendOrderBy(StringBuilder sql, List<QueryOperation> ops, TerminalOperation terminal,
                                      ExpressionGenerator exprs) {
        int reverses = 0;
        List<String> keys = new ArrayList<>();
        List<Boolean> descending = new ArrayList<>();
        for (QueryOperation op : ops) {
            if (op instanceof ReverseOperation) {
                reverses++;
            } else if (op instanceof OrderByOperation) {
                OrderByOperation orderBy = (OrderByOperation) op;
                keys.clear();
                descending.clear();
                keys.add(exprs.value(orderBy.keySelector()));
                descending.add(orderBy.descending());
            } else if (op instanceof ThenByOperation) {
                ThenByOperation thenBy = (ThenByOperation) op;
                keys.add(exprs.value(thenBy.keySelector()));
                descending.add(thenBy.descending());
            }
        }
        boolean flip = (reverses % 2 == 1) != (terminal instanceof LastOperation);
        if (keys.isEmpty()) {
            if (flip) {
                sql.append(" ORDER BY 1 DESC");
            } else if (reverses % 2 == 1) {
                // reverse() then last(): the two flips cancel
                sql.append(" ORDER BY 1 ASC");
            }
            return;
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            boolean desc = descending.get(i) != flip;
            parts.add(keys.get(i) + (desc ? " DESC" : " ASC"));
        }
        sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    /**
     * LIMIT/OFFSET. {@code first} and {@code last} fetch one row; {@code single}
     * fetches two so the caller can detect a second match.
     */
    private void appendLimit(StringBuilder sql, List<QueryOperation> ops, TerminalOperation terminal,
                             ExpressionGenerator exprs) {
        TakeOperation take = find(ops, TakeOperation.class);
        SkipOperation skip = find(ops, SkipOperation.class);
        String offset = skip != null ? exprs.value(skip.count()) : null;

        if (terminal instanceof FirstOperation || terminal instanceof LastOperation) {
            sql.append(" LIMIT 1");
        } else if (terminal instanceof SingleOperation) {
            sql.append(" LIMIT 2");
        } else if (take != null) {
            sql.append(" LIMIT ").append(exprs.value(take.count()));
        } else if (offset != null) {
            sql.append(' ').append(offsetWithoutLimit(offset));
            return;
        }
        if (offset != null) {
            sql.append(" OFFSET ").append(offset);
        }
    }

    // ==================== ANY / ALL / CONTAINS ====================

    private String exists(List<QueryOperation> ops, FromOperation from, List<JoinOperation> joins,
                          QueryOperation terminal, GenerationContext ctx, ExpressionGenerator exprs) {
        StringBuilder inner = new StringBuilder("SELECT 1");
        appendFrom(inner, from, joins, ctx, exprs);
        List<String> predicates = wherePredicates(ops, exprs);
        boolean all = terminal instanceof AllOperation;
        if (all) {
            // every row matches when no row fails the predicate
            predicates.add("NOT (" + exprs.bool(((AllOperation) terminal).predicate()) + ")");
        } else if (((AnyOperation) terminal).predicate() != null) {
            predicates.add(exprs.bool(((AnyOperation) terminal).predicate()));
        }
        appendWhere(inner, predicates);
        return "SELECT CASE WHEN " + (all ? "NOT EXISTS(" : "EXISTS(") + inner + ") THEN 1 ELSE 0 END";
    }

    private String contains(List<QueryOperation> ops, FromOperation from, List<JoinOperation> joins,
                            ContainsOperation terminal, GenerationContext ctx, ExpressionGenerator exprs) {
        for (QueryOperation op : ops) {
            if (op instanceof TakeOperation || op instanceof SkipOperation) {
                throw policy("contains() is not supported with take/skip.", terminal);
            }
        }
        SelectOperation select = findLast(ops, SelectOperation.class);
        if (select == null || select.selector() instanceof ObjectExpression
            || select.selector() instanceof AllColumnsExpression) {
            throw policy("contains() requires a scalar .select(...) projection.", terminal);
        }

        StringBuilder inner = new StringBuilder("SELECT ");
        inner.append(exprs.expression(select.selector())).append(" AS ").append(quoteIdentifier(CONTAINS_COLUMN));
        appendFrom(inner, from, joins, ctx, exprs);
        appendWhere(inner, wherePredicates(ops, exprs));
        GroupByOperation groupBy = find(ops, GroupByOperation.class);
        if (groupBy != null) {
            inner.append(" GROUP BY ").append(groupKeys(groupBy.keySelector(), exprs, false));
        }

        return "SELECT CASE WHEN EXISTS(SELECT 1 FROM (" + inner + ") AS " + quoteIdentifier(CONTAINS_ALIAS)
            + " WHERE " + quoteColumn(CONTAINS_ALIAS, CONTAINS_COLUMN) + " = "
            + exprs.value(terminal.value()) + ") THEN 1 ELSE 0 END";
    }

    // ==================== INSERT / UPDATE / DELETE ====================

    private String insert(InsertOperation insert, Map<String, Object> params) {
        ExpressionGenerator exprs = new ExpressionGenerator(
            new GenerationContext(params, this::formatParameter, false, null));
        if (insert.values() == null) {
            throw policy("INSERT statement requires values() to be called before generating SQL", insert);
        }
        List<String> columns = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, Expression> entry : insert.values().properties().entrySet()) {
            if (isUndefined(entry.getValue(), params)) {
                continue;
            }
            columns.add(quoteIdentifier(entry.getKey()));
            values.add(exprs.expression(entry.getValue()));
        }
        if (columns.isEmpty()) {
            throw policy("INSERT must specify at least one column. All provided values were undefined.", insert);
        }

        StringBuilder sql = new StringBuilder("INSERT INTO ")
            .append(quoteTable(insert.schema(), insert.table()))
            .append(" (").append(String.join(", ", columns)).append(") VALUES (")
            .append(String.join(", ", values)).append(')');

        OnConflict onConflict = insert.onConflict();
        if (onConflict != null) {
            List<String> target = new ArrayList<>();
            for (String column : onConflict.target()) {
                target.add(quoteIdentifier(column));
            }
            sql.append(" ON CONFLICT (").append(String.join(", ", target)).append(')');
            if (onConflict.action() == null) {
                throw policy("INSERT ON CONFLICT requires doNothing() or doUpdateSet()", insert);
            }
            if (onConflict.action() instanceof OnConflict.DoNothing) {
                sql.append(" DO NOTHING");
            } else {
                ObjectExpression assignments = ((OnConflict.DoUpdate) onConflict.action()).assignments();
                List<String> sets = assignments(assignments, params, exprs);
                if (sets.isEmpty()) {
                    throw policy("INSERT ON CONFLICT DO UPDATE must specify at least one column assignment. "
                        + "All provided values were undefined.", insert);
                }
                sql.append(" DO UPDATE SET ").append(String.join(", ", sets));
            }
        }
        appendReturning(sql, insert.returning(), exprs);
        return sql.toString();
    }

    private String update(UpdateOperation update, Map<String, Object> params) {
        ExpressionGenerator exprs = new ExpressionGenerator(
            new GenerationContext(params, this::formatParameter, false, null));
        if (update.assignments() == null) {
            throw policy("UPDATE statement requires set() to be called before generating SQL", update);
        }
        List<String> sets = assignments(update.assignments(), params, exprs);
        if (sets.isEmpty()) {
            throw policy("UPDATE must specify at least one column assignment. All provided values were undefined.",
                update);
        }
        if (update.predicate() == null && !update.allowFullTableUpdate()) {
            throw policy("UPDATE requires a WHERE clause or explicit allowFullTableUpdate", update);
        }

        StringBuilder sql = new StringBuilder("UPDATE ")
            .append(quoteTable(update.schema(), update.table()))
            .append(" SET ").append(String.join(", ", sets));
        if (update.predicate() != null) {
            sql.append(" WHERE ").append(exprs.bool(update.predicate()));
        }
        appendReturning(sql, update.returning(), exprs);
        return sql.toString();
    }

    private String delete(DeleteOperation delete, Map<String, Object> params) {
        ExpressionGenerator exprs = new ExpressionGenerator(
            new GenerationContext(params, this::formatParameter, false, null));
        if (delete.predicate() == null && !delete.allowFullTableDelete()) {
            throw policy("DELETE requires a WHERE clause or explicit allowFullTableDelete", delete);
        }
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(quoteTable(delete.schema(), delete.table()));
        if (delete.predicate() != null) {
            sql.append(" WHERE ").append(exprs.bool(delete.predicate()));
        }
        return sql.toString();
    }

    private static List<String> assignments(ObjectExpression assignments, Map<String, Object> params,
                                            ExpressionGenerator exprs) {
        List<String> sets = new ArrayList<>();
        for (Map.Entry<String, Expression> entry : assignments.properties().entrySet()) {
            if (isUndefined(entry.getValue(), params)) {
                continue;
            }
            sets.add(quoteIdentifier(entry.getKey()) + " = " + exprs.expression(entry.getValue()));
        }
        return sets;
    }

    private static void appendReturning(StringBuilder sql, Expression returning, ExpressionGenerator exprs) {
        if (returning == null) {
            return;
        }
        sql.append(" RETURNING ");
        if (returning instanceof AllColumnsExpression) {
            sql.append('*');
        } else {
            sql.append(exprs.projection(returning));
        }
    }

    /**
     * A value is undefined when it is the {@code undefined} constant or a
     * parameter whose key is absent from the parameter map. A key mapped to
     * null is defined and binds SQL NULL.
     */
    static boolean isUndefined(Expression value, Map<String, Object> params) {
        if (value instanceof ConstantExpression) {
            return ((ConstantExpression) value).undefined();
        }
        if (value instanceof ParameterExpression) {
            ParameterExpression param = (ParameterExpression) value;
            return param.index() == null && !params.containsKey(param.bindingName());
        }
        return false;
    }

    // ==================== Helpers ====================

    /**
     * Flattens a chain root first. A {@code from} ends the chain; its subquery
     * is a separate level.
     */
    private static List<QueryOperation> executionOrder(QueryOperation operation) {
        List<QueryOperation> ops = new ArrayList<>(Operations.chain(operation));
        Collections.reverse(ops);
        return ops;
    }

    private static <T extends QueryOperation> T find(List<QueryOperation> ops, Class<T> type) {
        for (QueryOperation op : ops) {
            if (type.isInstance(op)) {
                return type.cast(op);
            }
        }
        return null;
    }

    private static <T extends QueryOperation> T findLast(List<QueryOperation> ops, Class<T> type) {
        for (int i = ops.size() - 1; i >= 0; i--) {
            if (type.isInstance(ops.get(i))) {
                return type.cast(ops.get(i));
            }
        }
        return null;
    }

    private static String tableOf(QueryOperation operation) {
        if (operation instanceof InsertOperation) {
            return ((InsertOperation) operation).table();
        }
        if (operation instanceof UpdateOperation) {
            return ((UpdateOperation) operation).table();
        }
        if (operation instanceof DeleteOperation) {
            return ((DeleteOperation) operation).table();
        }
        FromOperation root = Operations.root(operation);
        return root != null ? root.table() : null;
    }

    private static SemanticPolicyException policy(String message, QueryOperation op) {
        String kind = op instanceof InsertOperation ? "insert"
            : op instanceof UpdateOperation ? "update"
            : op instanceof DeleteOperation ? "delete"
            : "select";
        return new SemanticPolicyException(message, ErrorContext.of(kind, tableOf(op), op.operationType()));
    }
}

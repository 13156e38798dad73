package com.tinqer.policy;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.exception.PolicyBindingException;
import com.tinqer.exception.TinqerException;
import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.ConstantExpression;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ExpressionRewriter;
import com.tinqer.expression.Expressions;
import com.tinqer.expression.LogicalExpression;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.logical.FromOperation;
import com.tinqer.logical.OperationRewriter;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.UpdateOperation;
import com.tinqer.logical.WhereOperation;
import com.tinqer.schema.RowFilterOperation;
import com.tinqer.schema.RowFilterState;
import com.tinqer.schema.TableRowFilter;
import com.tinqer.visitor.ContextSnapshot;
import com.tinqer.visitor.ExpressionVisitor;
import com.tinqer.visitor.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Injects per-table row filter predicates into finalized plans.
 *
 * <ul>
 *   <li>SELECT: every table leaf, including join inners, becomes
 *       {@code from((from(table).where(filter)) AS table)}</li>
 *   <li>UPDATE: the filter is AND-ed onto WHERE, together with a copy of the
 *       filter in which updated columns are replaced by their new values, so
 *       an update cannot move a row out of the filtered set</li>
 *   <li>DELETE: the filter is AND-ed onto WHERE</li>
 * </ul>
 *
 * <p>Context values are bound as parameters named
 * {@value #CONTEXT_PARAM_PREFIX}{@code key}, only for keys a filter reads.
 * A name that collides with an existing parameter is fatal.
 */
public final class RowFilterEngine {

    private static final Logger logger = LoggerFactory.getLogger(RowFilterEngine.class);

    public static final String CONTEXT_PARAM_PREFIX = "__tinqer_row_filter_ctx__";

    private static final String MISSING_CONTEXT =
        "Row filters require context binding. Call schema.withContext(context).";

    private RowFilterEngine() {}

    // ==================== SELECT ====================

    /**
     * Applies SELECT filters to every table of a query.
     *
     * @param operation the normalized query
     * @param rowFilters the schema's filters, or null
     * @param params caller parameters merged over auto-parameters
     * @param autoParamCounter the plan's auto-parameter counter; filter
     *                         literals continue from it
     * @return the filtered query and extended parameters
     * @throws PolicyBindingException if filters are declared but no context is bound
     */
    public static RowFilterResult<QueryOperation> applyToSelect(QueryOperation operation,
                                                                RowFilterState rowFilters,
                                                                Map<String, Object> params,
                                                                int autoParamCounter) {
        if (rowFilters == null) {
            return new RowFilterResult<>(operation, params);
        }
        if (!rowFilters.hasContext()) {
            throw new PolicyBindingException(MISSING_CONTEXT, ErrorContext.of("select", null, "finalize"));
        }

        SelectFilterRewriter rewriter = new SelectFilterRewriter(rowFilters, autoParamCounter);
        QueryOperation filtered = rewriter.rewrite(operation);

        Map<String, Object> nextParams = mergeStrict(params, rewriter.autoParams, "Row filter auto-params");
        nextParams = mergeStrict(nextParams, contextParams(rowFilters.context(), rewriter.contextKeys),
            "Row filter context params");
        logger.debug("Applied SELECT row filters to {} table(s)", rewriter.filteredTables);
        return new RowFilterResult<>(filtered, nextParams);
    }

    /**
     * Replaces filtered table leaves with filtered derived tables. Parsed
     * filters are reused per table so each filter mints its parameters once.
     */
    private static final class SelectFilterRewriter extends OperationRewriter {

        private final RowFilterState rowFilters;
        private final Map<String, ParsedRowFilter> parsed = new HashMap<>();
        private final Set<String> disabled = new LinkedHashSet<>();
        private final Map<String, Object> autoParams = new LinkedHashMap<>();
        private final Set<String> contextKeys = new LinkedHashSet<>();
        private int autoParamCounter;
        private int filteredTables;

        SelectFilterRewriter(RowFilterState rowFilters, int autoParamCounter) {
            this.rowFilters = rowFilters;
            this.autoParamCounter = autoParamCounter;
        }

        @Override
        protected QueryOperation rewriteFrom(FromOperation from) {
            if (from.subquery() != null) {
                return from.withSubquery(rewrite(from.subquery()));
            }
            ParsedRowFilter filter = filterFor(from.table(), from.schema());
            if (filter == null) {
                return from;
            }
            filteredTables++;
            FromOperation base = new FromOperation(from.table(), from.schema(), null, null);
            String alias = from.aliasHint() != null ? from.aliasHint() : from.table();
            return FromOperation.subquery(new WhereOperation(base, filter.predicate()), alias);
        }

        private ParsedRowFilter filterFor(String table, String schema) {
            String key = resolveTableKey(rowFilters, table, schema);
            if (disabled.contains(key)) {
                return null;
            }
            ParsedRowFilter cached = parsed.get(key);
            if (cached != null) {
                return cached;
            }
            ArrowFunctionNode lambda = resolveFilter(rowFilters.filters().get(key), key, RowFilterOperation.SELECT);
            if (lambda == null) {
                disabled.add(key);
                return null;
            }
            ParsedRowFilter filter = parseFilter(lambda, key, RowFilterOperation.SELECT, autoParamCounter);
            autoParamCounter = filter.autoParamCounter();
            autoParams.putAll(filter.autoParams());
            contextKeys.addAll(filter.contextKeys());
            parsed.put(key, filter);
            return filter;
        }
    }

    // ==================== UPDATE ====================

    /**
     * Applies the UPDATE filter of the target table.
     */
    public static RowFilterResult<UpdateOperation> applyToUpdate(UpdateOperation operation,
                                                                 RowFilterState rowFilters,
                                                                 Map<String, Object> params,
                                                                 int autoParamCounter) {
        if (rowFilters == null) {
            return new RowFilterResult<>(operation, params);
        }
        if (!rowFilters.hasContext()) {
            throw new PolicyBindingException(MISSING_CONTEXT,
                ErrorContext.of("update", operation.table(), "finalize"));
        }

        String key = resolveTableKey(rowFilters, operation.table(), operation.schema());
        ArrowFunctionNode lambda = resolveFilter(rowFilters.filters().get(key), key, RowFilterOperation.UPDATE);
        if (lambda == null) {
            return new RowFilterResult<>(operation, params);
        }

        ParsedRowFilter filter = parseFilter(lambda, key, RowFilterOperation.UPDATE, autoParamCounter);
        Map<String, Object> nextParams = mergeStrict(params, filter.autoParams(), "Row filter auto-params");
        nextParams = mergeStrict(nextParams, contextParams(rowFilters.context(), filter.contextKeys()),
            "Row filter context params");

        Map<String, Expression> assignments = includedAssignments(operation, nextParams);
        BooleanExpression check = new UpdatedColumnSubstitution(assignments).rewriteBoolean(filter.predicate());
        BooleanExpression predicate = and(and(operation.predicate(), filter.predicate()), check);

        logger.debug("Applied UPDATE row filter for {}", key);
        return new RowFilterResult<>(operation.withPredicate(predicate), nextParams);
    }

    /**
     * Returns the assignments that will actually be written: parameters
     * absent from the map and {@code undefined} constants are skipped.
     */
    private static Map<String, Expression> includedAssignments(UpdateOperation operation, Map<String, Object> params) {
        Map<String, Expression> included = new LinkedHashMap<>();
        if (operation.assignments() == null) {
            return included;
        }
        for (Map.Entry<String, Expression> entry : operation.assignments().properties().entrySet()) {
            Expression value = entry.getValue();
            if (value instanceof ParameterExpression param && !params.containsKey(param.bindingName())) {
                continue;
            }
            if (value instanceof ConstantExpression constant && constant.undefined()) {
                continue;
            }
            included.put(entry.getKey(), value);
        }
        return included;
    }

    /**
     * Replaces unqualified columns by the values an UPDATE assigns to them.
     */
    private static final class UpdatedColumnSubstitution extends ExpressionRewriter {

        private final Map<String, Expression> assignments;

        UpdatedColumnSubstitution(Map<String, Expression> assignments) {
            this.assignments = assignments;
        }

        @Override
        protected ValueExpression rewriteColumn(ColumnExpression column) {
            if (column.table() != null || !(column.source() instanceof ColumnSource.Direct)) {
                return column;
            }
            Expression replacement = assignments.get(column.name());
            if (replacement == null) {
                return column;
            }
            if (!(replacement instanceof ValueExpression value)) {
                throw new PolicyBindingException(
                    "Row filter column \"" + column.name() + "\" cannot be substituted with a non-value assignment.",
                    ErrorContext.of("update", null, "finalize"));
            }
            return value;
        }
    }

    // ==================== DELETE ====================

    /**
     * Applies the DELETE filter of the target table.
     */
    public static RowFilterResult<DeleteOperation> applyToDelete(DeleteOperation operation,
                                                                 RowFilterState rowFilters,
                                                                 Map<String, Object> params,
                                                                 int autoParamCounter) {
        if (rowFilters == null) {
            return new RowFilterResult<>(operation, params);
        }
        if (!rowFilters.hasContext()) {
            throw new PolicyBindingException(MISSING_CONTEXT,
                ErrorContext.of("delete", operation.table(), "finalize"));
        }

        String key = resolveTableKey(rowFilters, operation.table(), operation.schema());
        ArrowFunctionNode lambda = resolveFilter(rowFilters.filters().get(key), key, RowFilterOperation.DELETE);
        if (lambda == null) {
            return new RowFilterResult<>(operation, params);
        }

        ParsedRowFilter filter = parseFilter(lambda, key, RowFilterOperation.DELETE, autoParamCounter);
        Map<String, Object> nextParams = mergeStrict(params, filter.autoParams(), "Row filter auto-params");
        nextParams = mergeStrict(nextParams, contextParams(rowFilters.context(), filter.contextKeys()),
            "Row filter context params");

        logger.debug("Applied DELETE row filter for {}", key);
        return new RowFilterResult<>(operation.withPredicate(and(operation.predicate(), filter.predicate())),
            nextParams);
    }

    // ==================== Helpers ====================

    /**
     * Finds the configuration key for a table: {@code schema.table} first,
     * then {@code table}.
     */
    static String resolveTableKey(RowFilterState rowFilters, String table, String schema) {
        String qualified = schema != null ? schema + "." + table : null;
        if (qualified != null && rowFilters.filters().containsKey(qualified)) {
            return qualified;
        }
        if (rowFilters.filters().containsKey(table)) {
            return table;
        }
        throw new PolicyBindingException(
            "Row filter schema is missing configuration for table \"" + (qualified != null ? qualified : table) + "\".",
            ErrorContext.of(null, table, "finalize"));
    }

    private static ArrowFunctionNode resolveFilter(TableRowFilter config, String table, RowFilterOperation kind) {
        AstNode filter = config.filterFor(kind);
        if (filter == null) {
            return null;
        }
        if (!(filter instanceof ArrowFunctionNode lambda)) {
            throw new ParseStructureException("Row filter config for " + kind.key() + " must be a function or null.",
                ErrorContext.of(kind.key(), table, "rowFilters"));
        }
        return lambda;
    }

    /**
     * Visits {@code (row, ctx, helpers) => <predicate>} against the table.
     */
    static ParsedRowFilter parseFilter(ArrowFunctionNode lambda, String table, RowFilterOperation kind,
                                       int autoParamCounter) {
        VisitorContext ctx = VisitorContext.restore(new ContextSnapshot(
            null, lambda.param(2), Set.of(), Set.of(), Map.of(), Map.of(), autoParamCounter,
            null, table, null, kind.key()));
        ctx.setCurrentMethod("rowFilter");
        ctx.setRowFilterContextParam(lambda.param(1), CONTEXT_PARAM_PREFIX);
        ctx.bindRowParam(lambda.param(0));

        ExpressionVisitor expressions = new ExpressionVisitor(ctx);
        BooleanExpression predicate;
        try {
            predicate = expressions.visitBoolean(expressions.lambdaBody(lambda, table + "." + kind.key()));
        } catch (TinqerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ParseStructureException("Failed to parse row filter for " + table + "." + kind.key() + ".",
                e, ctx.errorContext());
        }

        Set<String> contextKeys = new LinkedHashSet<>();
        for (ParameterExpression param : Expressions.parameters(predicate)) {
            if (param.param().startsWith(CONTEXT_PARAM_PREFIX)) {
                contextKeys.add(param.param().substring(CONTEXT_PARAM_PREFIX.length()));
            }
        }
        return new ParsedRowFilter(predicate, ctx.getAutoParams(), contextKeys, ctx.getAutoParamCounter());
    }

    private static Map<String, Object> contextParams(Map<String, Object> context, Set<String> keys) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (String key : keys) {
            if (!context.containsKey(key)) {
                throw new PolicyBindingException("Row filter context is missing required key \"" + key + "\".",
                    ErrorContext.method("finalize"));
            }
            params.put(CONTEXT_PARAM_PREFIX + key, context.get(key));
        }
        return params;
    }

    private static Map<String, Object> mergeStrict(Map<String, Object> base, Map<String, Object> additions,
                                                   String label) {
        for (String key : additions.keySet()) {
            if (base.containsKey(key)) {
                throw new PolicyBindingException(label + " collided with existing parameter \"" + key + "\".",
                    ErrorContext.method("finalize"));
            }
        }
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(additions);
        return merged;
    }

    private static BooleanExpression and(BooleanExpression left, BooleanExpression right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return LogicalExpression.and(left, right);
    }
}

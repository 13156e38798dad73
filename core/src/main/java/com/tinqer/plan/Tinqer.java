package com.tinqer.plan;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.cache.CachedParse;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.schema.DatabaseSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for defining plans from query-construction lambdas.
 *
 * <pre>
 *   SelectPlanHandle adults = Tinqer.defineSelect(schema,
 *       "(q, p) => q.from(\"users\").where(u => u.age >= p.minAge)");
 *   CompiledStatement sql = PostgresDialect.INSTANCE.toSql(adults, Map.of("minAge", 18));
 * </pre>
 *
 * <p>Each {@code define*} method checks that the query starts with the
 * matching builder call ({@code from}, {@code insertInto}, {@code update} or
 * {@code deleteFrom}).
 */
public final class Tinqer {

    private static final Logger logger = LoggerFactory.getLogger(Tinqer.class);

    private Tinqer() {}

    // ==================== SELECT ====================

    public static SelectPlanHandle defineSelect(DatabaseSchema schema, String query) {
        return defineSelect(schema, query, ParseOptions.DEFAULT);
    }

    public static SelectPlanHandle defineSelect(DatabaseSchema schema, String query, ParseOptions options) {
        return new SelectPlanHandle(initialState(schema, QuerySourceParser.parse(query, options), PlanKind.SELECT,
            options, "defineSelect"));
    }

    public static SelectPlanHandle defineSelect(DatabaseSchema schema, ArrowFunctionNode query) {
        return new SelectPlanHandle(initialState(schema, QuerySourceParser.parse(query), PlanKind.SELECT,
            ParseOptions.NO_CACHE, "defineSelect"));
    }

    // ==================== INSERT ====================

    /**
     * Returns {@link InsertPlan.Initial}, {@link InsertPlan.WithValues},
     * {@link InsertPlan.WithConflictTarget} or {@link InsertPlan.WithReturning}
     * depending on how far the defining query went.
     */
    public static FinalizablePlan defineInsert(DatabaseSchema schema, String query) {
        return defineInsert(schema, query, ParseOptions.DEFAULT);
    }

    public static FinalizablePlan defineInsert(DatabaseSchema schema, String query, ParseOptions options) {
        return InsertPlan.start(initialState(schema, QuerySourceParser.parse(query, options), PlanKind.INSERT,
            options, "defineInsert"));
    }

    public static FinalizablePlan defineInsert(DatabaseSchema schema, ArrowFunctionNode query) {
        return InsertPlan.start(initialState(schema, QuerySourceParser.parse(query), PlanKind.INSERT,
            ParseOptions.NO_CACHE, "defineInsert"));
    }

    /**
     * Shortcut for a plan that starts at {@code insertInto(table)} with nothing else.
     */
    public static InsertPlan.Initial insertInto(DatabaseSchema schema, String table) {
        return (InsertPlan.Initial) defineInsert(schema, "q => q.insertInto(" + quote(table) + ")");
    }

    // ==================== UPDATE ====================

    /**
     * Returns the {@link UpdatePlan} stage matching the defining query: a
     * RETURNING clause wins, then a WHERE clause or the full-table opt-in,
     * then assignments.
     */
    public static FinalizablePlan defineUpdate(DatabaseSchema schema, String query) {
        return defineUpdate(schema, query, ParseOptions.DEFAULT);
    }

    public static FinalizablePlan defineUpdate(DatabaseSchema schema, String query, ParseOptions options) {
        return UpdatePlan.start(initialState(schema, QuerySourceParser.parse(query, options), PlanKind.UPDATE,
            options, "defineUpdate"));
    }

    public static FinalizablePlan defineUpdate(DatabaseSchema schema, ArrowFunctionNode query) {
        return UpdatePlan.start(initialState(schema, QuerySourceParser.parse(query), PlanKind.UPDATE,
            ParseOptions.NO_CACHE, "defineUpdate"));
    }

    public static UpdatePlan.Initial update(DatabaseSchema schema, String table) {
        return (UpdatePlan.Initial) defineUpdate(schema, "q => q.update(" + quote(table) + ")");
    }

    // ==================== DELETE ====================

    public static FinalizablePlan defineDelete(DatabaseSchema schema, String query) {
        return defineDelete(schema, query, ParseOptions.DEFAULT);
    }

    public static FinalizablePlan defineDelete(DatabaseSchema schema, String query, ParseOptions options) {
        return DeletePlan.start(initialState(schema, QuerySourceParser.parse(query, options), PlanKind.DELETE,
            options, "defineDelete"));
    }

    public static FinalizablePlan defineDelete(DatabaseSchema schema, ArrowFunctionNode query) {
        return DeletePlan.start(initialState(schema, QuerySourceParser.parse(query), PlanKind.DELETE,
            ParseOptions.NO_CACHE, "defineDelete"));
    }

    public static DeletePlan.Initial deleteFrom(DatabaseSchema schema, String table) {
        return (DeletePlan.Initial) defineDelete(schema, "q => q.deleteFrom(" + quote(table) + ")");
    }

    // ==================== Internals ====================

    private static PlanState initialState(DatabaseSchema schema, CachedParse parsed, PlanKind expected,
                                          ParseOptions options, String method) {
        Objects.requireNonNull(schema, "schema must not be null");
        String found = parsed.contextSnapshot().statementKind();
        if (!expected.name().toLowerCase(Locale.ROOT).equals(found)) {
            throw new ParseStructureException(
                method + "() requires a " + expected.name() + " query, found " + found,
                ErrorContext.method(method));
        }
        logger.debug("Defined {} plan over {}", expected, parsed.operation().operationType());
        // INSERT never consults row filters
        return new PlanState(expected, parsed.operation(), parsed.autoParams(), parsed.autoParamInfos(),
            parsed.contextSnapshot(), options, expected == PlanKind.INSERT ? null : schema.rowFilters());
    }

    private static String quote(String table) {
        Objects.requireNonNull(table, "table must not be null");
        return "\"" + table.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}

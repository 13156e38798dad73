package com.tinqer.plan;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.TerminalOperation;
import com.tinqer.policy.RowFilterEngine;
import com.tinqer.policy.RowFilterResult;

import java.util.Map;

/**
 * Composable SELECT plan.
 *
 * <p>Every method returns a new handle; this one stays valid and unchanged.
 * Lambdas are given as source text, e.g. {@code plan.where("u => u.age >= 18")}.
 * {@code join}, {@code groupJoin} and {@code selectMany} need the query
 * builder and must be written inside the query passed to
 * {@link Tinqer#defineSelect(com.tinqer.schema.DatabaseSchema, String)}.
 */
public final class SelectPlanHandle implements FinalizablePlan {

    private final PlanState state;

    SelectPlanHandle(PlanState state) {
        this.state = state;
    }

    /**
     * {@link SelectStage#TERMINAL} when the defining query already ended in a
     * terminal operation such as {@code count()}; no further calls are valid then.
     */
    public SelectStage stage() {
        return state.operation() instanceof TerminalOperation ? SelectStage.TERMINAL : SelectStage.QUERY;
    }

    // ==================== Query operations ====================

    public SelectPlanHandle where(String predicate) {
        return where(PlanTransitions.lambda(predicate, "where"));
    }

    public SelectPlanHandle where(ArrowFunctionNode predicate) {
        return next("where", predicate);
    }

    public SelectPlanHandle select(String selector) {
        return next("select", PlanTransitions.lambda(selector, "select"));
    }

    public SelectPlanHandle orderBy(String keySelector) {
        return next("orderBy", PlanTransitions.lambda(keySelector, "orderBy"));
    }

    public SelectPlanHandle orderByDescending(String keySelector) {
        return next("orderByDescending", PlanTransitions.lambda(keySelector, "orderByDescending"));
    }

    public SelectPlanHandle thenBy(String keySelector) {
        return next("thenBy", PlanTransitions.lambda(keySelector, "thenBy"));
    }

    public SelectPlanHandle thenByDescending(String keySelector) {
        return next("thenByDescending", PlanTransitions.lambda(keySelector, "thenByDescending"));
    }

    public SelectPlanHandle take(int count) {
        return next("take", LiteralNode.of(count));
    }

    public SelectPlanHandle skip(int count) {
        return next("skip", LiteralNode.of(count));
    }

    public SelectPlanHandle distinct() {
        return next("distinct");
    }

    public SelectPlanHandle reverse() {
        return next("reverse");
    }

    public SelectPlanHandle groupBy(String keySelector) {
        return next("groupBy", PlanTransitions.lambda(keySelector, "groupBy"));
    }

    // ==================== Terminal operations ====================

    public SelectTerminalHandle count() {
        return terminal("count");
    }

    public SelectTerminalHandle count(String predicate) {
        return terminal("count", predicate);
    }

    public SelectTerminalHandle longCount() {
        return terminal("longCount");
    }

    public SelectTerminalHandle first() {
        return terminal("first");
    }

    public SelectTerminalHandle first(String predicate) {
        return terminal("first", predicate);
    }

    public SelectTerminalHandle firstOrDefault() {
        return terminal("firstOrDefault");
    }

    public SelectTerminalHandle firstOrDefault(String predicate) {
        return terminal("firstOrDefault", predicate);
    }

    public SelectTerminalHandle single() {
        return terminal("single");
    }

    public SelectTerminalHandle single(String predicate) {
        return terminal("single", predicate);
    }

    public SelectTerminalHandle singleOrDefault() {
        return terminal("singleOrDefault");
    }

    public SelectTerminalHandle singleOrDefault(String predicate) {
        return terminal("singleOrDefault", predicate);
    }

    public SelectTerminalHandle last() {
        return terminal("last");
    }

    public SelectTerminalHandle last(String predicate) {
        return terminal("last", predicate);
    }

    public SelectTerminalHandle lastOrDefault() {
        return terminal("lastOrDefault");
    }

    public SelectTerminalHandle lastOrDefault(String predicate) {
        return terminal("lastOrDefault", predicate);
    }

    public SelectTerminalHandle sum(String selector) {
        return terminal("sum", requireSelector(selector, "sum"));
    }

    public SelectTerminalHandle avg(String selector) {
        return terminal("average", requireSelector(selector, "avg"));
    }

    public SelectTerminalHandle min() {
        return terminal("min");
    }

    public SelectTerminalHandle min(String selector) {
        return terminal("min", selector);
    }

    public SelectTerminalHandle max() {
        return terminal("max");
    }

    public SelectTerminalHandle max(String selector) {
        return terminal("max", selector);
    }

    public SelectTerminalHandle any() {
        return terminal("any");
    }

    public SelectTerminalHandle any(String predicate) {
        return terminal("any", predicate);
    }

    public SelectTerminalHandle all(String predicate) {
        return terminal("all", predicate);
    }

    /**
     * Tests whether the projected column contains a value. The value is bound
     * as an auto-parameter.
     */
    public SelectTerminalHandle contains(Object value) {
        return new SelectTerminalHandle(PlanTransitions.append(state, "contains", LiteralNode.of(value)));
    }

    // ==================== Finalize ====================

    @Override
    public FinalizedPlan finalize(Map<String, ?> params) {
        return finalizeSelect(state, params);
    }

    @Override
    public PlanState toPlan() {
        return state;
    }

    static FinalizedPlan finalizeSelect(PlanState state, Map<String, ?> params) {
        RowFilterResult<QueryOperation> filtered = RowFilterEngine.applyToSelect(state.operation(),
            state.rowFilters(), state.mergeParams(params), state.contextSnapshot().autoParamCounter());
        return new FinalizedPlan(PlanKind.SELECT, filtered.operation(), filtered.params(), state.autoParamInfos());
    }

    private SelectPlanHandle next(String method, AstNode... arguments) {
        return new SelectPlanHandle(PlanTransitions.append(state, method, arguments));
    }

    private SelectTerminalHandle terminal(String method) {
        return new SelectTerminalHandle(PlanTransitions.append(state, method));
    }

    private SelectTerminalHandle terminal(String method, String lambda) {
        return new SelectTerminalHandle(PlanTransitions.append(state, method, PlanTransitions.lambda(lambda, method)));
    }

    private static String requireSelector(String selector, String method) {
        if (selector == null) {
            throw new ParseStructureException(method + "() requires a selector function", ErrorContext.method(method));
        }
        return selector;
    }
}

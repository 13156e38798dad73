package com.tinqer.plan;

import com.tinqer.logical.QueryOperation;
import com.tinqer.schema.RowFilterState;
import com.tinqer.visitor.AutoParamInfo;
import com.tinqer.visitor.ContextSnapshot;
import com.tinqer.visitor.VisitorContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable state behind every plan handle.
 *
 * <p>Handles never mutate a state: each fluent call restores a visitor
 * context from {@link #contextSnapshot()}, applies one operation and builds
 * the next state with {@link #next(QueryOperation, VisitorContext)}. IR
 * nodes are immutable records, so states may share subtrees freely.
 *
 * @param kind statement kind
 * @param operation the normalized operation tree
 * @param autoParams auto-parameter values
 * @param autoParamInfos auto-parameter diagnostics
 * @param contextSnapshot visitor state to continue from
 * @param parseOptions options the plan was defined with
 * @param rowFilters the schema's row filters, or null
 */
public record PlanState(PlanKind kind,
                        QueryOperation operation,
                        Map<String, Object> autoParams,
                        Map<String, AutoParamInfo> autoParamInfos,
                        ContextSnapshot contextSnapshot,
                        ParseOptions parseOptions,
                        RowFilterState rowFilters) {

    public PlanState {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(contextSnapshot, "contextSnapshot must not be null");
        autoParams = Collections.unmodifiableMap(new LinkedHashMap<>(autoParams));
        autoParamInfos = Collections.unmodifiableMap(new LinkedHashMap<>(autoParamInfos));
        parseOptions = parseOptions != null ? parseOptions : ParseOptions.DEFAULT;
    }

    /**
     * Builds the state that follows this one.
     *
     * @param nextOperation the normalized operation tree
     * @param ctx the context the operation was visited in
     */
    public PlanState next(QueryOperation nextOperation, VisitorContext ctx) {
        return new PlanState(kind, nextOperation, ctx.getAutoParams(), ctx.getAutoParamInfos(),
            ctx.snapshot(), parseOptions, rowFilters);
    }

    /**
     * Returns the auto-parameters with the caller's parameters merged over them.
     */
    public Map<String, Object> mergeParams(Map<String, ?> params) {
        Map<String, Object> merged = new LinkedHashMap<>(autoParams);
        if (params != null) {
            merged.putAll(params);
        }
        return merged;
    }
}

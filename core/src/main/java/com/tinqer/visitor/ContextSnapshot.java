package com.tinqer.visitor;

import com.tinqer.expression.Expression;
import com.tinqer.logical.ResultShape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable capture of a {@link VisitorContext} between fluent calls.
 *
 * <p>Collections are copied into unmodifiable views; IR values are immutable
 * and shared as-is, so taking or restoring a snapshot never walks a tree.
 */
public record ContextSnapshot(String queryBuilderParam,
                              String helpersParam,
                              Set<String> tableParams,
                              Set<String> queryParams,
                              Map<String, Object> autoParams,
                              Map<String, AutoParamInfo> autoParamInfos,
                              int autoParamCounter,
                              ResultShape currentResultShape,
                              String currentTable,
                              Expression groupKey,
                              String statementKind) {

    public static final ContextSnapshot EMPTY = new ContextSnapshot(
        null, null, Set.of(), Set.of(), Map.of(), Map.of(), 0, null, null, null, null);

    public ContextSnapshot {
        tableParams = Set.copyOf(tableParams);
        queryParams = Set.copyOf(queryParams);
        autoParams = Collections.unmodifiableMap(new LinkedHashMap<>(autoParams));
        autoParamInfos = Collections.unmodifiableMap(new LinkedHashMap<>(autoParamInfos));
    }
}

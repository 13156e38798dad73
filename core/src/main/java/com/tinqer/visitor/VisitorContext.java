package com.tinqer.visitor;

import com.tinqer.exception.ErrorContext;
import com.tinqer.expression.Expression;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.logical.ResultShape;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Working state of one front-end pass.
 *
 * <p>Tracks which lambda parameter names are in scope and what they denote
 * (table rows, query parameters, helpers, groups, join results), mints
 * auto-parameters, and carries the join result shape and GROUP BY key
 * between operations.
 *
 * <p>A context is confined to a single thread for the duration of a pass.
 * Use {@link #snapshot()} and {@link #restore(ContextSnapshot)} to carry
 * state between fluent calls without sharing mutable collections.
 */
public class VisitorContext {

    public static final String AUTO_PARAM_PREFIX = "__p";

    private String queryBuilderParam;
    private String helpersParam;
    private final Set<String> tableParams;
    private final Set<String> queryParams;
    private final Set<String> groupingParams = new HashSet<>();
    private final Map<String, Integer> joinParams = new HashMap<>();
    private String joinResultParam;
    private String upsertExcludedParam;
    private String rowFilterContextParam;
    private String rowFilterParamPrefix;

    private final Map<String, Object> autoParams;
    private final Map<String, AutoParamInfo> autoParamInfos;
    private int autoParamCounter;

    private ResultShape currentResultShape;
    private String currentTable;
    private Expression groupKey;
    private String statementKind;
    private String currentMethod;

    public VisitorContext() {
        this(ContextSnapshot.EMPTY);
    }

    private VisitorContext(ContextSnapshot snapshot) {
        this.queryBuilderParam = snapshot.queryBuilderParam();
        this.helpersParam = snapshot.helpersParam();
        this.tableParams = new HashSet<>(snapshot.tableParams());
        this.queryParams = new HashSet<>(snapshot.queryParams());
        this.autoParams = new LinkedHashMap<>(snapshot.autoParams());
        this.autoParamInfos = new LinkedHashMap<>(snapshot.autoParamInfos());
        this.autoParamCounter = snapshot.autoParamCounter();
        this.currentResultShape = snapshot.currentResultShape();
        this.currentTable = snapshot.currentTable();
        this.groupKey = snapshot.groupKey();
        this.statementKind = snapshot.statementKind();
    }

    /**
     * Creates a fresh context from a snapshot.
     */
    public static VisitorContext restore(ContextSnapshot snapshot) {
        return new VisitorContext(snapshot);
    }

    /**
     * Captures the state that survives between fluent calls. Lambda-local
     * bindings (join, grouping and upsert parameters) are not captured.
     */
    public ContextSnapshot snapshot() {
        return new ContextSnapshot(queryBuilderParam, helpersParam, tableParams, queryParams,
            autoParams, autoParamInfos, autoParamCounter, currentResultShape, currentTable,
            groupKey, statementKind);
    }

    // ==================== Auto-parameters ====================

    /**
     * Mints the next auto-parameter for a literal.
     *
     * @param value the literal value
     * @param fieldName the related column, or null
     * @param sourceTable join table index of the related column, or null
     * @return the placeholder expression
     */
    public ParameterExpression createAutoParam(Object value, String fieldName, Integer sourceTable) {
        autoParamCounter++;
        String name = AUTO_PARAM_PREFIX + autoParamCounter;
        autoParams.put(name, value);
        autoParamInfos.put(name, new AutoParamInfo(value, fieldName, currentTable, sourceTable));
        return ParameterExpression.named(name);
    }

    public Map<String, Object> getAutoParams() {
        return autoParams;
    }

    public Map<String, AutoParamInfo> getAutoParamInfos() {
        return autoParamInfos;
    }

    public int getAutoParamCounter() {
        return autoParamCounter;
    }

    // ==================== Bindings ====================

    public String getQueryBuilderParam() {
        return queryBuilderParam;
    }

    public void setQueryBuilderParam(String name) {
        this.queryBuilderParam = name;
    }

    public String getHelpersParam() {
        return helpersParam;
    }

    public void setHelpersParam(String name) {
        this.helpersParam = name;
    }

    public boolean isQueryBuilder(String name) {
        return name != null && name.equals(queryBuilderParam);
    }

    public boolean isHelpers(String name) {
        return name != null && name.equals(helpersParam);
    }

    public boolean isTableParam(String name) {
        return tableParams.contains(name);
    }

    public void addTableParam(String name) {
        tableParams.add(name);
    }

    public void removeTableParam(String name) {
        tableParams.remove(name);
    }

    public boolean isQueryParam(String name) {
        return queryParams.contains(name);
    }

    public void addQueryParam(String name) {
        queryParams.add(name);
    }

    public void removeQueryParam(String name) {
        queryParams.remove(name);
    }

    public boolean isGroupingParam(String name) {
        return groupingParams.contains(name);
    }

    public void addGroupingParam(String name) {
        groupingParams.add(name);
    }

    public void removeGroupingParam(String name) {
        groupingParams.remove(name);
    }

    public Integer getJoinParamIndex(String name) {
        return joinParams.get(name);
    }

    public void addJoinParam(String name, int tableIndex) {
        joinParams.put(name, tableIndex);
    }

    public void removeJoinParam(String name) {
        joinParams.remove(name);
    }

    public boolean isJoinResultParam(String name) {
        return name != null && name.equals(joinResultParam) && currentResultShape != null;
    }

    public String getJoinResultParam() {
        return joinResultParam;
    }

    public void setJoinResultParam(String name) {
        this.joinResultParam = name;
    }

    public boolean isUpsertExcludedParam(String name) {
        return name != null && name.equals(upsertExcludedParam);
    }

    public void setUpsertExcludedParam(String name) {
        this.upsertExcludedParam = name;
    }

    public boolean isRowFilterContextParam(String name) {
        return name != null && name.equals(rowFilterContextParam);
    }

    public String getRowFilterParamPrefix() {
        return rowFilterParamPrefix;
    }

    /**
     * Binds the context parameter of a row-filter lambda. Properties read
     * from it become parameters named {@code prefix + key}.
     */
    public void setRowFilterContextParam(String name, String prefix) {
        this.rowFilterContextParam = name;
        this.rowFilterParamPrefix = prefix;
    }

    /**
     * Binds the row parameter of a lambda. After a join the row is the join
     * result, after a groupBy it is the group, otherwise a table row.
     */
    public void bindRowParam(String name) {
        if (name == null) {
            return;
        }
        if (groupKey != null) {
            groupingParams.add(name);
        } else if (currentResultShape != null) {
            joinResultParam = name;
        } else {
            tableParams.add(name);
        }
    }

    /**
     * Binds the element parameter of an aggregate or window lambda, which
     * sees the underlying row even inside a group.
     */
    public void bindElementParam(String name) {
        if (name == null) {
            return;
        }
        if (currentResultShape != null) {
            joinResultParam = name;
        } else {
            tableParams.add(name);
        }
    }

    public void unbindRowParam(String name) {
        if (name == null) {
            return;
        }
        groupingParams.remove(name);
        tableParams.remove(name);
        if (name.equals(joinResultParam)) {
            joinResultParam = null;
        }
    }

    // ==================== Query state ====================

    public ResultShape getCurrentResultShape() {
        return currentResultShape;
    }

    public void setCurrentResultShape(ResultShape shape) {
        this.currentResultShape = shape;
    }

    public String getCurrentTable() {
        return currentTable;
    }

    public void setCurrentTable(String table) {
        this.currentTable = table;
    }

    public Expression getGroupKey() {
        return groupKey;
    }

    public void setGroupKey(Expression key) {
        this.groupKey = key;
    }

    public String getStatementKind() {
        return statementKind;
    }

    public void setStatementKind(String kind) {
        this.statementKind = kind;
    }

    public String getCurrentMethod() {
        return currentMethod;
    }

    public void setCurrentMethod(String method) {
        this.currentMethod = method;
    }

    /**
     * Returns the location to attach to errors raised at this point.
     */
    public ErrorContext errorContext() {
        return ErrorContext.of(statementKind, currentTable, currentMethod);
    }
}

package com.tinqer.plan;

import com.tinqer.logical.QueryOperation;
import com.tinqer.visitor.AutoParamInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@code finalize}: the operation tree to generate SQL from and the
 * parameters to bind.
 *
 * @param kind the statement kind
 * @param operation the normalized, row-filtered operation tree
 * @param params auto-parameters, caller parameters and row filter parameters
 * @param autoParamInfos diagnostics per auto-parameter
 */
public record FinalizedPlan(PlanKind kind,
                            QueryOperation operation,
                            Map<String, Object> params,
                            Map<String, AutoParamInfo> autoParamInfos) {

    public FinalizedPlan {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        autoParamInfos = Collections.unmodifiableMap(new LinkedHashMap<>(autoParamInfos));
    }
}

package com.tinqer.runtime;

import com.tinqer.visitor.AutoParamInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SQL text ready for a driver, with the parameters to bind by name.
 *
 * @param sql the statement
 * @param params every placeholder's value, array parameters expanded to
 *               {@code name_0, name_1, ...}
 * @param autoParamInfos where each auto-parameter came from
 */
public record CompiledStatement(String sql,
                                Map<String, Object> params,
                                Map<String, AutoParamInfo> autoParamInfos) {

    public CompiledStatement {
        Objects.requireNonNull(sql, "sql must not be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        autoParamInfos = autoParamInfos != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(autoParamInfos))
            : Collections.emptyMap();
    }
}

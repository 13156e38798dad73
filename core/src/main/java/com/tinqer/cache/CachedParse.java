package com.tinqer.cache;

import com.tinqer.logical.QueryOperation;
import com.tinqer.visitor.AutoParamInfo;
import com.tinqer.visitor.ContextSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of parsing one query source: the normalized operation tree, the
 * auto-parameters minted for its literals, and the visitor state needed to
 * keep composing the query.
 *
 * <p>All parts are immutable, so one entry can back any number of plans on
 * any number of threads.
 */
public record CachedParse(QueryOperation operation,
                          Map<String, Object> autoParams,
                          Map<String, AutoParamInfo> autoParamInfos,
                          ContextSnapshot contextSnapshot) {

    public CachedParse {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(contextSnapshot, "contextSnapshot must not be null");
        autoParams = Collections.unmodifiableMap(new LinkedHashMap<>(autoParams));
        autoParamInfos = Collections.unmodifiableMap(new LinkedHashMap<>(autoParamInfos));
    }
}

package com.tinqer.policy;

import com.tinqer.logical.QueryOperation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Operation tree and parameters after row filters were applied.
 */
public record RowFilterResult<T extends QueryOperation>(T operation, Map<String, Object> params) {

    public RowFilterResult {
        Objects.requireNonNull(operation, "operation must not be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}

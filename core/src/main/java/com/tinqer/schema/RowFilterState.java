package com.tinqer.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Row filters declared on a schema plus the context bound to them.
 *
 * @param filters table name (optionally {@code schema.table}) to filter
 * @param context bound context values, or null when not yet bound
 */
public record RowFilterState(Map<String, TableRowFilter> filters, Map<String, Object> context) {

    public RowFilterState {
        Objects.requireNonNull(filters, "filters must not be null");
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public boolean hasContext() {
        return context != null;
    }

    public RowFilterState withContext(Map<String, Object> newContext) {
        return new RowFilterState(filters, Objects.requireNonNull(newContext, "context must not be null"));
    }
}

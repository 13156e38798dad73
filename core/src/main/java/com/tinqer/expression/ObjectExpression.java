package com.tinqer.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Object projection. Property order is preserved and drives column order in
 * the generated SQL. A spread is stored under {@link #SPREAD_KEY}.
 */
public record ObjectExpression(Map<String, Expression> properties) implements Expression {

    public static final String SPREAD_KEY = "__spread__";

    public ObjectExpression {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Expression get(String key) {
        return properties.get(key);
    }
}

package com.tinqer.expression;

import java.util.Objects;

/**
 * Placeholder bound at execution time.
 *
 * @param param the parameter root, e.g. {@code p} or {@code __p1}
 * @param property the property of the parameter object, may be null
 * @param index array index into the parameter value, may be null
 */
public record ParameterExpression(String param, String property, Integer index) implements ValueExpression {

    public ParameterExpression {
        Objects.requireNonNull(param, "param must not be null");
    }

    public static ParameterExpression named(String name) {
        return new ParameterExpression(name, null, null);
    }

    /**
     * Returns the key this placeholder reads from the parameter map.
     */
    public String bindingName() {
        return property != null ? property : param;
    }

    public ParameterExpression withIndex(int newIndex) {
        return new ParameterExpression(param, property, newIndex);
    }
}

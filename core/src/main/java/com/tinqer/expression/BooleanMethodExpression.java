package com.tinqer.expression;

import java.util.Objects;

/**
 * String test compiled to {@code LIKE}.
 */
public record BooleanMethodExpression(ValueExpression object, Method method, ValueExpression argument)
    implements BooleanExpression {

    public enum Method {
        STARTS_WITH("startsWith"),
        ENDS_WITH("endsWith"),
        INCLUDES("includes"),
        CONTAINS("contains");

        private final String sourceName;

        Method(String sourceName) {
            this.sourceName = sourceName;
        }

        public static Method fromSourceName(String name) {
            for (Method m : values()) {
                if (m.sourceName.equals(name)) {
                    return m;
                }
            }
            return null;
        }
    }

    public BooleanMethodExpression {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }
}

package com.tinqer.expression;

import java.util.Objects;

public record StringMethodExpression(ValueExpression object, Method method) implements ValueExpression {

    public enum Method {
        TO_LOWER_CASE("toLowerCase", "LOWER"),
        TO_UPPER_CASE("toUpperCase", "UPPER");

        private final String sourceName;
        private final String sqlFunction;

        Method(String sourceName, String sqlFunction) {
            this.sourceName = sourceName;
            this.sqlFunction = sqlFunction;
        }

        public String sqlFunction() {
            return sqlFunction;
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

    public StringMethodExpression {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(method, "method must not be null");
    }
}

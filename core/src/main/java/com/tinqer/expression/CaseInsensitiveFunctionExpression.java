package com.tinqer.expression;

import java.util.Objects;

/**
 * Helper function comparing strings without regard to case, compiled with
 * {@code LOWER()} on both sides.
 */
public record CaseInsensitiveFunctionExpression(Function function, ValueExpression left, ValueExpression right)
    implements BooleanExpression {

    public enum Function {
        IEQUALS("iequals"),
        ISTARTS_WITH("istartsWith"),
        IENDS_WITH("iendsWith"),
        ICONTAINS("icontains");

        private final String sourceName;

        Function(String sourceName) {
            this.sourceName = sourceName;
        }

        public static Function fromSourceName(String name) {
            for (Function f : values()) {
                if (f.sourceName.equals(name)) {
                    return f;
                }
            }
            return null;
        }
    }

    public CaseInsensitiveFunctionExpression {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}

package com.tinqer.expression;

/**
 * Inline constant. Literals from query source are auto-parameterized, so in
 * practice this holds {@code null} or {@code undefined}.
 *
 * @param value the constant value
 * @param undefined whether the source said {@code undefined}; such values are
 *                  skipped by INSERT and UPDATE
 */
public record ConstantExpression(Object value, boolean undefined) implements ValueExpression {

    public static final ConstantExpression NULL = new ConstantExpression(null, false);
    public static final ConstantExpression UNDEFINED = new ConstantExpression(null, true);

    public ConstantExpression {
        if (undefined && value != null) {
            throw new IllegalArgumentException("undefined constant cannot carry a value");
        }
    }

    public static ConstantExpression of(Object value) {
        return value == null ? NULL : new ConstantExpression(value, false);
    }

    public boolean isNull() {
        return value == null;
    }
}

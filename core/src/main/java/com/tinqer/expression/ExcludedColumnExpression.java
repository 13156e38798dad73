package com.tinqer.expression;

import java.util.Objects;

/**
 * Column of the row proposed for insertion, available inside
 * {@code ON CONFLICT ... DO UPDATE SET}.
 */
public record ExcludedColumnExpression(String name) implements ValueExpression {

    public ExcludedColumnExpression {
        Objects.requireNonNull(name, "name must not be null");
    }
}

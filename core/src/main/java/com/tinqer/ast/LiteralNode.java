package com.tinqer.ast;

import java.util.Objects;

/**
 * Literal value. Parsed numbers are {@link Long} for integral text and
 * {@link Double} otherwise; host values keep their own type.
 */
public record LiteralNode(Object value, Kind literalKind) implements AstNode {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL,
        /** A host value passed to a plan builder, e.g. a date. Never produced by the parser. */
        VALUE
    }

    public static final LiteralNode NULL = new LiteralNode(null, Kind.NULL);

    public LiteralNode {
        Objects.requireNonNull(literalKind, "literalKind must not be null");
        if (literalKind == Kind.NULL && value != null) {
            throw new IllegalArgumentException("null literal cannot carry a value");
        }
    }

    public static LiteralNode of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof String) {
            return new LiteralNode(value, Kind.STRING);
        }
        if (value instanceof Boolean) {
            return new LiteralNode(value, Kind.BOOLEAN);
        }
        if (value instanceof Number) {
            return new LiteralNode(value, Kind.NUMBER);
        }
        return new LiteralNode(value, Kind.VALUE);
    }

    @Override
    public String toString() {
        return switch (literalKind) {
            case STRING -> "\"" + value + "\"";
            case NULL -> "null";
            default -> String.valueOf(value);
        };
    }
}

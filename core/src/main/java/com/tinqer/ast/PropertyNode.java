package com.tinqer.ast;

import java.util.Objects;

public record PropertyNode(String key, AstNode value) implements AstNode {

    public PropertyNode {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        return key + ": " + value;
    }
}

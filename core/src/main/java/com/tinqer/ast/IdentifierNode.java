package com.tinqer.ast;

import java.util.Objects;

public record IdentifierNode(String name) implements AstNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}

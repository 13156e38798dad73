package com.tinqer.ast;

import java.util.Objects;

public record SpreadNode(AstNode argument) implements AstNode {

    public SpreadNode {
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public String toString() {
        return "..." + argument;
    }
}

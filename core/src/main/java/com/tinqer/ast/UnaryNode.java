package com.tinqer.ast;

import java.util.Objects;

public record UnaryNode(String operator, AstNode argument) implements AstNode {

    public UnaryNode {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public String toString() {
        return operator + argument;
    }
}

package com.tinqer.ast;

import java.util.Objects;

public record ConditionalNode(AstNode test, AstNode consequent, AstNode alternate) implements AstNode {

    public ConditionalNode {
        Objects.requireNonNull(test, "test must not be null");
        Objects.requireNonNull(consequent, "consequent must not be null");
        Objects.requireNonNull(alternate, "alternate must not be null");
    }

    @Override
    public String toString() {
        return "(" + test + " ? " + consequent + " : " + alternate + ")";
    }
}

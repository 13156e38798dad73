package com.tinqer.ast;

/**
 * {@code return expr}; the argument is null for a bare {@code return}.
 */
public record ReturnNode(AstNode argument) implements AstNode {

    @Override
    public String toString() {
        return argument == null ? "return" : "return " + argument;
    }
}

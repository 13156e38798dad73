package com.tinqer.ast;

import java.util.List;

public record BlockNode(List<AstNode> statements) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ ");
        for (AstNode statement : statements) {
            sb.append(statement).append("; ");
        }
        return sb.append('}').toString();
    }
}

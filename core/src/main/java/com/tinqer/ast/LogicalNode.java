package com.tinqer.ast;

import java.util.Objects;

public record LogicalNode(String operator, AstNode left, AstNode right) implements AstNode {

    public LogicalNode {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}

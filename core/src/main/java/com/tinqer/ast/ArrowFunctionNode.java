package com.tinqer.ast;

import java.util.List;
import java.util.Objects;

/**
 * Arrow function {@code (a, b) => body}. The body is either an expression or
 * a {@link BlockNode}.
 */
public record ArrowFunctionNode(List<String> params, AstNode body) implements AstNode {

    public ArrowFunctionNode {
        params = List.copyOf(params);
        Objects.requireNonNull(body, "body must not be null");
    }

    public String param(int index) {
        return index < params.size() ? params.get(index) : null;
    }

    /**
     * Returns the expression the function evaluates to: the body itself, or
     * the argument of the block's first {@code return}. Null when a block has
     * no return value.
     */
    public AstNode returnedExpression() {
        if (body instanceof BlockNode block) {
            for (AstNode statement : block.statements()) {
                if (statement instanceof ReturnNode ret) {
                    return ret.argument();
                }
            }
            return null;
        }
        return body;
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", params) + ") => " + body;
    }
}

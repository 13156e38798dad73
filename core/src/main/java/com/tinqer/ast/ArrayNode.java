package com.tinqer.ast;

import java.util.List;

public record ArrayNode(List<AstNode> elements) implements AstNode {

    public ArrayNode {
        elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}

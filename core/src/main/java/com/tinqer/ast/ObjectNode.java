package com.tinqer.ast;

import java.util.List;

/**
 * Object literal. Members are {@link PropertyNode} or {@link SpreadNode}, in
 * source order.
 */
public record ObjectNode(List<AstNode> members) implements AstNode {

    public ObjectNode {
        members = List.copyOf(members);
        for (AstNode member : members) {
            if (!(member instanceof PropertyNode) && !(member instanceof SpreadNode)) {
                throw new IllegalArgumentException("Object members must be properties or spreads, got " + member.kind());
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(members.get(i));
        }
        return sb.append(" }").toString();
    }
}

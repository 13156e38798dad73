package com.tinqer.ast;

import java.util.List;
import java.util.Objects;

public record CallNode(AstNode callee, List<AstNode> arguments) implements AstNode {

    public CallNode {
        Objects.requireNonNull(callee, "callee must not be null");
        arguments = List.copyOf(arguments);
    }

    /**
     * Returns the method name when the callee is {@code x.name} or a bare identifier.
     */
    public String methodName() {
        if (callee instanceof MemberNode member) {
            return member.propertyName();
        }
        if (callee instanceof IdentifierNode id) {
            return id.name();
        }
        return null;
    }

    /**
     * Returns the receiver of a method call, or null for a bare function call.
     */
    public AstNode receiver() {
        return callee instanceof MemberNode member ? member.object() : null;
    }

    public AstNode argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(callee).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}

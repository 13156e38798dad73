package com.tinqer.ast;

import java.util.Objects;

/**
 * Member access: {@code object.name} or {@code object[expr]}.
 *
 * @param object the accessed object
 * @param property an {@link IdentifierNode} when not computed, any expression otherwise
 * @param computed whether bracket syntax was used
 */
public record MemberNode(AstNode object, AstNode property, boolean computed) implements AstNode {

    public MemberNode {
        Objects.requireNonNull(object, "object must not be null");
        Objects.requireNonNull(property, "property must not be null");
    }

    /**
     * Returns the property name for {@code a.b} access, or for {@code a["b"]}
     * with a string literal; null otherwise.
     */
    public String propertyName() {
        if (!computed && property instanceof IdentifierNode id) {
            return id.name();
        }
        if (computed && property instanceof LiteralNode lit && lit.literalKind() == LiteralNode.Kind.STRING) {
            return (String) lit.value();
        }
        return null;
    }

    @Override
    public String toString() {
        return computed ? object + "[" + property + "]" : object + "." + property;
    }
}

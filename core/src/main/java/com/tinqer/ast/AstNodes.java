package com.tinqer.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building syntax trees by hand.
 *
 * <p>The plan builder uses these to synthesize a single method call on top of
 * a placeholder receiver; callers without source text can use them to build
 * whole query lambdas.
 */
public final class AstNodes {

    private AstNodes() {
    }

    public static IdentifierNode id(String name) {
        return new IdentifierNode(name);
    }

    public static MemberNode member(AstNode object, String property) {
        return new MemberNode(object, new IdentifierNode(property), false);
    }

    public static MemberNode index(AstNode object, AstNode index) {
        return new MemberNode(object, index, true);
    }

    /**
     * Builds a member chain such as {@code u.address.city} from dotted text.
     */
    public static AstNode path(String dotted) {
        String[] parts = dotted.split("\\.");
        AstNode node = id(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            node = member(node, parts[i]);
        }
        return node;
    }

    public static CallNode call(AstNode callee, AstNode... arguments) {
        return new CallNode(callee, Arrays.asList(arguments));
    }

    public static CallNode method(AstNode receiver, String name, AstNode... arguments) {
        return new CallNode(member(receiver, name), Arrays.asList(arguments));
    }

    public static CallNode method(AstNode receiver, String name, List<AstNode> arguments) {
        return new CallNode(member(receiver, name), arguments);
    }

    public static ArrowFunctionNode arrow(List<String> params, AstNode body) {
        return new ArrowFunctionNode(params, body);
    }

    public static ArrowFunctionNode arrow(String param, AstNode body) {
        return new ArrowFunctionNode(List.of(param), body);
    }

    public static LiteralNode literal(Object value) {
        return LiteralNode.of(value);
    }

    public static BinaryNode binary(String operator, AstNode left, AstNode right) {
        return new BinaryNode(operator, left, right);
    }

    public static LogicalNode logical(String operator, AstNode left, AstNode right) {
        return new LogicalNode(operator, left, right);
    }

    public static UnaryNode not(AstNode argument) {
        return new UnaryNode("!", argument);
    }

    public static PropertyNode property(String key, AstNode value) {
        return new PropertyNode(key, value);
    }

    public static ObjectNode object(AstNode... members) {
        return new ObjectNode(Arrays.asList(members));
    }

    public static ArrayNode array(AstNode... elements) {
        return new ArrayNode(Arrays.asList(elements));
    }
}

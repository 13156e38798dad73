package com.tinqer.ast;

/**
 * Generic syntax tree of a query-construction lambda.
 *
 * <p>This is the contract between whatever produces a tree from caller code
 * (the bundled {@link com.tinqer.parser.LambdaSourceParser}, or hand-built
 * trees via {@link AstNodes}) and the visitor framework that compiles it.
 */
public sealed interface AstNode
    permits IdentifierNode, MemberNode, CallNode, ArrowFunctionNode, BlockNode, ReturnNode,
            LiteralNode, BinaryNode, LogicalNode, UnaryNode, ConditionalNode,
            ObjectNode, PropertyNode, SpreadNode, ArrayNode {

    /**
     * Short node kind used in error messages.
     */
    default String kind() {
        return getClass().getSimpleName().replace("Node", "");
    }
}

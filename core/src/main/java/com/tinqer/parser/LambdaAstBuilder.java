package com.tinqer.parser;

import com.tinqer.ast.*;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts an ANTLR4 parse tree of a lambda into the generic {@link AstNode}
 * tree.
 *
 * <p>Binary rules are folded left to right, so {@code a - b - c} becomes
 * {@code (a - b) - c}. Parentheses disappear; grouping is kept by tree shape.
 */
public class LambdaAstBuilder extends LambdaBaseVisitor<AstNode> {

    // ==================== Entry ====================

    @Override
    public AstNode visitProgram(LambdaParser.ProgramContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public AstNode visitExpression(LambdaParser.ExpressionContext ctx) {
        if (ctx.arrowFunction() != null) {
            return visit(ctx.arrowFunction());
        }
        return visit(ctx.conditionalExpression());
    }

    // ==================== Functions ====================

    @Override
    public AstNode visitArrowFunction(LambdaParser.ArrowFunctionContext ctx) {
        List<String> params = new ArrayList<>();
        LambdaParser.ArrowParametersContext paramsCtx = ctx.arrowParameters();
        if (paramsCtx instanceof LambdaParser.SingleParameterContext single) {
            params.add(single.Identifier().getText());
        } else if (paramsCtx instanceof LambdaParser.ParameterListContext list) {
            for (TerminalNode id : list.Identifier()) {
                params.add(id.getText());
            }
        }

        LambdaParser.ArrowBodyContext body = ctx.arrowBody();
        AstNode bodyNode = body.block() != null ? visit(body.block()) : visit(body.expression());
        return new ArrowFunctionNode(params, bodyNode);
    }

    @Override
    public AstNode visitBlock(LambdaParser.BlockContext ctx) {
        List<AstNode> statements = new ArrayList<>();
        for (LambdaParser.StatementContext statement : ctx.statement()) {
            statements.add(visit(statement));
        }
        return new BlockNode(statements);
    }

    @Override
    public AstNode visitStatement(LambdaParser.StatementContext ctx) {
        return new ReturnNode(ctx.expression() != null ? visit(ctx.expression()) : null);
    }

    // ==================== Operators ====================

    @Override
    public AstNode visitConditionalExpression(LambdaParser.ConditionalExpressionContext ctx) {
        AstNode test = visit(ctx.coalesceExpression());
        if (ctx.expression().isEmpty()) {
            return test;
        }
        return new ConditionalNode(test, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public AstNode visitCoalesceExpression(LambdaParser.CoalesceExpressionContext ctx) {
        return foldLogical(ctx);
    }

    @Override
    public AstNode visitLogicalOrExpression(LambdaParser.LogicalOrExpressionContext ctx) {
        return foldLogical(ctx);
    }

    @Override
    public AstNode visitLogicalAndExpression(LambdaParser.LogicalAndExpressionContext ctx) {
        return foldLogical(ctx);
    }

    @Override
    public AstNode visitEqualityExpression(LambdaParser.EqualityExpressionContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public AstNode visitRelationalExpression(LambdaParser.RelationalExpressionContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public AstNode visitAdditiveExpression(LambdaParser.AdditiveExpressionContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public AstNode visitMultiplicativeExpression(LambdaParser.MultiplicativeExpressionContext ctx) {
        return foldBinary(ctx);
    }

    @Override
    public AstNode visitPrefixUnary(LambdaParser.PrefixUnaryContext ctx) {
        return new UnaryNode(ctx.getChild(0).getText(), visit(ctx.unaryExpression()));
    }

    @Override
    public AstNode visitPostfixUnary(LambdaParser.PostfixUnaryContext ctx) {
        return visit(ctx.postfixExpression());
    }

    /**
     * Children alternate operand, operator, operand, ...
     */
    private AstNode foldBinary(ParserRuleContext ctx) {
        AstNode result = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            result = new BinaryNode(ctx.getChild(i).getText(), result, visit(ctx.getChild(i + 1)));
        }
        return result;
    }

    private AstNode foldLogical(ParserRuleContext ctx) {
        AstNode result = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            result = new LogicalNode(ctx.getChild(i).getText(), result, visit(ctx.getChild(i + 1)));
        }
        return result;
    }

    // ==================== Member access and calls ====================

    @Override
    public AstNode visitPostfixExpression(LambdaParser.PostfixExpressionContext ctx) {
        AstNode result = visit(ctx.primary());
        for (LambdaParser.PostfixOperatorContext op : ctx.postfixOperator()) {
            if (op instanceof LambdaParser.MemberAccessContext member) {
                result = new MemberNode(result, new IdentifierNode(member.identifierName().getText()), false);
            } else if (op instanceof LambdaParser.ComputedAccessContext computed) {
                result = new MemberNode(result, visit(computed.expression()), true);
            } else if (op instanceof LambdaParser.CallArgumentsContext call) {
                List<AstNode> args = new ArrayList<>();
                if (call.arguments() != null) {
                    for (LambdaParser.ExpressionContext arg : call.arguments().expression()) {
                        args.add(visit(arg));
                    }
                }
                result = new CallNode(result, args);
            }
        }
        return result;
    }

    // ==================== Primaries ====================

    @Override
    public AstNode visitParenthesized(LambdaParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public AstNode visitLiteralValue(LambdaParser.LiteralValueContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public AstNode visitIdentifier(LambdaParser.IdentifierContext ctx) {
        return new IdentifierNode(ctx.Identifier().getText());
    }

    @Override
    public AstNode visitObjectValue(LambdaParser.ObjectValueContext ctx) {
        return visit(ctx.objectLiteral());
    }

    @Override
    public AstNode visitArrayValue(LambdaParser.ArrayValueContext ctx) {
        return visit(ctx.arrayLiteral());
    }

    @Override
    public AstNode visitObjectLiteral(LambdaParser.ObjectLiteralContext ctx) {
        List<AstNode> members = new ArrayList<>();
        for (LambdaParser.ObjectMemberContext member : ctx.objectMember()) {
            members.add(visit(member));
        }
        return new ObjectNode(members);
    }

    @Override
    public AstNode visitKeyValueMember(LambdaParser.KeyValueMemberContext ctx) {
        LambdaParser.PropertyKeyContext key = ctx.propertyKey();
        String name;
        if (key.StringLiteral() != null) {
            name = unquote(key.StringLiteral().getText());
        } else {
            name = key.getText();
        }
        return new PropertyNode(name, visit(ctx.expression()));
    }

    @Override
    public AstNode visitSpreadMember(LambdaParser.SpreadMemberContext ctx) {
        return new SpreadNode(visit(ctx.expression()));
    }

    @Override
    public AstNode visitShorthandMember(LambdaParser.ShorthandMemberContext ctx) {
        String name = ctx.Identifier().getText();
        return new PropertyNode(name, new IdentifierNode(name));
    }

    @Override
    public AstNode visitArrayLiteral(LambdaParser.ArrayLiteralContext ctx) {
        List<AstNode> elements = new ArrayList<>();
        for (LambdaParser.ExpressionContext element : ctx.expression()) {
            elements.add(visit(element));
        }
        return new ArrayNode(elements);
    }

    @Override
    public AstNode visitLiteral(LambdaParser.LiteralContext ctx) {
        if (ctx.NumericLiteral() != null) {
            return new LiteralNode(parseNumber(ctx.NumericLiteral().getText()), LiteralNode.Kind.NUMBER);
        }
        if (ctx.StringLiteral() != null) {
            return new LiteralNode(unquote(ctx.StringLiteral().getText()), LiteralNode.Kind.STRING);
        }
        if (ctx.TRUE() != null) {
            return new LiteralNode(Boolean.TRUE, LiteralNode.Kind.BOOLEAN);
        }
        if (ctx.FALSE() != null) {
            return new LiteralNode(Boolean.FALSE, LiteralNode.Kind.BOOLEAN);
        }
        return LiteralNode.NULL;
    }

    @Override
    protected AstNode defaultResult() {
        return null;
    }

    @Override
    public AstNode visitChildren(org.antlr.v4.runtime.tree.RuleNode node) {
        if (node.getChildCount() == 1) {
            ParseTree child = node.getChild(0);
            if (!(child instanceof TerminalNode)) {
                return visit(child);
            }
        }
        throw new ParseStructureException(
            "Unsupported syntax: " + node.getText(), ErrorContext.method("parse"));
    }

    // ==================== Helpers ====================

    static Number parseNumber(String text) {
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return Double.parseDouble(text);
        }
        return Long.parseLong(text);
    }

    static String unquote(String quoted) {
        String body = quoted.substring(1, quoted.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '0' -> sb.append('\0');
                case 'u' -> {
                    if (i + 4 < body.length()) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                        i += 4;
                    } else {
                        sb.append(next);
                    }
                }
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}

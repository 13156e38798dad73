package com.tinqer.plan;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.AstNodes;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.ast.ObjectNode;
import com.tinqer.ast.PropertyNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.logical.QueryOperation;
import com.tinqer.optimizer.PlanNormalizer;
import com.tinqer.parser.LambdaSourceParser;
import com.tinqer.visitor.QueryChainVisitor;
import com.tinqer.visitor.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies one fluent call to a plan state.
 */
final class PlanTransitions {

    private static final Logger logger = LoggerFactory.getLogger(PlanTransitions.class);

    /** Receiver of synthesized calls; the visitors never look at it. */
    static final String PLAN_RECEIVER = "__plan";

    private PlanTransitions() {}

    /**
     * Restores the visitor context, visits {@code __plan.method(arguments)}
     * against the current operation and normalizes the result.
     */
    static PlanState append(PlanState state, String method, List<AstNode> arguments) {
        VisitorContext ctx = VisitorContext.restore(state.contextSnapshot());
        CallNode call = AstNodes.method(AstNodes.id(PLAN_RECEIVER), method, arguments);
        QueryOperation next = new QueryChainVisitor(ctx).applyCall(state.operation(), call);
        QueryOperation normalized = PlanNormalizer.getDefault().normalize(next);
        logger.debug("Appended {}() to {} plan", method, state.kind());
        return state.next(normalized, ctx);
    }

    static PlanState append(PlanState state, String method, AstNode... arguments) {
        return append(state, method, List.of(arguments));
    }

    /**
     * Parses lambda source text such as {@code u => u.age >= 18}.
     */
    static ArrowFunctionNode lambda(String source, String label) {
        if (source == null || source.isBlank()) {
            throw new ParseStructureException(label + " expects an arrow function expression", ErrorContext.method(label));
        }
        AstNode node = LambdaSourceParser.getInstance().parse(source);
        if (node instanceof ArrowFunctionNode arrow) {
            return arrow;
        }
        throw new ParseStructureException(label + " expects an arrow function expression", ErrorContext.method(label));
    }

    static List<AstNode> lambdas(String label, String... sources) {
        List<AstNode> result = new ArrayList<>();
        for (String source : sources) {
            result.add(lambda(source, label));
        }
        return result;
    }

    /**
     * Builds an object literal of host values; each value is auto-parameterized
     * by the visitor.
     */
    static ObjectNode objectLiteral(Map<String, ?> values) {
        List<AstNode> members = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            members.add(new PropertyNode(entry.getKey(), LiteralNode.of(entry.getValue())));
        }
        return new ObjectNode(members);
    }
}

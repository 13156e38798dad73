package com.tinqer.visitor;

import com.tinqer.ast.*;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.expression.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Translates lambda bodies into expression IR.
 *
 * <p>Three entry points match the position an expression appears in:
 * {@link #visitBoolean} for predicates, {@link #visitValue} for scalars and
 * {@link #visitExpression} for projections, where objects, arrays and
 * booleans are all allowed. Every literal except {@code null} becomes an
 * auto-parameter.
 */
public class ExpressionVisitor {

    private static final Set<String> COMPARISON_OPERATORS =
        Set.of("==", "===", "!=", "!==", ">", ">=", "<", "<=");

    private static final Set<String> BOOLEAN_METHODS =
        Set.of("startsWith", "endsWith", "includes", "contains");

    private static final Set<String> CASE_INSENSITIVE_FUNCTIONS =
        Set.of("iequals", "istartsWith", "iendsWith", "icontains");

    private static final Set<String> DATE_METHODS =
        Set.of("now", "getTime", "getDate", "getDay", "getFullYear", "getMonth", "getHours",
               "getMinutes", "getSeconds", "setDate", "toISOString");

    private final VisitorContext ctx;
    private final MemberAccessResolver members;

    public ExpressionVisitor(VisitorContext ctx) {
        this.ctx = ctx;
        this.members = new MemberAccessResolver(ctx);
    }

    public VisitorContext context() {
        return ctx;
    }

    public MemberAccessResolver members() {
        return members;
    }

    // ==================== Lambdas ====================

    /**
     * Requires an arrow function argument.
     *
     * @param node the argument
     * @param label method name used in the error message
     */
    public ArrowFunctionNode requireLambda(AstNode node, String label) {
        if (node instanceof ArrowFunctionNode arrow) {
            return arrow;
        }
        throw new ParseStructureException(label + " expects an arrow function expression", ctx.errorContext());
    }

    /**
     * Returns the expression a lambda evaluates to.
     */
    public AstNode lambdaBody(ArrowFunctionNode lambda, String label) {
        AstNode body = lambda.returnedExpression();
        if (body == null) {
            throw new ParseStructureException(label + " lambda must return a value", ctx.errorContext());
        }
        return body;
    }

    /**
     * Visits a lambda over query rows: the first parameter is the row (a
     * table row, join result or group, depending on the chain so far) and an
     * optional second parameter names the query parameters.
     *
     * @param argument the lambda argument
     * @param label method name used in error messages
     * @param body visitor applied to the lambda body while the bindings are active
     */
    public <T> T visitRowLambda(AstNode argument, String label, Function<AstNode, T> body) {
        ArrowFunctionNode lambda = requireLambda(argument, label);
        String row = lambda.param(0);
        String params = lambda.param(1);
        boolean addedParams = params != null && !ctx.isQueryParam(params);
        ctx.bindRowParam(row);
        if (addedParams) {
            ctx.addQueryParam(params);
        }
        try {
            return body.apply(lambdaBody(lambda, label));
        } finally {
            ctx.unbindRowParam(row);
            if (addedParams) {
                ctx.removeQueryParam(params);
            }
        }
    }

    // ==================== Projections ====================

    /**
     * Visits an expression in projection position.
     */
    public Expression visitExpression(AstNode node) {
        if (node instanceof ObjectNode object) {
            return visitObject(object);
        }
        if (node instanceof ArrayNode array) {
            List<Expression> elements = new ArrayList<>();
            for (AstNode element : array.elements()) {
                elements.add(visitExpression(element));
            }
            return new ArrayExpression(elements);
        }
        if (node instanceof IdentifierNode id && ctx.isJoinResultParam(id.name())) {
            return members.shapeToObject(ctx.getCurrentResultShape(), node);
        }
        if (node instanceof MemberNode member) {
            return members.resolve(member);
        }
        if (isBooleanShaped(node)) {
            return visitBoolean(node);
        }
        return visitValue(node);
    }

    /**
     * Visits an object literal. Spreads of a table row become
     * {@link ObjectExpression#SPREAD_KEY}; spreads of a join result inline its fields.
     */
    public ObjectExpression visitObject(ObjectNode node) {
        Map<String, Expression> properties = new LinkedHashMap<>();
        for (AstNode member : node.members()) {
            if (member instanceof PropertyNode property) {
                properties.put(property.key(), visitExpression(property.value()));
            } else {
                AstNode argument = ((SpreadNode) member).argument();
                Expression spread = visitExpression(argument);
                if (spread instanceof ObjectExpression object) {
                    properties.putAll(object.properties());
                } else if (spread instanceof AllColumnsExpression || spread instanceof ReferenceExpression) {
                    String key = ObjectExpression.SPREAD_KEY;
                    int suffix = 1;
                    while (properties.containsKey(key)) {
                        key = ObjectExpression.SPREAD_KEY + suffix++;
                    }
                    properties.put(key, spread);
                } else {
                    throw new ParseStructureException("Unsupported spread: ..." + argument, ctx.errorContext());
                }
            }
        }
        return new ObjectExpression(properties);
    }

    /**
     * Visits the column assignments of {@code values()}, {@code set()} or
     * {@code doUpdateSet()}. Each literal is tagged with the column it is
     * assigned to.
     */
    public ObjectExpression visitAssignments(ObjectNode node, String label) {
        Map<String, Expression> assignments = new LinkedHashMap<>();
        for (AstNode member : node.members()) {
            if (!(member instanceof PropertyNode property)) {
                throw new ParseStructureException(label + " does not support spread assignments", ctx.errorContext());
            }
            AstNode value = property.value();
            if (value instanceof ObjectNode || value instanceof ArrayNode) {
                throw new ParseStructureException(
                    label + " value for column '" + property.key() + "' must be a scalar", ctx.errorContext());
            }
            Expression assigned = isBooleanShaped(value)
                ? visitBoolean(value)
                : visitValue(value, ColumnExpression.of(property.key()));
            assignments.put(property.key(), assigned);
        }
        return new ObjectExpression(assignments);
    }

    // ==================== Values ====================

    public ValueExpression visitValue(AstNode node) {
        return visitValue(node, null);
    }

    /**
     * Visits a scalar expression.
     *
     * @param node the syntax node
     * @param related a column the value is compared with or assigned to, used
     *                for auto-parameter diagnostics; may be null
     */
    public ValueExpression visitValue(AstNode node, ColumnExpression related) {
        if (node instanceof LiteralNode literal) {
            return literalValue(literal, related);
        }
        if (node instanceof IdentifierNode id) {
            return identifierValue(id);
        }
        if (node instanceof MemberNode member) {
            Expression resolved = members.resolve(member);
            if (resolved instanceof ValueExpression value) {
                return value;
            }
            throw new ParseStructureException("Expected a scalar value but found an object: " + node, ctx.errorContext());
        }
        if (node instanceof BinaryNode binary) {
            if (COMPARISON_OPERATORS.contains(binary.operator())) {
                throw new ParseStructureException(
                    "Comparison cannot be used as a value here: " + node, ctx.errorContext());
            }
            return arithmetic(binary);
        }
        if (node instanceof LogicalNode logical && !"&&".equals(logical.operator())) {
            return coalesce(logical);
        }
        if (node instanceof UnaryNode unary) {
            return unaryValue(unary, related);
        }
        if (node instanceof ConditionalNode conditional) {
            return conditional(conditional);
        }
        if (node instanceof CallNode call) {
            return callValue(call);
        }
        throw new ParseStructureException("Unsupported expression: " + node, ctx.errorContext());
    }

    private ValueExpression literalValue(LiteralNode literal, ColumnExpression related) {
        if (literal.literalKind() == LiteralNode.Kind.NULL) {
            return ConstantExpression.NULL;
        }
        return ctx.createAutoParam(literal.value(), related != null ? related.name() : null, sourceIndex(related));
    }

    private ValueExpression identifierValue(IdentifierNode id) {
        String name = id.name();
        if ("undefined".equals(name)) {
            return ConstantExpression.UNDEFINED;
        }
        if (ctx.isQueryParam(name)) {
            return ParameterExpression.named(name);
        }
        if (ctx.isTableParam(name)) {
            return AllColumnsExpression.INSTANCE;
        }
        Integer joinIndex = ctx.getJoinParamIndex(name);
        if (joinIndex != null) {
            return new ReferenceExpression(ColumnSource.joinParam(joinIndex), null);
        }
        throw new ParseStructureException("Unknown identifier '" + name + "'", ctx.errorContext());
    }

    private ValueExpression arithmetic(BinaryNode binary) {
        ArithmeticOperator op = ArithmeticOperator.fromSymbol(binary.operator());
        if (op == null) {
            throw new ParseStructureException("Unsupported operator: " + binary.operator(), ctx.errorContext());
        }
        ValueExpression left = visitValue(binary.left());
        ValueExpression right = visitValue(binary.right(), left instanceof ColumnExpression c ? c : null);
        if (op == ArithmeticOperator.ADD && (isStringValued(left) || isStringValued(right))) {
            return new ConcatExpression(left, right);
        }
        return new ArithmeticExpression(op, left, right);
    }

    /**
     * Whether a value is known to be a string at parse time.
     */
    private boolean isStringValued(ValueExpression value) {
        if (value instanceof ConcatExpression || value instanceof StringMethodExpression) {
            return true;
        }
        if (value instanceof ConstantExpression constant) {
            return constant.value() instanceof String;
        }
        if (value instanceof ParameterExpression param && param.property() == null) {
            return ctx.getAutoParams().get(param.param()) instanceof String;
        }
        return false;
    }

    private ValueExpression coalesce(LogicalNode logical) {
        List<Expression> arguments = new ArrayList<>();
        for (AstNode side : List.of(logical.left(), logical.right())) {
            Expression visited = visitExpression(side);
            if (visited instanceof CoalesceExpression nested) {
                arguments.addAll(nested.expressions());
            } else {
                arguments.add(visited);
            }
        }
        return new CoalesceExpression(arguments);
    }

    private ValueExpression unaryValue(UnaryNode unary, ColumnExpression related) {
        if ("+".equals(unary.operator())) {
            return visitValue(unary.argument(), related);
        }
        if (!"-".equals(unary.operator())) {
            throw new ParseStructureException(
                "Unsupported unary operator in value position: " + unary.operator(), ctx.errorContext());
        }
        if (unary.argument() instanceof LiteralNode literal && literal.value() instanceof Number number) {
            return ctx.createAutoParam(negate(number), related != null ? related.name() : null, sourceIndex(related));
        }
        ValueExpression operand = visitValue(unary.argument(), related);
        return new ArithmeticExpression(ArithmeticOperator.MULTIPLY, ctx.createAutoParam(-1L, null, null), operand);
    }

    private static Number negate(Number number) {
        if (number instanceof Integer i) {
            return -i;
        }
        if (number instanceof Long l) {
            return -l;
        }
        return -number.doubleValue();
    }

    private ValueExpression conditional(ConditionalNode node) {
        List<CaseExpression.WhenClause> clauses = new ArrayList<>();
        clauses.add(new CaseExpression.WhenClause(visitCondition(node.test()), visitExpression(node.consequent())));
        Expression alternate = visitExpression(node.alternate());
        if (alternate instanceof CaseExpression nested && node.alternate() instanceof ConditionalNode) {
            clauses.addAll(nested.conditions());
            return new CaseExpression(clauses, nested.elseResult());
        }
        return new CaseExpression(clauses, alternate);
    }

    /**
     * Visits a ternary test; a bare column or parameter tests for non-null.
     */
    private BooleanExpression visitCondition(AstNode test) {
        if (isBooleanShaped(test)) {
            return visitBoolean(test);
        }
        ValueExpression value = visitValue(test);
        if (value instanceof ParameterExpression param) {
            return new BooleanParameterExpression(param);
        }
        return new IsNullExpression(value, true);
    }

    // ==================== Calls in value position ====================

    private ValueExpression callValue(CallNode call) {
        String method = call.methodName();
        AstNode receiver = call.receiver();

        if (receiver instanceof IdentifierNode id && ctx.isGroupingParam(id.name())) {
            return groupAggregate(call, method);
        }
        if (method != null && DATE_METHODS.contains(method)) {
            throw new ParseStructureException(
                "Unsupported method: " + method + "(). Date arithmetic is not supported.", ctx.errorContext());
        }
        StringMethodExpression.Method stringMethod = StringMethodExpression.Method.fromSourceName(method);
        if (stringMethod != null && receiver != null) {
            return new StringMethodExpression(visitValue(receiver), stringMethod);
        }
        WindowFunctionExpression.Function window = WindowFunctionExpression.Function.fromSourceName(method);
        if (window != null && receiver instanceof CallNode) {
            return windowFunction(call, window);
        }
        throw new ParseStructureException("Unsupported method: " + method + "()", ctx.errorContext());
    }

    private ValueExpression groupAggregate(CallNode call, String method) {
        AggregateExpression.Function function = switch (method == null ? "" : method) {
            case "count" -> AggregateExpression.Function.COUNT;
            case "sum" -> AggregateExpression.Function.SUM;
            case "avg", "average" -> AggregateExpression.Function.AVG;
            case "min" -> AggregateExpression.Function.MIN;
            case "max" -> AggregateExpression.Function.MAX;
            default -> throw new ParseStructureException(
                "Unsupported group method: " + method + "()", ctx.errorContext());
        };
        if (function == AggregateExpression.Function.COUNT) {
            return AggregateExpression.countAll();
        }
        if (call.arguments().isEmpty()) {
            throw new ParseStructureException(method + "() requires a selector function", ctx.errorContext());
        }
        return new AggregateExpression(function, visitElementLambda(call.argument(0), method));
    }

    /**
     * Visits a lambda over the underlying rows, e.g. the selector of
     * {@code g.sum(x => x.amount)} or of a window ordering.
     */
    public ValueExpression visitElementLambda(AstNode argument, String label) {
        ArrowFunctionNode lambda = requireLambda(argument, label + "()");
        String param = lambda.param(0);
        Expression savedGroupKey = ctx.getGroupKey();
        ctx.setGroupKey(null);
        ctx.bindElementParam(param);
        try {
            return visitValue(lambdaBody(lambda, label + "()"));
        } finally {
            ctx.unbindRowParam(param);
            ctx.setGroupKey(savedGroupKey);
        }
    }

    private ValueExpression windowFunction(CallNode call, WindowFunctionExpression.Function function) {
        List<ValueExpression> partitionBy = new ArrayList<>();
        List<WindowFunctionExpression.WindowOrder> orderBy = new ArrayList<>();
        List<CallNode> steps = new ArrayList<>();

        AstNode current = call.receiver();
        while (current instanceof CallNode step) {
            if ("window".equals(step.methodName()) && step.receiver() instanceof IdentifierNode helpers
                && ctx.isHelpers(helpers.name())) {
                break;
            }
            steps.add(0, step);
            current = step.receiver();
        }
        if (!(current instanceof CallNode)) {
            throw new ParseStructureException(
                "Window functions must start with " + ctx.getHelpersParam() + ".window(row)", ctx.errorContext());
        }

        for (CallNode step : steps) {
            String method = step.methodName();
            switch (method == null ? "" : method) {
                case "partitionBy" -> {
                    for (AstNode argument : step.arguments()) {
                        partitionBy.add(visitElementLambda(argument, "partitionBy"));
                    }
                }
                case "orderBy", "thenBy" -> orderBy.add(new WindowFunctionExpression.WindowOrder(
                    visitElementLambda(step.argument(0), method), false));
                case "orderByDescending", "thenByDescending" -> orderBy.add(new WindowFunctionExpression.WindowOrder(
                    visitElementLambda(step.argument(0), method), true));
                default -> throw new ParseStructureException(
                    "Unsupported window method: " + method + "()", ctx.errorContext());
            }
        }
        return new WindowFunctionExpression(function, partitionBy, orderBy);
    }

    // ==================== Predicates ====================

    /**
     * Visits a predicate.
     */
    public BooleanExpression visitBoolean(AstNode node) {
        if (node instanceof BinaryNode binary && COMPARISON_OPERATORS.contains(binary.operator())) {
            return comparison(binary);
        }
        if (node instanceof LogicalNode logical) {
            LogicalOperator op = switch (logical.operator()) {
                case "&&" -> LogicalOperator.AND;
                case "||" -> LogicalOperator.OR;
                default -> throw new ParseStructureException(
                    "Operator " + logical.operator() + " cannot be used as a predicate", ctx.errorContext());
            };
            BooleanExpression left = visitBoolean(logical.left());
            BooleanExpression right = visitBoolean(logical.right());
            return new LogicalExpression(op, left, right);
        }
        if (node instanceof UnaryNode unary && "!".equals(unary.operator())) {
            return new NotExpression(visitBoolean(unary.argument()));
        }
        if (node instanceof LiteralNode literal && literal.literalKind() == LiteralNode.Kind.BOOLEAN) {
            return new BooleanParameterExpression(ctx.createAutoParam(literal.value(), null, null));
        }
        if (node instanceof IdentifierNode id && ctx.isQueryParam(id.name())) {
            return new BooleanParameterExpression(ParameterExpression.named(id.name()));
        }
        if (node instanceof MemberNode member) {
            Expression resolved = members.resolve(member);
            if (resolved instanceof ColumnExpression column) {
                return new BooleanColumnExpression(column);
            }
            if (resolved instanceof ParameterExpression param) {
                return new BooleanParameterExpression(param);
            }
            if (resolved instanceof BooleanExpression bool) {
                return bool;
            }
        }
        if (node instanceof CallNode call) {
            return callBoolean(call);
        }
        throw new ParseStructureException("Expected a boolean expression: " + node, ctx.errorContext());
    }

    private BooleanExpression comparison(BinaryNode binary) {
        ComparisonOperator op = ComparisonOperator.fromSymbol(binary.operator());
        ValueExpression left = visitValue(binary.left());
        ValueExpression right = visitValue(binary.right(), left instanceof ColumnExpression c ? c : null);
        return new ComparisonExpression(op, left, right);
    }

    private BooleanExpression callBoolean(CallNode call) {
        String method = call.methodName();
        AstNode receiver = call.receiver();

        if (method != null && CASE_INSENSITIVE_FUNCTIONS.contains(method) && isHelperFunctionCall(receiver)) {
            if (call.arguments().size() != 2) {
                throw new ParseStructureException(method + " requires two arguments", ctx.errorContext());
            }
            ValueExpression left = visitValue(call.argument(0));
            ValueExpression right = visitValue(call.argument(1), left instanceof ColumnExpression c ? c : null);
            return new CaseInsensitiveFunctionExpression(
                CaseInsensitiveFunctionExpression.Function.fromSourceName(method), left, right);
        }

        if (method != null && BOOLEAN_METHODS.contains(method) && receiver != null) {
            if (call.arguments().isEmpty()) {
                String label = method.equals("startsWith") || method.equals("endsWith") ? method : "includes/contains";
                throw new ParseStructureException(label + " requires an argument", ctx.errorContext());
            }
            if (method.equals("includes") || method.equals("contains")) {
                BooleanExpression membership = membership(receiver, call.argument(0));
                if (membership != null) {
                    return membership;
                }
            }
            ValueExpression object = visitValue(receiver);
            ValueExpression argument = visitValue(call.argument(0), object instanceof ColumnExpression c ? c : null);
            return new BooleanMethodExpression(object, BooleanMethodExpression.Method.fromSourceName(method), argument);
        }

        throw new ParseStructureException("Unsupported method: " + method + "()", ctx.errorContext());
    }

    /**
     * {@code [1, 2].includes(x.id)} and {@code p.ids.includes(x.id)} compile
     * to IN; a column receiver is a string search and returns null.
     */
    private BooleanExpression membership(AstNode receiver, AstNode argument) {
        if (receiver instanceof ArrayNode array) {
            ValueExpression value = visitValue(argument);
            ColumnExpression related = value instanceof ColumnExpression c ? c : null;
            List<Expression> elements = new ArrayList<>();
            for (AstNode element : array.elements()) {
                elements.add(visitValue(element, related));
            }
            return new InExpression(value, new ArrayExpression(elements));
        }
        boolean parameterList = (receiver instanceof IdentifierNode id && ctx.isQueryParam(id.name()))
            || (receiver instanceof MemberNode member && rootIsQueryParam(member));
        if (parameterList) {
            ValueExpression list = visitValue(receiver);
            ValueExpression value = visitValue(argument);
            return new InExpression(value, list);
        }
        return null;
    }

    private boolean rootIsQueryParam(MemberNode member) {
        AstNode current = member;
        while (current instanceof MemberNode m) {
            current = m.object();
        }
        return current instanceof IdentifierNode id && ctx.isQueryParam(id.name());
    }

    /**
     * {@code h.functions.iequals(...)} or {@code h.iequals(...)}.
     */
    private boolean isHelperFunctionCall(AstNode receiver) {
        if (receiver instanceof IdentifierNode id) {
            return ctx.isHelpers(id.name());
        }
        return receiver instanceof MemberNode member
            && "functions".equals(member.propertyName())
            && member.object() instanceof IdentifierNode id
            && ctx.isHelpers(id.name());
    }

    /**
     * Whether a node must be visited as a predicate in projection position.
     */
    boolean isBooleanShaped(AstNode node) {
        if (node instanceof BinaryNode binary) {
            return COMPARISON_OPERATORS.contains(binary.operator());
        }
        if (node instanceof LogicalNode logical) {
            if ("&&".equals(logical.operator())) {
                return true;
            }
            return "||".equals(logical.operator())
                && (isBooleanShaped(logical.left()) || isBooleanShaped(logical.right()));
        }
        if (node instanceof UnaryNode unary) {
            return "!".equals(unary.operator());
        }
        if (node instanceof CallNode call) {
            String method = call.methodName();
            return method != null && (BOOLEAN_METHODS.contains(method)
                || (CASE_INSENSITIVE_FUNCTIONS.contains(method) && isHelperFunctionCall(call.receiver())));
        }
        return false;
    }

    private static Integer sourceIndex(ColumnExpression column) {
        if (column == null) {
            return null;
        }
        if (column.source() instanceof ColumnSource.JoinParam joinParam) {
            return joinParam.paramIndex();
        }
        if (column.source() instanceof ColumnSource.JoinResult joinResult) {
            return joinResult.tableIndex();
        }
        return null;
    }
}

package com.tinqer.visitor;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.IdentifierNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.TerminalOperation;
import com.tinqer.logical.UpdateOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front end of the compiler: walks a query-construction lambda and builds
 * the operation IR.
 *
 * <p>A chain such as {@code q.from("users").where(...).take(10)} is peeled
 * from the outside in; each call first visits its receiver, so operations
 * nearer {@code from} are built first, then hands its arguments to the
 * visitor for that method. Unknown methods are errors, never dropped.
 */
public class QueryChainVisitor {

    private static final Logger logger = LoggerFactory.getLogger(QueryChainVisitor.class);

    private final VisitorContext ctx;
    private final ExpressionVisitor expressions;
    private final FromVisitor fromVisitor;
    private final WhereVisitor whereVisitor;
    private final ProjectionVisitor projectionVisitor;
    private final JoinVisitor joinVisitor;
    private final OrderingVisitor orderingVisitor;
    private final TerminalVisitor terminalVisitor;
    private final InsertVisitor insertVisitor;
    private final UpdateVisitor updateVisitor;
    private final DeleteVisitor deleteVisitor;

    public QueryChainVisitor(VisitorContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionVisitor(ctx);
        this.fromVisitor = new FromVisitor(expressions);
        this.whereVisitor = new WhereVisitor(expressions);
        this.projectionVisitor = new ProjectionVisitor(expressions);
        this.joinVisitor = new JoinVisitor(expressions, this);
        this.orderingVisitor = new OrderingVisitor(expressions);
        this.terminalVisitor = new TerminalVisitor(expressions);
        this.insertVisitor = new InsertVisitor(expressions);
        this.updateVisitor = new UpdateVisitor(expressions);
        this.deleteVisitor = new DeleteVisitor();
    }

    public VisitorContext context() {
        return ctx;
    }

    public ExpressionVisitor expressions() {
        return expressions;
    }

    /**
     * Parses a whole query lambda {@code (q, p, h) => <chain>}.
     *
     * @param root the query lambda
     * @return the operation IR root (the outermost operation of the chain)
     */
    public QueryOperation visitQuery(ArrowFunctionNode root) {
        ctx.setQueryBuilderParam(root.param(0));
        if (root.param(1) != null) {
            ctx.addQueryParam(root.param(1));
        }
        if (root.param(2) != null) {
            ctx.setHelpersParam(root.param(2));
        }
        AstNode body = expressions.lambdaBody(root, "Query");
        QueryOperation operation = visitChain(body);
        logger.debug("Built {} operation with {} auto-parameters",
            operation.operationType(), ctx.getAutoParams().size());
        return operation;
    }

    /**
     * Visits a method chain that must start at the query builder.
     */
    public QueryOperation visitChain(AstNode node) {
        if (!(node instanceof CallNode call)) {
            throw new ParseStructureException(
                "Query must be a method chain starting at " + ctx.getQueryBuilderParam() + ", found " + node.kind(),
                ctx.errorContext());
        }
        QueryMethod method = QueryMethod.fromSourceName(call.methodName());
        if (method != null && method.isRoot() && isBuilderReceiver(call.receiver())) {
            ctx.setCurrentMethod(method.sourceName());
            return fromVisitor.visit(method, call);
        }
        if (call.receiver() == null) {
            throw new ParseStructureException("Unsupported call: " + call, ctx.errorContext());
        }
        QueryOperation source = visitChain(call.receiver());
        return applyCall(source, call);
    }

    private boolean isBuilderReceiver(AstNode receiver) {
        // bare from("users") is the DSL form without a builder parameter
        return receiver == null || (receiver instanceof IdentifierNode id && ctx.isQueryBuilder(id.name()));
    }

    /**
     * Applies one method call to an already-built source operation.
     *
     * @param source the operation the call is chained onto
     * @param call the call; its receiver is ignored
     * @return the new outermost operation
     */
    public QueryOperation applyCall(QueryOperation source, CallNode call) {
        String name = call.methodName();
        QueryMethod method = QueryMethod.fromSourceName(name);
        ctx.setCurrentMethod(name);
        if (method == null || method.isRoot()) {
            throw new ParseStructureException("Unsupported method: " + name + "()", ctx.errorContext());
        }
        if (source instanceof TerminalOperation terminal) {
            throw new ParseStructureException(
                name + "() cannot follow terminal operation " + terminal.operationType() + "()", ctx.errorContext());
        }

        return switch (method) {
            case WHERE -> whereVisitor.visit(source, call);
            case SELECT -> projectionVisitor.visitSelect(requireSelect(source, name), call);
            case GROUP_BY -> projectionVisitor.visitGroupBy(requireSelect(source, name), call);
            case JOIN -> joinVisitor.visitJoin(requireSelect(source, name), call);
            case GROUP_JOIN -> joinVisitor.visitGroupJoin(requireSelect(source, name), call);
            case SELECT_MANY -> joinVisitor.visitSelectMany(requireSelect(source, name), call);
            case DEFAULT_IF_EMPTY -> joinVisitor.visitDefaultIfEmpty(requireSelect(source, name));
            case ORDER_BY -> orderingVisitor.visitOrderBy(requireSelect(source, name), call, false);
            case ORDER_BY_DESCENDING -> orderingVisitor.visitOrderBy(requireSelect(source, name), call, true);
            case THEN_BY -> orderingVisitor.visitThenBy(requireSelect(source, name), call, false);
            case THEN_BY_DESCENDING -> orderingVisitor.visitThenBy(requireSelect(source, name), call, true);
            case DISTINCT -> orderingVisitor.visitDistinct(requireSelect(source, name));
            case REVERSE -> orderingVisitor.visitReverse(requireSelect(source, name));
            case TAKE -> orderingVisitor.visitTake(requireSelect(source, name), call);
            case SKIP -> orderingVisitor.visitSkip(requireSelect(source, name), call);
            case FIRST, FIRST_OR_DEFAULT, SINGLE, SINGLE_OR_DEFAULT, LAST, LAST_OR_DEFAULT, ANY, ALL,
                 CONTAINS, COUNT, LONG_COUNT, SUM, AVERAGE, AVG, MIN, MAX ->
                terminalVisitor.visit(method, requireSelect(source, name), call);
            case VALUES -> insertVisitor.visitValues(requireInsert(source, name), call);
            case ON_CONFLICT -> insertVisitor.visitOnConflict(requireInsert(source, name), call);
            case DO_NOTHING -> insertVisitor.visitDoNothing(requireInsert(source, name));
            case DO_UPDATE_SET -> insertVisitor.visitDoUpdateSet(requireInsert(source, name), call);
            case RETURNING -> visitReturning(source, call);
            case SET -> updateVisitor.visitSet(requireUpdate(source, name), call);
            case ALLOW_FULL_TABLE_UPDATE -> updateVisitor.visitAllowFullTableUpdate(requireUpdate(source, name));
            case ALLOW_FULL_TABLE_DELETE -> deleteVisitor.visitAllowFullTableDelete(requireDelete(source, name));
            case FROM, INSERT_INTO, UPDATE, DELETE_FROM ->
                throw new ParseStructureException(name + "() must start a query", ctx.errorContext());
        };
    }

    private QueryOperation visitReturning(QueryOperation source, CallNode call) {
        if (source instanceof InsertOperation insert) {
            return insertVisitor.visitReturning(insert, call);
        }
        if (source instanceof UpdateOperation update) {
            return updateVisitor.visitReturning(update, call);
        }
        throw new ParseStructureException(
            "returning() can only be called on INSERT or UPDATE operations", ctx.errorContext());
    }

    private QueryOperation requireSelect(QueryOperation source, String method) {
        if (source instanceof InsertOperation || source instanceof UpdateOperation || source instanceof DeleteOperation) {
            throw new ParseStructureException(
                method + "() cannot be used on " + source.operationType().toUpperCase() + " statements",
                ctx.errorContext());
        }
        return source;
    }

    private InsertOperation requireInsert(QueryOperation source, String method) {
        if (source instanceof InsertOperation insert) {
            return insert;
        }
        throw new ParseStructureException(method + "() can only be called on INSERT operations", ctx.errorContext());
    }

    private UpdateOperation requireUpdate(QueryOperation source, String method) {
        if (source instanceof UpdateOperation update) {
            return update;
        }
        throw new ParseStructureException(method + "() can only be called on UPDATE operations", ctx.errorContext());
    }

    private DeleteOperation requireDelete(QueryOperation source, String method) {
        if (source instanceof DeleteOperation delete) {
            return delete;
        }
        throw new ParseStructureException(method + "() can only be called on DELETE operations", ctx.errorContext());
    }
}

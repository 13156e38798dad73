package com.tinqer.logical;

/**
 * Typed rewrite fold over the operation IR.
 *
 * <p>The base implementation rebuilds every node with rewritten children:
 * sources, join inners, selectMany collections and from-subqueries.
 * Subclasses override the node kinds they transform.
 */
public abstract class OperationRewriter {

    public QueryOperation rewrite(QueryOperation operation) {
        if (operation == null) {
            return null;
        }
        if (operation instanceof FromOperation from) {
            return rewriteFrom(from);
        }
        if (operation instanceof JoinOperation join) {
            return rewriteJoin(join);
        }
        if (operation instanceof GroupJoinOperation groupJoin) {
            return rewriteGroupJoin(groupJoin);
        }
        if (operation instanceof SelectManyOperation selectMany) {
            return rewriteSelectMany(selectMany);
        }
        return rewriteDefault(operation);
    }

    protected QueryOperation rewriteFrom(FromOperation from) {
        if (from.subquery() != null) {
            return from.withSubquery(rewrite(from.subquery()));
        }
        return from;
    }

    protected QueryOperation rewriteJoin(JoinOperation join) {
        return ((JoinOperation) join.withSource(rewrite(join.source()))).withInner(rewrite(join.inner()));
    }

    protected QueryOperation rewriteGroupJoin(GroupJoinOperation groupJoin) {
        return ((GroupJoinOperation) groupJoin.withSource(rewrite(groupJoin.source())))
            .withInner(rewrite(groupJoin.inner()));
    }

    protected QueryOperation rewriteSelectMany(SelectManyOperation selectMany) {
        return ((SelectManyOperation) selectMany.withSource(rewrite(selectMany.source())))
            .withCollection(rewrite(selectMany.collection()));
    }

    protected QueryOperation rewriteDefault(QueryOperation operation) {
        QueryOperation source = operation.source();
        if (source == null) {
            return operation;
        }
        return operation.withSource(rewrite(source));
    }
}

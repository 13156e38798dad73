package com.tinqer.optimizer;

import com.tinqer.logical.DefaultIfEmptyOperation;
import com.tinqer.logical.GroupJoinOperation;
import com.tinqer.logical.JoinOperation;
import com.tinqer.logical.JoinType;
import com.tinqer.logical.OperationRewriter;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.SelectManyOperation;

/**
 * Rewrites {@code selectMany} into joins.
 *
 * <pre>
 *   SelectMany(GroupJoin(outer, inner), DefaultIfEmpty(inner)) -> Join(outer, inner, LEFT)
 *   SelectMany(GroupJoin(outer, inner), inner)                 -> Join(outer, inner, INNER)
 *   SelectMany(outer, independentQuery)                        -> Join(outer, independentQuery, CROSS)
 * </pre>
 *
 * <p>The join takes the selectMany's result selector and shape, so member
 * access resolved against the flattened result keeps pointing at the same
 * tables.
 */
public class JoinNormalizationRule extends OperationRewriter implements NormalizationRule {

    @Override
    public QueryOperation apply(QueryOperation operation) {
        return rewrite(operation);
    }

    @Override
    protected QueryOperation rewriteSelectMany(SelectManyOperation selectMany) {
        QueryOperation collection = rewrite(selectMany.collection());

        if (selectMany.source() instanceof GroupJoinOperation groupJoin) {
            QueryOperation outer = rewrite(groupJoin.source());
            JoinType joinType = JoinType.INNER;
            QueryOperation inner = collection;
            if (collection instanceof DefaultIfEmptyOperation defaultIfEmpty) {
                joinType = JoinType.LEFT;
                inner = defaultIfEmpty.source();
            }
            return new JoinOperation(outer, inner, groupJoin.outerKey(), groupJoin.innerKey(),
                groupJoin.outerKeySource(), selectMany.resultSelector(), selectMany.resultShape(), joinType);
        }

        QueryOperation inner = collection instanceof DefaultIfEmptyOperation defaultIfEmpty
            ? defaultIfEmpty.source()
            : collection;
        return new JoinOperation(rewrite(selectMany.source()), inner, null, null, null,
            selectMany.resultSelector(), selectMany.resultShape(), JoinType.CROSS);
    }
}

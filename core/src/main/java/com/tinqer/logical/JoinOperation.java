package com.tinqer.logical;

import com.tinqer.expression.Expression;

import java.util.Objects;

/**
 * Join of the source chain with an inner query.
 *
 * @param source the outer query
 * @param inner the inner query
 * @param outerKey outer key column, null for a cross join
 * @param innerKey inner key column, null for a cross join
 * @param outerKeySource index of the table in an accumulated join result
 *                       that holds the outer key, or null when the outer side
 *                       is a single table
 * @param resultSelector projection of {@code (outer, inner)}, may be null
 * @param resultShape shape of the join result, used to resolve later member access
 * @param joinType kind of join
 */
public record JoinOperation(QueryOperation source,
                            QueryOperation inner,
                            String outerKey,
                            String innerKey,
                            Integer outerKeySource,
                            Expression resultSelector,
                            ResultShape resultShape,
                            JoinType joinType) implements QueryOperation {

    public JoinOperation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(inner, "inner must not be null");
        joinType = joinType != null ? joinType : JoinType.INNER;
        if (joinType != JoinType.CROSS && (outerKey == null || innerKey == null)) {
            throw new IllegalArgumentException(joinType + " join requires outer and inner keys");
        }
    }

    @Override
    public String operationType() {
        return "join";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new JoinOperation(newSource, inner, outerKey, innerKey, outerKeySource,
            resultSelector, resultShape, joinType);
    }

    public JoinOperation withInner(QueryOperation newInner) {
        return new JoinOperation(source, newInner, outerKey, innerKey, outerKeySource,
            resultSelector, resultShape, joinType);
    }
}

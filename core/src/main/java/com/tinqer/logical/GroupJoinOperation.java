package com.tinqer.logical;

import com.tinqer.expression.Expression;

import java.util.Objects;

/**
 * Group join: pairs each outer row with the group of matching inner rows.
 * Only meaningful when followed by {@code selectMany}; join normalization
 * rewrites the pair into a {@link JoinOperation}.
 */
public record GroupJoinOperation(QueryOperation source,
                                 QueryOperation inner,
                                 String outerKey,
                                 String innerKey,
                                 Integer outerKeySource,
                                 Expression resultSelector,
                                 ResultShape resultShape,
                                 String groupProperty) implements QueryOperation {

    public GroupJoinOperation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(inner, "inner must not be null");
        Objects.requireNonNull(outerKey, "outerKey must not be null");
        Objects.requireNonNull(innerKey, "innerKey must not be null");
    }

    @Override
    public String operationType() {
        return "groupJoin";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new GroupJoinOperation(newSource, inner, outerKey, innerKey, outerKeySource,
            resultSelector, resultShape, groupProperty);
    }

    public GroupJoinOperation withInner(QueryOperation newInner) {
        return new GroupJoinOperation(source, newInner, outerKey, innerKey, outerKeySource,
            resultSelector, resultShape, groupProperty);
    }
}

package com.tinqer.logical;

import com.tinqer.expression.Expression;

import java.util.Objects;

/**
 * Flattens a collection per source row.
 *
 * @param source the outer query
 * @param collection the flattened collection: the group of a preceding
 *                   group join (optionally under {@code defaultIfEmpty}), or
 *                   an independent query
 * @param resultSelector projection of {@code (outer, item)}, may be null
 * @param resultShape shape of the result
 */
public record SelectManyOperation(QueryOperation source,
                                  QueryOperation collection,
                                  Expression resultSelector,
                                  ResultShape resultShape) implements QueryOperation {

    public SelectManyOperation {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
    }

    @Override
    public String operationType() {
        return "selectMany";
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return new SelectManyOperation(newSource, collection, resultSelector, resultShape);
    }

    public SelectManyOperation withCollection(QueryOperation newCollection) {
        return new SelectManyOperation(source, newCollection, resultSelector, resultShape);
    }
}

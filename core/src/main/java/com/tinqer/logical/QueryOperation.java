package com.tinqer.logical;

/**
 * Base of the operation IR.
 *
 * <p>A query is a chain of operations linked through {@link #source()} back to
 * a root ({@code from}, {@code insert}, {@code update} or {@code delete}).
 * Joins add a second child, the inner query. All implementations are
 * immutable records.
 */
public sealed interface QueryOperation
    permits FromOperation, WhereOperation, SelectOperation, JoinOperation, GroupJoinOperation,
            SelectManyOperation, DefaultIfEmptyOperation, GroupByOperation, OrderByOperation,
            ThenByOperation, DistinctOperation, TakeOperation, SkipOperation, ReverseOperation,
            TerminalOperation, InsertOperation, UpdateOperation, DeleteOperation {

    /**
     * Returns the operation name as written in query source, e.g. "where" or
     * "firstOrDefault".
     */
    String operationType();

    /**
     * Returns the preceding operation, or null at a root.
     */
    QueryOperation source();

    /**
     * Returns a copy of this operation chained onto a different source. Roots
     * return themselves.
     */
    QueryOperation withSource(QueryOperation newSource);
}

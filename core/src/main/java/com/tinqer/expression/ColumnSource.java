package com.tinqer.expression;

/**
 * Where a column reference comes from. The generator maps each variant to a
 * table alias.
 */
public sealed interface ColumnSource {

    Direct DIRECT = new Direct();

    /** Unqualified access on the single table in scope. */
    record Direct() implements ColumnSource {
    }

    /** Explicit table alias. */
    record TableAlias(String alias) implements ColumnSource {
    }

    /** Parameter {@code paramIndex} of a join result selector (0 = outer, 1 = inner). */
    record JoinParam(int paramIndex) implements ColumnSource {
    }

    /** Table {@code tableIndex} within an accumulated join result. */
    record JoinResult(int tableIndex) implements ColumnSource {
    }

    /** Table whose columns were spread into a projection. */
    record Spread(int sourceIndex) implements ColumnSource {
    }

    static ColumnSource joinParam(int index) {
        return new JoinParam(index);
    }

    static ColumnSource joinResult(int index) {
        return new JoinResult(index);
    }
}

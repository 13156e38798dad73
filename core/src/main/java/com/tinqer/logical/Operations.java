package com.tinqer.logical;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only helpers over operation chains.
 */
public final class Operations {

    private Operations() {
    }

    /**
     * Flattens a chain from the given operation back to its root, outermost
     * first. A {@code from} over a subquery ends the chain; the subquery is
     * a separate statement.
     */
    public static List<QueryOperation> chain(QueryOperation operation) {
        List<QueryOperation> operations = new ArrayList<>();
        QueryOperation current = operation;
        while (current != null) {
            operations.add(current);
            if (current instanceof FromOperation) {
                break;
            }
            current = current.source();
        }
        return operations;
    }

    /**
     * Returns the outermost operation of the given type in the chain, or null.
     */
    public static <T extends QueryOperation> T find(QueryOperation operation, Class<T> type) {
        for (QueryOperation op : chain(operation)) {
            if (type.isInstance(op)) {
                return type.cast(op);
            }
        }
        return null;
    }

    /**
     * Returns every operation of the given type, innermost (closest to the
     * root) first.
     */
    public static <T extends QueryOperation> List<T> findAll(QueryOperation operation, Class<T> type) {
        List<T> result = new ArrayList<>();
        List<QueryOperation> operations = chain(operation);
        for (int i = operations.size() - 1; i >= 0; i--) {
            QueryOperation op = operations.get(i);
            if (type.isInstance(op)) {
                result.add(type.cast(op));
            }
        }
        return result;
    }

    /**
     * Returns the root {@code from} of a chain, or null for statements.
     */
    public static FromOperation root(QueryOperation operation) {
        List<QueryOperation> operations = chain(operation);
        QueryOperation last = operations.get(operations.size() - 1);
        return last instanceof FromOperation from ? from : null;
    }

    /**
     * Number of tables the chain joins together: the root plus one per join,
     * group join or independent selectMany. Table indices in join shapes count in the
     * same order.
     */
    public static int tableCount(QueryOperation operation) {
        int count = 1;
        for (QueryOperation op : chain(operation)) {
            if (op instanceof JoinOperation || op instanceof GroupJoinOperation) {
                count++;
            } else if (op instanceof SelectManyOperation selectMany && !(selectMany.source() instanceof GroupJoinOperation)) {
                // flattening a group join reuses the group join's table
                count++;
            }
        }
        return count;
    }
}

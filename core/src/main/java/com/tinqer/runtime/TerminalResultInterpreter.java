package com.tinqer.runtime;

import com.tinqer.logical.AllOperation;
import com.tinqer.logical.AnyOperation;
import com.tinqer.logical.AverageOperation;
import com.tinqer.logical.ContainsOperation;
import com.tinqer.logical.CountOperation;
import com.tinqer.logical.FirstOperation;
import com.tinqer.logical.LastOperation;
import com.tinqer.logical.MaxOperation;
import com.tinqer.logical.MinOperation;
import com.tinqer.logical.QueryOperation;
import com.tinqer.logical.SingleOperation;
import com.tinqer.logical.SumOperation;
import com.tinqer.plan.FinalizedPlan;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Interprets the rows a driver returned for a compiled SELECT according to
 * the plan's terminal operation.
 *
 * <p>Rows are maps from column label to value in column order, as most JDBC
 * row mappers produce them.
 * <ul>
 *   <li>{@code first}, {@code single}, {@code last}: the row, or null for the
 *       {@code OrDefault} variants when there is none</li>
 *   <li>{@code count}, {@code longCount}: a {@code Long}</li>
 *   <li>{@code sum}, {@code average}, {@code min}, {@code max}: the first
 *       column, or null when there are no rows</li>
 *   <li>{@code any}, {@code all}, {@code contains}: a {@code Boolean}</li>
 *   <li>anything else: the row list unchanged</li>
 * </ul>
 */
public final class TerminalResultInterpreter {

    private TerminalResultInterpreter() {}

    public static Object interpret(FinalizedPlan plan, List<Map<String, Object>> rows) {
        return interpret(plan.operation(), rows);
    }

    /**
     * @throws NoSuchElementException if {@code first}, {@code single} or
     *         {@code last} found no row
     * @throws IllegalStateException if {@code single} found more than one row
     */
    public static Object interpret(QueryOperation operation, List<Map<String, Object>> rows) {
        String op = operation.operationType();
        if (operation instanceof FirstOperation || operation instanceof SingleOperation
            || operation instanceof LastOperation) {
            if (rows.isEmpty()) {
                if (op.endsWith("OrDefault")) {
                    return null;
                }
                throw new NoSuchElementException("No elements found for " + op + " operation");
            }
            if (operation instanceof SingleOperation && rows.size() > 1) {
                throw new IllegalStateException("Multiple elements found for " + op + " operation");
            }
            // last() already reversed the ordering, the wanted row is the final one fetched
            return operation instanceof LastOperation ? rows.get(rows.size() - 1) : rows.get(0);
        }
        if (operation instanceof CountOperation) {
            Object value = firstColumn(rows);
            return value instanceof Number ? ((Number) value).longValue() : 0L;
        }
        if (operation instanceof SumOperation || operation instanceof AverageOperation
            || operation instanceof MinOperation || operation instanceof MaxOperation) {
            return firstColumn(rows);
        }
        if (operation instanceof AnyOperation || operation instanceof AllOperation
            || operation instanceof ContainsOperation) {
            return toBoolean(firstColumn(rows));
        }
        return rows;
    }

    private static Object firstColumn(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return null;
        }
        Iterator<Object> values = rows.get(0).values().iterator();
        return values.hasNext() ? values.next() : null;
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            String text = (String) value;
            if ("0".equals(text)) {
                return false;
            }
            return !text.isEmpty();
        }
        return value != null;
    }
}

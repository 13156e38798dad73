package com.tinqer.logical;

import com.tinqer.expression.ObjectExpression;

import java.util.List;

/**
 * {@code ON CONFLICT (target) DO ...} clause of an INSERT.
 *
 * @param target conflict target columns, never empty
 * @param action the action, null until {@code doNothing()} or {@code doUpdateSet()} is called
 */
public record OnConflict(List<String> target, Action action) {

    public sealed interface Action {
    }

    public record DoNothing() implements Action {
        public static final DoNothing INSTANCE = new DoNothing();
    }

    /**
     * @param assignments column to value; values may reference excluded columns
     */
    public record DoUpdate(ObjectExpression assignments) implements Action {
    }

    public OnConflict {
        target = List.copyOf(target);
        if (target.isEmpty()) {
            throw new IllegalArgumentException("ON CONFLICT requires at least one target column");
        }
    }

    public OnConflict withAction(Action newAction) {
        return new OnConflict(target, newAction);
    }
}

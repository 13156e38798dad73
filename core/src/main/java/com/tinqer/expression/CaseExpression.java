package com.tinqer.expression;

import java.util.List;
import java.util.Objects;

/**
 * {@code CASE WHEN ... THEN ... ELSE ... END}, produced from ternaries.
 */
public record CaseExpression(List<WhenClause> conditions, Expression elseResult) implements ValueExpression {

    public record WhenClause(BooleanExpression when, Expression then) {
        public WhenClause {
            Objects.requireNonNull(when, "when must not be null");
            Objects.requireNonNull(then, "then must not be null");
        }
    }

    public CaseExpression {
        conditions = List.copyOf(conditions);
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN clause");
        }
    }
}

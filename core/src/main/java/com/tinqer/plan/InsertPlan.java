package com.tinqer.plan;

import com.tinqer.ast.AstNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.logical.InsertOperation;

import java.util.Map;

/**
 * Staged handles of an INSERT plan.
 *
 * <pre>
 *   Initial --values--> WithValues --onConflict--> WithConflictTarget --doNothing/doUpdateSet--> WithValues
 *                       WithValues --returning--> WithReturning
 * </pre>
 *
 * <p>Only {@link WithValues} and {@link WithReturning} produce a usable
 * plan; the other stages throw from {@code finalize}. INSERT is never row
 * filtered.
 */
public final class InsertPlan {

    private InsertPlan() {}

    static FinalizablePlan start(PlanState state) {
        InsertOperation insert = (InsertOperation) state.operation();
        if (insert.returning() != null) {
            return new WithReturning(state);
        }
        if (insert.onConflict() != null && insert.onConflict().action() == null) {
            return new WithConflictTarget(state);
        }
        if (insert.values() != null && !insert.values().properties().isEmpty()) {
            return new WithValues(state);
        }
        return new Initial(state);
    }

    private static FinalizedPlan finalizeInsert(PlanState state, Map<String, ?> params) {
        return new FinalizedPlan(PlanKind.INSERT, state.operation(), state.mergeParams(params), state.autoParamInfos());
    }

    /** Table chosen, no values yet. */
    public static final class Initial implements FinalizablePlan {

        private final PlanState state;

        Initial(PlanState state) {
            this.state = state;
        }

        public InsertStage stage() {
            return InsertStage.INITIAL;
        }

        /**
         * Sets the values to insert. Each value is bound as an auto-parameter;
         * a null value inserts SQL NULL.
         */
        public WithValues values(Map<String, ?> values) {
            return new WithValues(PlanTransitions.append(state, "values", PlanTransitions.objectLiteral(values)));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            throw new SemanticPolicyException("INSERT statement requires values() to be called before generating SQL",
                ErrorContext.of("insert", ((InsertOperation) state.operation()).table(), "finalize"));
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** Values set; may add an upsert clause or RETURNING. */
    public static final class WithValues implements FinalizablePlan {

        private final PlanState state;

        WithValues(PlanState state) {
            this.state = state;
        }

        public InsertStage stage() {
            return InsertStage.WITH_VALUES;
        }

        /**
         * Starts an upsert on the given conflict target columns, e.g.
         * {@code onConflict("u => u.email")}.
         */
        public WithConflictTarget onConflict(String target, String... additionalTargets) {
            String[] targets = new String[additionalTargets.length + 1];
            targets[0] = target;
            System.arraycopy(additionalTargets, 0, targets, 1, additionalTargets.length);
            return new WithConflictTarget(
                PlanTransitions.append(state, "onConflict", PlanTransitions.lambdas("onConflict", targets)));
        }

        public WithReturning returning(String selector) {
            return new WithReturning(
                PlanTransitions.append(state, "returning", PlanTransitions.lambda(selector, "returning")));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            return finalizeInsert(state, params);
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** Conflict target set; an action must follow. */
    public static final class WithConflictTarget implements FinalizablePlan {

        private final PlanState state;

        WithConflictTarget(PlanState state) {
            this.state = state;
        }

        public InsertStage stage() {
            return InsertStage.WITH_CONFLICT_TARGET;
        }

        public WithValues doNothing() {
            return new WithValues(PlanTransitions.append(state, "doNothing"));
        }

        /**
         * Sets the columns to update on conflict from host values.
         */
        public WithValues doUpdateSet(Map<String, ?> values) {
            return doUpdateSet(PlanTransitions.objectLiteral(values));
        }

        /**
         * Sets the columns to update on conflict from a lambda such as
         * {@code (existing, excluded) => ({ name: excluded.name })}.
         */
        public WithValues doUpdateSet(String selector) {
            return doUpdateSet(PlanTransitions.lambda(selector, "doUpdateSet"));
        }

        private WithValues doUpdateSet(AstNode argument) {
            return new WithValues(PlanTransitions.append(state, "doUpdateSet", argument));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            throw new SemanticPolicyException("INSERT upsert requires doNothing() or doUpdateSet() before generating SQL",
                ErrorContext.of("insert", ((InsertOperation) state.operation()).table(), "finalize"));
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** RETURNING set; only finalize remains. */
    public static final class WithReturning implements FinalizablePlan {

        private final PlanState state;

        WithReturning(PlanState state) {
            this.state = state;
        }

        public InsertStage stage() {
            return InsertStage.WITH_RETURNING;
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            return finalizeInsert(state, params);
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }
}

package com.tinqer.plan;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.logical.UpdateOperation;
import com.tinqer.policy.RowFilterEngine;
import com.tinqer.policy.RowFilterResult;

import java.util.Map;

/**
 * Staged handles of an UPDATE plan.
 *
 * <pre>
 *   Initial --set--> WithSet --where/allowFullTableUpdate--> Complete --returning--> WithReturning
 *                    WithSet --returning--> WithReturning
 * </pre>
 *
 * <p>{@code set()} can be called once. A plan without WHERE and without the
 * full-table opt-in is rejected at finalize, before row filters could add a
 * predicate of their own.
 */
public final class UpdatePlan {

    private UpdatePlan() {}

    static FinalizablePlan start(PlanState state) {
        UpdateOperation update = (UpdateOperation) state.operation();
        if (update.returning() != null) {
            return new WithReturning(state);
        }
        if (update.predicate() != null || update.allowFullTableUpdate()) {
            return new Complete(state);
        }
        if (update.assignments() != null && !update.assignments().properties().isEmpty()) {
            return new WithSet(state);
        }
        return new Initial(state);
    }

    private static FinalizedPlan finalizeUpdate(PlanState state, Map<String, ?> params) {
        UpdateOperation update = (UpdateOperation) state.operation();
        if (update.predicate() == null && !update.allowFullTableUpdate()) {
            throw new SemanticPolicyException("UPDATE requires a WHERE clause or explicit allowFullTableUpdate",
                ErrorContext.of("update", update.table(), "finalize"));
        }
        RowFilterResult<UpdateOperation> filtered = RowFilterEngine.applyToUpdate(update, state.rowFilters(),
            state.mergeParams(params), state.contextSnapshot().autoParamCounter());
        return new FinalizedPlan(PlanKind.UPDATE, filtered.operation(), filtered.params(), state.autoParamInfos());
    }

    /** Table chosen, no assignments yet. */
    public static final class Initial implements FinalizablePlan {

        private final PlanState state;

        Initial(PlanState state) {
            this.state = state;
        }

        public UpdateStage stage() {
            return UpdateStage.INITIAL;
        }

        /**
         * Sets the assignments from host values.
         */
        public WithSet set(Map<String, ?> values) {
            return new WithSet(PlanTransitions.append(state, "set", PlanTransitions.objectLiteral(values)));
        }

        /**
         * Sets the assignments from a lambda such as
         * {@code (u, p) => ({ status: p.status })}.
         */
        public WithSet set(String selector) {
            return new WithSet(PlanTransitions.append(state, "set", PlanTransitions.lambda(selector, "set")));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            throw new SemanticPolicyException("UPDATE statement requires set() to be called before generating SQL",
                ErrorContext.of("update", ((UpdateOperation) state.operation()).table(), "finalize"));
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** Assignments set; a WHERE clause or the full-table opt-in must follow. */
    public static final class WithSet implements FinalizablePlan {

        private final PlanState state;

        WithSet(PlanState state) {
            this.state = state;
        }

        public UpdateStage stage() {
            return UpdateStage.WITH_SET;
        }

        public Complete where(String predicate) {
            return new Complete(PlanTransitions.append(state, "where", PlanTransitions.lambda(predicate, "where")));
        }

        public Complete allowFullTableUpdate() {
            return new Complete(PlanTransitions.append(state, "allowFullTableUpdate"));
        }

        public WithReturning returning(String selector) {
            return new WithReturning(
                PlanTransitions.append(state, "returning", PlanTransitions.lambda(selector, "returning")));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            return finalizeUpdate(state, params);
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** Assignments and a WHERE clause (or the full-table opt-in) set. */
    public static final class Complete implements FinalizablePlan {

        private final PlanState state;

        Complete(PlanState state) {
            this.state = state;
        }

        public UpdateStage stage() {
            return UpdateStage.COMPLETE;
        }

        /**
         * Adds another predicate; predicates are combined with AND.
         */
        public Complete where(String predicate) {
            return new Complete(PlanTransitions.append(state, "where", PlanTransitions.lambda(predicate, "where")));
        }

        public WithReturning returning(String selector) {
            return new WithReturning(
                PlanTransitions.append(state, "returning", PlanTransitions.lambda(selector, "returning")));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            return finalizeUpdate(state, params);
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

        public UpdateStage stage() {
            return UpdateStage.WITH_RETURNING;
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            return finalizeUpdate(state, params);
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }
}

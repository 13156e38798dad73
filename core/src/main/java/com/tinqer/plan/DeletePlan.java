package com.tinqer.plan;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.logical.DeleteOperation;
import com.tinqer.policy.RowFilterEngine;
import com.tinqer.policy.RowFilterResult;

import java.util.Map;

/**
 * Staged handles of a DELETE plan: {@link Initial} until a WHERE clause or
 * {@code allowFullTableDelete()} makes it {@link Complete}.
 */
public final class DeletePlan {

    private DeletePlan() {}

    static FinalizablePlan start(PlanState state) {
        DeleteOperation delete = (DeleteOperation) state.operation();
        if (delete.predicate() != null || delete.allowFullTableDelete()) {
            return new Complete(state);
        }
        return new Initial(state);
    }

    /** No WHERE clause yet. */
    public static final class Initial implements FinalizablePlan {

        private final PlanState state;

        Initial(PlanState state) {
            this.state = state;
        }

        public DeleteStage stage() {
            return DeleteStage.INITIAL;
        }

        public Complete where(String predicate) {
            return new Complete(PlanTransitions.append(state, "where", PlanTransitions.lambda(predicate, "where")));
        }

        public Complete allowFullTableDelete() {
            return new Complete(PlanTransitions.append(state, "allowFullTableDelete"));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            throw new SemanticPolicyException("DELETE requires a WHERE clause or explicit allowFullTableDelete",
                ErrorContext.of("delete", ((DeleteOperation) state.operation()).table(), "finalize"));
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }

    /** A WHERE clause or the full-table opt-in is present. */
    public static final class Complete implements FinalizablePlan {

        private final PlanState state;

        Complete(PlanState state) {
            this.state = state;
        }

        public DeleteStage stage() {
            return DeleteStage.COMPLETE;
        }

        /**
         * Adds another predicate; predicates are combined with AND.
         */
        public Complete where(String predicate) {
            return new Complete(PlanTransitions.append(state, "where", PlanTransitions.lambda(predicate, "where")));
        }

        @Override
        public FinalizedPlan finalize(Map<String, ?> params) {
            DeleteOperation delete = (DeleteOperation) state.operation();
            RowFilterResult<DeleteOperation> filtered = RowFilterEngine.applyToDelete(delete, state.rowFilters(),
                state.mergeParams(params), state.contextSnapshot().autoParamCounter());
            return new FinalizedPlan(PlanKind.DELETE, filtered.operation(), filtered.params(), state.autoParamInfos());
        }

        @Override
        public PlanState toPlan() {
            return state;
        }
    }
}

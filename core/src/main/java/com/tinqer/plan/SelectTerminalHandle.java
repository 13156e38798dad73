package com.tinqer.plan;

import java.util.Map;

/**
 * SELECT plan ending in a terminal operation such as {@code first()} or
 * {@code count()}. Nothing can be chained after it.
 */
public final class SelectTerminalHandle implements FinalizablePlan {

    private final PlanState state;

    SelectTerminalHandle(PlanState state) {
        this.state = state;
    }

    public SelectStage stage() {
        return SelectStage.TERMINAL;
    }

    @Override
    public FinalizedPlan finalize(Map<String, ?> params) {
        return SelectPlanHandle.finalizeSelect(state, params);
    }

    @Override
    public PlanState toPlan() {
        return state;
    }
}

package com.tinqer.plan;

import java.util.Map;

/**
 * A plan handle that can be turned into a {@link FinalizedPlan}.
 */
public interface FinalizablePlan {

    /**
     * Merges the caller's parameters over the auto-parameters (the caller
     * wins) and applies row filters.
     *
     * @param params caller parameters; an absent key is an undefined value
     * @return the finalized plan
     */
    FinalizedPlan finalize(Map<String, ?> params);

    /**
     * Returns the underlying immutable plan state.
     */
    PlanState toPlan();
}

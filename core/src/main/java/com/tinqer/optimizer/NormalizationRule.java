package com.tinqer.optimizer;

import com.tinqer.logical.QueryOperation;

/**
 * Rewrite applied to every operation tree before it is stored in a plan.
 *
 * <p>Normalization rules turn operation shapes the visitors produce into the
 * forms the SQL generators understand, e.g. a group join flattened by
 * {@code selectMany} into a single outer join. Rules must be idempotent:
 * applying a rule to its own output returns an equal tree.
 */
public interface NormalizationRule {

    /**
     * Applies this rule to an operation tree.
     *
     * @param operation the input tree
     * @return the rewritten tree, or the input if the rule does not apply
     */
    QueryOperation apply(QueryOperation operation);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}

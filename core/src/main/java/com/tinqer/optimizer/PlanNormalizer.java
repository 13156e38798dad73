package com.tinqer.optimizer;

import com.tinqer.logical.QueryOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies normalization rules to an operation tree until it stops changing.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOperation normalized = PlanNormalizer.getDefault().normalize(operation);
 * </pre>
 *
 * <p>The default rules run in this order:
 * <ul>
 *   <li>{@link JoinNormalizationRule}</li>
 *   <li>{@link ProjectionWrappingRule}</li>
 * </ul>
 */
public class PlanNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PlanNormalizer.class);

    private static final PlanNormalizer DEFAULT = new PlanNormalizer();

    private final List<NormalizationRule> rules;
    private final int maxIterations;

    public PlanNormalizer() {
        this(List.of(new JoinNormalizationRule(), new ProjectionWrappingRule()), 10);
    }

    public PlanNormalizer(List<NormalizationRule> rules, int maxIterations) {
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    public static PlanNormalizer getDefault() {
        return DEFAULT;
    }

    /**
     * Normalizes an operation tree.
     *
     * @param operation the input tree, may be null
     * @return the normalized tree
     */
    public QueryOperation normalize(QueryOperation operation) {
        if (operation == null) {
            return null;
        }

        QueryOperation current = operation;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            QueryOperation previous = current;
            for (NormalizationRule rule : rules) {
                QueryOperation next = rule.apply(current);
                if (!next.equals(current)) {
                    logger.debug("Rule {} rewrote {} (iteration {})", rule.name(), current.operationType(), iteration);
                }
                current = next;
            }
            if (current.equals(previous)) {
                break;
            }
        }
        return current;
    }

    public List<NormalizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxIterations() {
        return maxIterations;
    }
}

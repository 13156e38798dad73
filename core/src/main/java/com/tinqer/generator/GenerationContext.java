package com.tinqer.generator;

import java.util.Collections;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * State for generating one SELECT level (or one DML statement).
 *
 * <p>Derived tables and join inners are generated with a fresh context of
 * their own, so aliases never leak between nesting levels. The parameter map
 * is shared by all levels.
 */
final class GenerationContext {

    private final Map<String, Object> params;
    private final UnaryOperator<String> placeholders;
    private final boolean joined;
    private final String rootAlias;

    GenerationContext(Map<String, Object> params, UnaryOperator<String> placeholders,
                      boolean joined, String rootAlias) {
        this.params = params != null ? params : Collections.emptyMap();
        this.placeholders = placeholders;
        this.joined = joined;
        this.rootAlias = rootAlias;
    }

    Map<String, Object> params() {
        return params;
    }

    String placeholder(String name) {
        return placeholders.apply(name);
    }

    /**
     * Whether the level joins more than one table; columns are then always
     * qualified by their table alias.
     */
    boolean joined() {
        return joined;
    }

    /**
     * Alias of the table with the given join index. Index 0 is the root.
     */
    String tableAlias(int index) {
        return index == 0 && !joined ? rootAlias : "t" + index;
    }

    /**
     * Alias used to qualify unqualified columns, or null when columns stay bare.
     */
    String directAlias() {
        return joined ? tableAlias(0) : null;
    }
}

package com.tinqer.plan;

/**
 * Per-call parse settings.
 *
 * @param cache whether the parse cache is consulted and updated
 */
public record ParseOptions(boolean cache) {

    public static final ParseOptions DEFAULT = new ParseOptions(true);
    public static final ParseOptions NO_CACHE = new ParseOptions(false);
}

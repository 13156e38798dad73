package com.tinqer.cache;

import com.tinqer.runtime.TinqerConfig;

/**
 * Settings of a {@link ParseCache}.
 *
 * @param enabled whether lookups and inserts take effect
 * @param capacity maximum number of entries; 0 keeps nothing
 */
public record ParseCacheConfig(boolean enabled, int capacity) {

    public ParseCacheConfig {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative, got " + capacity);
        }
    }

    /**
     * Returns the settings from {@link TinqerConfig}.
     */
    public static ParseCacheConfig fromSystemConfig() {
        return new ParseCacheConfig(TinqerConfig.isCacheEnabled(), TinqerConfig.getCacheCapacity());
    }
}

package com.tinqer.runtime;

import com.tinqer.cache.ParseCache;
import com.tinqer.cache.ParseCacheConfig;

/**
 * Process-wide settings.
 *
 * <ul>
 *   <li>{@code tinqer.cache.enabled} (default {@code true}) - whether parsed
 *       query sources are memoized</li>
 *   <li>{@code tinqer.cache.capacity} (default {@code 1024}) - maximum number
 *       of memoized sources</li>
 * </ul>
 *
 * <p>Values are read from system properties on first use and can be changed
 * at runtime via {@link #configureCache(boolean, int)}. Every change is
 * applied to the shared {@link ParseCache} immediately.
 */
public final class TinqerConfig {

    public static final String CACHE_ENABLED_PROPERTY = "tinqer.cache.enabled";
    public static final String CACHE_CAPACITY_PROPERTY = "tinqer.cache.capacity";

    public static final boolean DEFAULT_CACHE_ENABLED = true;
    public static final int DEFAULT_CACHE_CAPACITY = 1024;

    private static volatile boolean cacheEnabled = readEnabled();
    private static volatile int cacheCapacity = readCapacity();

    public static boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public static int getCacheCapacity() {
        return cacheCapacity;
    }

    public static void configureCache(boolean enabled, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Cache capacity must be non-negative, got " + capacity);
        }
        apply(enabled, capacity);
    }

    /**
     * Re-reads the system properties. Intended for tests only.
     */
    public static void reset() {
        boolean enabled = readEnabled();
        int capacity = readCapacity();
        apply(enabled, capacity);
    }

    private static synchronized void apply(boolean enabled, int capacity) {
        cacheEnabled = enabled;
        cacheCapacity = capacity;
        ParseCache.getInstance().configure(new ParseCacheConfig(enabled, capacity));
    }

    private static boolean readEnabled() {
        String value = System.getProperty(CACHE_ENABLED_PROPERTY);
        return value == null ? DEFAULT_CACHE_ENABLED : Boolean.parseBoolean(value.trim());
    }

    private static int readCapacity() {
        String value = System.getProperty(CACHE_CAPACITY_PROPERTY);
        if (value == null) {
            return DEFAULT_CACHE_CAPACITY;
        }
        try {
            int capacity = Integer.parseInt(value.trim());
            return capacity >= 0 ? capacity : DEFAULT_CACHE_CAPACITY;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid %s: '%s'. Expected a non-negative integer".formatted(CACHE_CAPACITY_PROPERTY, value), e);
        }
    }

    private TinqerConfig() {}
}

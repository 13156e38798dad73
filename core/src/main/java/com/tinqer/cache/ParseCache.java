package com.tinqer.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded LRU memo of parsed query sources, keyed by source text.
 *
 * <p>All methods are synchronized. A lookup never parses, so a cache miss
 * handled by the caller cannot re-enter the cache.
 */
public class ParseCache {

    private static final Logger logger = LoggerFactory.getLogger(ParseCache.class);

    private static final ParseCache INSTANCE = new ParseCache(ParseCacheConfig.fromSystemConfig());

    private final LinkedHashMap<String, CachedParse> entries;
    private ParseCacheConfig config;

    public ParseCache(ParseCacheConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedParse> eldest) {
                if (size() > ParseCache.this.config.capacity()) {
                    logger.debug("Evicting parse cache entry ({} entries, capacity {})",
                        size(), ParseCache.this.config.capacity());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Returns the process-wide cache used by the plan builder.
     */
    public static ParseCache getInstance() {
        return INSTANCE;
    }

    /**
     * Looks up a parsed source.
     *
     * @param source the query source text
     * @return the entry, or null on a miss or when the cache is disabled
     */
    public synchronized CachedParse get(String source) {
        if (!config.enabled()) {
            return null;
        }
        CachedParse entry = entries.get(source);
        if (entry != null) {
            logger.debug("Parse cache hit ({} entries)", entries.size());
        } else {
            logger.debug("Parse cache miss ({} entries)", entries.size());
        }
        return entry;
    }

    public synchronized void put(String source, CachedParse entry) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        if (!config.enabled() || config.capacity() == 0) {
            return;
        }
        entries.put(source, entry);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized ParseCacheConfig config() {
        return config;
    }

    /**
     * Replaces the settings. Shrinking the capacity evicts least recently
     * used entries; disabling the cache drops every entry.
     */
    public synchronized void configure(ParseCacheConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "config must not be null");
        if (!newConfig.enabled()) {
            entries.clear();
            return;
        }
        Iterator<Map.Entry<String, CachedParse>> iterator = entries.entrySet().iterator();
        while (entries.size() > newConfig.capacity() && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }
}

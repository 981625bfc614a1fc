package com.fuzzy.reconciliation.cache;

/**
 * Configuration for the pair score cache.
 *
 * @param maxSize    maximum number of cached scores
 * @param ttlSeconds seconds an unused score stays cached
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 scores, 10 minute idle expiry, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}

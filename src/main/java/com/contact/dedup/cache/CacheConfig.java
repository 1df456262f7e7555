package com.contact.dedup.cache;

import com.contact.dedup.core.InvalidConfigurationException;

import java.time.Duration;

/**
 * Configuration for the duplicate-decision cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, long ttlSeconds, boolean enabled) {

    public static final long DEFAULT_TTL_SECONDS = Duration.ofHours(24).toSeconds();

    public CacheConfig {
        if (maxSize <= 0) {
            throw new InvalidConfigurationException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new InvalidConfigurationException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, 24h TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, DEFAULT_TTL_SECONDS, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }
}

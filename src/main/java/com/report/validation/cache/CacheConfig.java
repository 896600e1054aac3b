package com.report.validation.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the validation cache. Results are keyed per judge version, so a
 * long TTL is safe; a new judge version never reads older entries.
 *
 * @param maxSize maximum number of cached node results
 * @param ttl     time a result stays cached after it is written
 * @param enabled false to run every scoring pass against the judge
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    public CacheConfig(int maxSize, long ttlSeconds, boolean enabled) {
        this(maxSize, Duration.ofSeconds(ttlSeconds), enabled);
    }

    public static CacheConfig defaults() {
        return new CacheConfig(50_000, Duration.ofHours(24), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}

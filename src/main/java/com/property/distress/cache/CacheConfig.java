package com.property.distress.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolution cache sizing.
 *
 * @param maxSize  maximum number of cached matches
 * @param ttl      how long a cached match stays valid
 * @param enabled  whether a real cache is built at all
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 50,000 matches for 10 minutes: roughly one large extract's worth of distinct keys.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, Duration.ofMinutes(10), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }

    /**
     * Builds the cache this configuration describes.
     */
    public ResolutionCache createCache() {
        return enabled ? new CaffeineResolutionCache(this) : new NoOpResolutionCache();
    }
}

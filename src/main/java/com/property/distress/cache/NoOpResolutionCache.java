package com.property.distress.cache;

import com.property.distress.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<MatchResult> get(String lookupKey) {
        return Optional.empty();
    }

    @Override
    public void put(String lookupKey, MatchResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.EMPTY;
    }
}

package com.property.distress.cache;

import com.property.distress.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache of positive resolver outcomes, keyed by the normalized lookup key.
 * Misses are never cached: a record that does not resolve today may resolve once more
 * properties are loaded.
 */
public interface ResolutionCache {

    Optional<MatchResult> get(String lookupKey);

    void put(String lookupKey, MatchResult result);

    /**
     * Drops every entry. Called whenever properties or owners are added, since a new
     * property can become a better match for a key that is already cached.
     */
    void invalidateAll();

    CacheStats getStats();
}

package com.contact.dedup.cache;

import com.contact.dedup.core.model.DuplicateDecision;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpDecisionCache implements DecisionCache {

    @Override
    public Optional<DuplicateDecision> get(String fingerprint, double threshold) {
        return Optional.empty();
    }

    @Override
    public void put(DuplicateDecision decision) {
        // no-op
    }

    @Override
    public void invalidate(String fingerprint) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

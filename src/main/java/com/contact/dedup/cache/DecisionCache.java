package com.contact.dedup.cache;

import com.contact.dedup.core.model.DuplicateDecision;

import java.util.Optional;

/**
 * Caller-side cache of duplicate-check results, keyed by record fingerprint and threshold.
 * The matching components never see it; staleness is the cache owner's concern.
 */
public interface DecisionCache {

    /**
     * Gets a cached decision.
     *
     * @param fingerprint fingerprint of the incoming record
     * @param threshold   threshold the decision was made against
     * @return the cached decision, or empty if absent or expired
     */
    Optional<DuplicateDecision> get(String fingerprint, double threshold);

    /**
     * Caches a decision under its own fingerprint and threshold.
     */
    void put(DuplicateDecision decision);

    /**
     * Invalidates all decisions for the given fingerprint, whatever the threshold.
     */
    void invalidate(String fingerprint);

    void invalidateAll();

    CacheStats getStats();
}

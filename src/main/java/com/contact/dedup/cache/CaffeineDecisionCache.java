package com.contact.dedup.cache;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.DuplicateDecision;
import com.contact.dedup.matching.RecordFingerprint;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed decision cache with write-based expiry (24h by default).
 * Implements {@link MergeListener} to drop decisions that a merge made stale.
 */
public class CaffeineDecisionCache implements DecisionCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDecisionCache.class);

    private final Cache<CacheKey, DuplicateDecision> cache;
    private final Function<ContactRecord, String> fingerprinter;

    public CaffeineDecisionCache() {
        this(CacheConfig.defaults());
    }

    public CaffeineDecisionCache(CacheConfig config) {
        this(config, RecordFingerprint::of);
    }

    /**
     * @param fingerprinter must match the fingerprint the decisions were stored under,
     *                      so merges invalidate the right entries
     */
    public CaffeineDecisionCache(CacheConfig config, Function<ContactRecord, String> fingerprinter) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("CaffeineDecisionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<DuplicateDecision> get(String fingerprint, double threshold) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(fingerprint, threshold)));
    }

    @Override
    public void put(DuplicateDecision decision) {
        cache.put(new CacheKey(decision.fingerprint(), decision.threshold()), decision);
    }

    @Override
    public void invalidate(String fingerprint) {
        cache.asMap().keySet().removeIf(key -> key.fingerprint().equals(fingerprint));
        log.debug("Invalidated cached decisions for fingerprint {}", fingerprint);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached decisions");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Drops decisions for both merged records and every decision that lists either of
     * them as a candidate.
     */
    @Override
    public void onMerge(ContactRecord existing, ContactRecord incoming) {
        String existingFingerprint = fingerprinter.apply(existing);
        String incomingFingerprint = fingerprinter.apply(incoming);
        cache.asMap().entrySet().removeIf(entry ->
                entry.getKey().fingerprint().equals(existingFingerprint)
                        || entry.getKey().fingerprint().equals(incomingFingerprint)
                        || mentions(entry.getValue(), existing)
                        || mentions(entry.getValue(), incoming));
        log.debug("Cache invalidated for merge: {} <- {}", existing.getId(), incoming.getId());
    }

    private static boolean mentions(DuplicateDecision decision, ContactRecord record) {
        return decision.candidates().stream().anyMatch(c ->
                record.getId() != null
                        ? Objects.equals(record.getId(), c.existing().getId())
                        : c.existing().equals(record));
    }

    /**
     * Cache key combining fingerprint and threshold.
     */
    record CacheKey(String fingerprint, double threshold) {}
}

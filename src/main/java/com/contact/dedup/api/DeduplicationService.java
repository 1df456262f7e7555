package com.contact.dedup.api;

import com.contact.dedup.cache.CacheConfig;
import com.contact.dedup.cache.CaffeineDecisionCache;
import com.contact.dedup.cache.DecisionCache;
import com.contact.dedup.cache.MergeListener;
import com.contact.dedup.cache.NoOpDecisionCache;
import com.contact.dedup.comparator.ComparatorRegistry;
import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.DuplicateDecision;
import com.contact.dedup.logging.LogContext;
import com.contact.dedup.matching.CandidateProvider;
import com.contact.dedup.matching.DuplicateResolver;
import com.contact.dedup.matching.MatchAggregator;
import com.contact.dedup.matching.RecordFingerprint;
import com.contact.dedup.merge.DataMerger;
import com.contact.dedup.merge.MergeResult;
import com.contact.dedup.merge.MergeStrategy;
import com.contact.dedup.metrics.MetricsService;
import com.contact.dedup.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point for contact deduplication.
 * Checks incoming records against the candidates a {@link CandidateProvider} returns and
 * merges confirmed duplicates.
 *
 * <pre>
 * DeduplicationService service = DeduplicationService.builder()
 *     .candidateProvider(repository::findPlausibleCandidates)
 *     .cacheConfig(CacheConfig.defaults())
 *     .build();
 *
 * DuplicateDecision decision = service.checkDuplicates(incoming);
 * if (decision.isDuplicate()) {
 *     MergeResult merged = service.mergeRecords(decision.bestMatch().orElseThrow().existing(), incoming);
 * }
 * </pre>
 */
public class DeduplicationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationService.class);

    private final CandidateProvider candidateProvider;
    private final DeduplicationOptions options;
    private final DuplicateResolver resolver;
    private final DataMerger merger;
    private final DecisionCache cache;
    private final MetricsService metricsService;
    private final List<MergeListener> mergeListeners;
    private volatile AsyncDeduplicationService asyncService;

    private DeduplicationService(Builder builder) {
        this.candidateProvider = builder.candidateProvider;
        this.options = builder.options;
        ComparatorRegistry registry = builder.registry != null
                ? builder.registry : ComparatorRegistry.defaults(options.getCompanySimilarityFloor());
        this.resolver = new DuplicateResolver(new MatchAggregator(registry));
        this.merger = new DataMerger(options.getDefaultMergeStrategy(), builder.clock);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineDecisionCache(builder.cacheConfig,
                    record -> RecordFingerprint.of(record, registry));
        } else {
            this.cache = new NoOpDecisionCache();
        }

        List<MergeListener> listeners = new ArrayList<>(builder.mergeListeners);
        // Register cache as merge listener if it implements MergeListener
        if (cache instanceof MergeListener mergeListener) {
            listeners.add(mergeListener);
        }
        this.mergeListeners = List.copyOf(listeners);

        log.info("DeduplicationService initialized: comparators={}, {}", registry.fieldNames(), options);
    }

    /**
     * Checks the record against the configured duplicate threshold.
     */
    public DuplicateDecision checkDuplicates(ContactRecord record) {
        return checkDuplicates(record, options.getDuplicateThreshold());
    }

    /**
     * Checks the record against the given threshold. Candidate provider failures propagate
     * unchanged.
     *
     * @throws InvalidConfigurationException if the threshold is outside [0, 100]
     */
    public DuplicateDecision checkDuplicates(ContactRecord record, double threshold) {
        Objects.requireNonNull(record, "record is required");
        InvalidConfigurationException.requireThreshold(threshold, "threshold");

        long start = System.nanoTime();
        String fingerprint = fingerprint(record);
        try (LogContext ctx = LogContext.forDuplicateCheck(LogContext.generateCorrelationId(), fingerprint)) {
            Optional<DuplicateDecision> cached = cachedDecision(fingerprint, threshold);
            if (cached.isPresent()) {
                return cached.get();
            }
            List<ContactRecord> candidates = hasComparableFields(record)
                    ? candidateProvider.findPlausibleCandidates(record)
                    : List.of();
            DuplicateDecision decision = resolver.resolve(record, candidates, threshold);
            return completeCheck(decision, candidates == null ? 0 : candidates.size(), start);
        }
    }

    /**
     * Merges the incoming record into the existing one using the default strategy.
     */
    public MergeResult mergeRecords(ContactRecord existing, ContactRecord incoming) {
        return mergeRecords(existing, incoming, options.getDefaultMergeStrategy());
    }

    /**
     * Merges the incoming record into the existing one and notifies merge listeners.
     */
    public MergeResult mergeRecords(ContactRecord existing, ContactRecord incoming, MergeStrategy strategy) {
        Objects.requireNonNull(existing, "existing record is required");
        Objects.requireNonNull(incoming, "incoming record is required");
        Objects.requireNonNull(strategy, "strategy is required");

        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(),
                existing.getId(), incoming.getId(), strategy.name())) {
            MergeResult result = merger.merge(existing, incoming, strategy);
            for (MergeListener listener : mergeListeners) {
                listener.onMerge(existing, incoming);
            }
            metricsService.incrementMerge(strategy);
            metricsService.recordMergeChanges(result.auditTrail().size());
            log.info("dedup.merge.completed strategy={} changes={} summary=\"{}\"",
                    strategy, result.auditTrail().size(), result.summary());
            return result;
        }
    }

    String fingerprint(ContactRecord record) {
        return RecordFingerprint.of(record, resolver.getAggregator().getRegistry());
    }

    /**
     * True if at least one registered comparator can read a value from the record.
     */
    boolean hasComparableFields(ContactRecord record) {
        return !resolver.getAggregator().checkedFields(record).isEmpty();
    }

    Optional<DuplicateDecision> cachedDecision(String fingerprint, double threshold) {
        Optional<DuplicateDecision> cached = cache.get(fingerprint, threshold);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("dedup.check.cached duplicate={} confidence={}",
                    cached.get().isDuplicate(), cached.get().confidence());
        } else {
            metricsService.recordCacheMiss();
        }
        return cached;
    }

    DuplicateDecision completeCheck(DuplicateDecision decision, int lookedUp, long startNanos) {
        cache.put(decision);
        metricsService.recordCheckDuration(Duration.ofNanos(System.nanoTime() - startNanos), decision.isDuplicate());
        metricsService.recordCandidateCount(decision.candidates().size());
        metricsService.recordTopConfidence(decision.confidence());
        if (decision.isDuplicate()) {
            metricsService.incrementDuplicateDetected();
        }
        log.info("dedup.check.completed duplicate={} confidence={} candidates={} lookedUp={} threshold={}",
                decision.isDuplicate(), decision.confidence(), decision.candidates().size(),
                lookedUp, decision.threshold());
        return decision;
    }

    CandidateProvider getCandidateProvider() {
        return candidateProvider;
    }

    public DeduplicationOptions getOptions() {
        return options;
    }

    public DuplicateResolver getResolver() {
        return resolver;
    }

    public DataMerger getMerger() {
        return merger;
    }

    public DecisionCache getCache() {
        return cache;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Returns the async view of this service, creating its worker pool on first use.
     */
    public AsyncDeduplicationService async() {
        AsyncDeduplicationService result = asyncService;
        if (result == null) {
            synchronized (this) {
                result = asyncService;
                if (result == null) {
                    result = new AsyncDeduplicationService(this);
                    asyncService = result;
                }
            }
        }
        return result;
    }

    @Override
    public void close() {
        AsyncDeduplicationService async = asyncService;
        if (async != null) {
            async.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CandidateProvider candidateProvider;
        private DeduplicationOptions options = DeduplicationOptions.defaults();
        private ComparatorRegistry registry;
        private DecisionCache cache;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private Clock clock = Clock.systemUTC();
        private final List<MergeListener> mergeListeners = new ArrayList<>();

        /**
         * Sets the source of plausible existing records. Required.
         */
        public Builder candidateProvider(CandidateProvider candidateProvider) {
            this.candidateProvider = candidateProvider;
            return this;
        }

        public Builder options(DeduplicationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets a custom comparator registry. Overrides the company similarity floor in the options.
         */
        public Builder comparatorRegistry(ComparatorRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets a custom decision cache. Takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder cache(DecisionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Enables a Caffeine decision cache with the given configuration.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Builder mergeListener(MergeListener listener) {
            this.mergeListeners.add(Objects.requireNonNull(listener, "listener is required"));
            return this;
        }

        public DeduplicationService build() {
            if (candidateProvider == null) {
                throw new IllegalStateException("candidateProvider is required");
            }
            return new DeduplicationService(this);
        }
    }
}

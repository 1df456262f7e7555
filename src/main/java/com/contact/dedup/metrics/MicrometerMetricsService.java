package com.contact.dedup.metrics;

import com.contact.dedup.merge.MergeStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.check.duration} - Timer (tag: duplicate)</li>
 *   <li>{@code dedup.candidates} - DistributionSummary</li>
 *   <li>{@code dedup.confidence} - DistributionSummary of top confidences</li>
 *   <li>{@code dedup.duplicate.detected} - Counter</li>
 *   <li>{@code dedup.merge} - Counter (tag: strategy)</li>
 *   <li>{@code dedup.merge.changes} - DistributionSummary</li>
 *   <li>{@code dedup.cache.hit} / {@code dedup.cache.miss} - Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<Boolean, Timer> checkTimers = new ConcurrentHashMap<>();
    private final Map<MergeStrategy, Counter> mergeCounters = new ConcurrentHashMap<>();
    private final DistributionSummary candidateSummary;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary mergeChangesSummary;
    private final Counter duplicateCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidateSummary = DistributionSummary.builder("dedup.candidates")
                .description("Number of matching candidates per duplicate check")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("dedup.confidence")
                .description("Top aggregate confidence per duplicate check")
                .register(registry);
        this.mergeChangesSummary = DistributionSummary.builder("dedup.merge.changes")
                .description("Number of audited field changes per merge")
                .register(registry);
        this.duplicateCounter = Counter.builder("dedup.duplicate.detected")
                .description("Number of incoming records classified as duplicates")
                .register(registry);
        this.cacheHitCounter = Counter.builder("dedup.cache.hit")
                .description("Number of decision cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("dedup.cache.miss")
                .description("Number of decision cache misses")
                .register(registry);
    }

    @Override
    public void recordCheckDuration(Duration duration, boolean duplicate) {
        Timer timer = checkTimers.computeIfAbsent(duplicate, d ->
                Timer.builder("dedup.check.duration")
                        .description("Duration of duplicate checks")
                        .tag("duplicate", String.valueOf(d))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void recordTopConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementDuplicateDetected() {
        duplicateCounter.increment();
    }

    @Override
    public void incrementMerge(MergeStrategy strategy) {
        Counter counter = mergeCounters.computeIfAbsent(strategy, s ->
                Counter.builder("dedup.merge")
                        .description("Number of record merges")
                        .tag("strategy", s.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordMergeChanges(int changes) {
        mergeChangesSummary.record(changes);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}

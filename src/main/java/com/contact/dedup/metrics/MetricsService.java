package com.contact.dedup.metrics;

import com.contact.dedup.merge.MergeStrategy;

import java.time.Duration;

/**
 * Records deduplication metrics. The default {@link NoOpMetricsService} does nothing,
 * so the library works without a metrics backend.
 */
public interface MetricsService {

    void recordCheckDuration(Duration duration, boolean duplicate);

    void recordCandidateCount(int count);

    void recordTopConfidence(double confidence);

    void incrementDuplicateDetected();

    void incrementMerge(MergeStrategy strategy);

    void recordMergeChanges(int changes);

    void recordCacheHit();

    void recordCacheMiss();
}

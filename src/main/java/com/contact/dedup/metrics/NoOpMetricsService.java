package com.contact.dedup.metrics;

import com.contact.dedup.merge.MergeStrategy;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCheckDuration(Duration duration, boolean duplicate) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordTopConfidence(double confidence) {
    }

    @Override
    public void incrementDuplicateDetected() {
    }

    @Override
    public void incrementMerge(MergeStrategy strategy) {
    }

    @Override
    public void recordMergeChanges(int changes) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

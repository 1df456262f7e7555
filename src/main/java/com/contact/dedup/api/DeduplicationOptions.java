package com.contact.dedup.api;

import com.contact.dedup.comparator.CompanyNameComparator;
import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.matching.DuplicateResolver;
import com.contact.dedup.merge.MergeStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for duplicate checks and merges.
 * Configures the duplicate threshold, company-name similarity floor, default merge
 * strategy and the async lookup settings.
 */
public class DeduplicationOptions {

    private static final Duration DEFAULT_CANDIDATE_LOOKUP_TIMEOUT = Duration.ofSeconds(5);

    private final double duplicateThreshold;
    private final double companySimilarityFloor;
    private final MergeStrategy defaultMergeStrategy;
    private final Duration candidateLookupTimeout;
    private final int parallelism;

    private DeduplicationOptions(Builder builder) {
        this.duplicateThreshold = builder.duplicateThreshold;
        this.companySimilarityFloor = builder.companySimilarityFloor;
        this.defaultMergeStrategy = builder.defaultMergeStrategy;
        this.candidateLookupTimeout = builder.candidateLookupTimeout;
        this.parallelism = builder.parallelism;
    }

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public double getCompanySimilarityFloor() {
        return companySimilarityFloor;
    }

    public MergeStrategy getDefaultMergeStrategy() {
        return defaultMergeStrategy;
    }

    public Duration getCandidateLookupTimeout() {
        return candidateLookupTimeout;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Creates default options.
     */
    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: only exact email or profile URL matches count as duplicates.
     */
    public static DeduplicationOptions strict() {
        return builder().duplicateThreshold(95.0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double duplicateThreshold = DuplicateResolver.DEFAULT_THRESHOLD;
        private double companySimilarityFloor = CompanyNameComparator.DEFAULT_SIMILARITY_FLOOR;
        private MergeStrategy defaultMergeStrategy = MergeStrategy.MOST_COMPLETE;
        private Duration candidateLookupTimeout = DEFAULT_CANDIDATE_LOOKUP_TIMEOUT;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public Builder duplicateThreshold(double duplicateThreshold) {
            this.duplicateThreshold = InvalidConfigurationException.requireThreshold(
                    duplicateThreshold, "duplicateThreshold");
            return this;
        }

        public Builder companySimilarityFloor(double companySimilarityFloor) {
            this.companySimilarityFloor = InvalidConfigurationException.requireRatio(
                    companySimilarityFloor, "companySimilarityFloor");
            return this;
        }

        public Builder defaultMergeStrategy(MergeStrategy defaultMergeStrategy) {
            this.defaultMergeStrategy = Objects.requireNonNull(defaultMergeStrategy,
                    "defaultMergeStrategy is required");
            return this;
        }

        public Builder candidateLookupTimeout(Duration candidateLookupTimeout) {
            if (candidateLookupTimeout == null || candidateLookupTimeout.isZero()
                    || candidateLookupTimeout.isNegative()) {
                throw new InvalidConfigurationException("candidateLookupTimeout must be positive");
            }
            this.candidateLookupTimeout = candidateLookupTimeout;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new InvalidConfigurationException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public DeduplicationOptions build() {
            return new DeduplicationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "duplicateThreshold=" + duplicateThreshold +
                ", companySimilarityFloor=" + companySimilarityFloor +
                ", defaultMergeStrategy=" + defaultMergeStrategy +
                ", candidateLookupTimeout=" + candidateLookupTimeout +
                ", parallelism=" + parallelism +
                '}';
    }
}

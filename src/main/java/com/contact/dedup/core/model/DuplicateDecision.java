package com.contact.dedup.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a duplicate check for one incoming record.
 *
 * @param fingerprint   hash of the incoming record's identifying fields
 * @param candidates    matching existing records, highest confidence first
 * @param duplicate     true if the top candidate reached the threshold
 * @param threshold     threshold the decision was made against
 * @param checkedFields identifying fields present on the incoming record
 */
public record DuplicateDecision(
        String fingerprint,
        List<MatchCandidate> candidates,
        boolean duplicate,
        double threshold,
        List<String> checkedFields
) {
    public DuplicateDecision {
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        checkedFields = checkedFields != null ? List.copyOf(checkedFields) : List.of();
    }

    /**
     * Creates a decision with no candidates.
     */
    public static DuplicateDecision noMatch(String fingerprint, double threshold, List<String> checkedFields) {
        return new DuplicateDecision(fingerprint, List.of(), false, threshold, checkedFields);
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    /**
     * The highest-ranked candidate, if any.
     */
    public Optional<MatchCandidate> bestMatch() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /**
     * Confidence of the best candidate, or 0 when nothing matched.
     */
    public double confidence() {
        return candidates.isEmpty() ? 0.0 : candidates.get(0).confidence();
    }
}

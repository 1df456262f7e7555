package com.contact.dedup.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An existing record together with the field matches computed against an incoming record.
 * The aggregate confidence is the maximum of the individual field confidences.
 */
public record MatchCandidate(
        ContactRecord existing,
        List<FieldMatch> fieldMatches,
        double confidence
) {
    public MatchCandidate {
        Objects.requireNonNull(existing, "existing record is required");
        fieldMatches = fieldMatches != null ? List.copyOf(fieldMatches) : List.of();
    }

    /**
     * Builds a candidate from non-empty field matches, taking the strongest signal as the aggregate.
     */
    public static MatchCandidate of(ContactRecord existing, List<FieldMatch> fieldMatches) {
        if (fieldMatches == null || fieldMatches.isEmpty()) {
            throw new IllegalArgumentException("A match candidate needs at least one field match");
        }
        double max = fieldMatches.stream()
                .mapToDouble(FieldMatch::confidence)
                .max()
                .orElse(0.0);
        return new MatchCandidate(existing, fieldMatches, max);
    }

    /**
     * Names of the fields that produced a signal, in comparator order.
     */
    public List<String> matchedFields() {
        return fieldMatches.stream().map(FieldMatch::fieldName).toList();
    }
}

package com.contact.dedup.core.model;

import java.util.Objects;

/**
 * Result of one field comparator for a single record pair.
 *
 * @param fieldName    the compared field, e.g. {@code email}
 * @param confidence   0-100 strength of the signal
 * @param matchType    how the match was established
 * @param matchedValue the existing record's value that matched
 * @param reason       human-readable explanation
 */
public record FieldMatch(
        String fieldName,
        double confidence,
        MatchType matchType,
        String matchedValue,
        String reason
) {
    public FieldMatch {
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(matchType, "matchType is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 100.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 100, got " + confidence);
        }
    }
}

package com.contact.dedup.core.model;

/**
 * How a field comparator established a match.
 */
public enum MatchType {
    /** Equality after trivial normalization (case, whitespace). */
    EXACT,
    /** Shared email or website domain. */
    DOMAIN,
    /** Equality after structural normalization, e.g. digits-only phone numbers. */
    NORMALIZED,
    /** Edit-distance similarity above the configured floor. */
    FUZZY
}

package com.contact.dedup.audit;

/**
 * The rule that decided a field's merged value.
 */
public enum MergeRule {
    ONLY_EXISTING,
    ONLY_INCOMING,
    IDENTICAL,
    MOST_RECENT,
    MOST_COMPLETE,
    PREFER_EXISTING,
    PREFER_INCOMING,
    /**
     * A recency comparison was needed but a last-updated marker was missing;
     * the existing value was kept.
     */
    RECENCY_FALLBACK,
    DEEP_MERGE,
    LIST_UNION
}

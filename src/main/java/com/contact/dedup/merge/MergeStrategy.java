package com.contact.dedup.merge;

/**
 * Strategies for resolving conflicting field values when two records are merged.
 * Fields present on only one side always keep that side's value.
 */
public enum MergeStrategy {
    /**
     * Use the value from the record with the later last-updated marker. If either record
     * lacks a marker the existing value is kept and the audit entry is tagged
     * {@code RECENCY_FALLBACK}.
     */
    MOST_RECENT,

    /**
     * Use the longer (more detailed) value; equal lengths fall back to {@link #MOST_RECENT}.
     */
    MOST_COMPLETE,

    /**
     * Keep the existing record's value for any conflict.
     */
    PREFER_EXISTING,

    /**
     * Take the incoming record's value for any conflict.
     */
    PREFER_INCOMING
}

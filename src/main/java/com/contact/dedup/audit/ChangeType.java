package com.contact.dedup.audit;

/**
 * Kind of change a merge made to a field of the existing record.
 */
public enum ChangeType {
    /** Field was empty on the existing record and now has a value. */
    ADDED,
    /** Field value was replaced. */
    UPDATED,
    /** Structured value was combined from both records. */
    MERGED
}

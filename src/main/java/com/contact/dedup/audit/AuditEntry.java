package com.contact.dedup.audit;

import java.util.Objects;

/**
 * One field changed by a merge.
 *
 * @param fieldName   field name, {@code attributes.<key>} for payload entries
 * @param before      value on the existing record
 * @param after       merged value
 * @param changeType  kind of change
 * @param rule        rule that decided the outcome
 * @param reason      human-readable explanation
 */
public record AuditEntry(
        String fieldName,
        Object before,
        Object after,
        ChangeType changeType,
        MergeRule rule,
        String reason
) {
    public AuditEntry {
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(rule, "rule is required");
    }
}

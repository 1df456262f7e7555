package com.contact.dedup.merge;

import com.contact.dedup.audit.AuditEntry;
import com.contact.dedup.audit.ChangeType;
import com.contact.dedup.core.model.ContactRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of merging two records: the reconciled record and one audit entry per changed field.
 */
public record MergeResult(
        ContactRecord mergedRecord,
        List<AuditEntry> auditTrail,
        MergeStrategy strategy,
        Instant mergedAt
) {
    public MergeResult {
        Objects.requireNonNull(mergedRecord, "mergedRecord is required");
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(mergedAt, "mergedAt is required");
        auditTrail = auditTrail != null ? List.copyOf(auditTrail) : List.of();
    }

    public boolean hasChanges() {
        return !auditTrail.isEmpty();
    }

    /**
     * The audit entry for a field, if that field changed.
     */
    public Optional<AuditEntry> auditEntry(String fieldName) {
        return auditTrail.stream()
                .filter(e -> e.fieldName().equals(fieldName))
                .findFirst();
    }

    /**
     * Human-readable change counts, e.g. {@code "1 added, 2 updated"}.
     */
    public String summary() {
        if (!hasChanges()) {
            return "No changes made";
        }
        Map<ChangeType, Integer> counts = new EnumMap<>(ChangeType.class);
        for (AuditEntry entry : auditTrail) {
            counts.merge(entry.changeType(), 1, Integer::sum);
        }
        List<String> parts = new ArrayList<>();
        counts.forEach((type, count) -> parts.add(count + " " + type.name().toLowerCase(Locale.ROOT)));
        return String.join(", ", parts);
    }
}

package com.contact.dedup.merge;

import com.contact.dedup.audit.AuditEntry;
import com.contact.dedup.audit.ChangeType;
import com.contact.dedup.audit.MergeRule;
import com.contact.dedup.core.model.ContactField;
import com.contact.dedup.core.model.ContactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combines two records judged to be the same entity into one.
 *
 * <p>Every scalar field and every payload attribute is resolved by {@link MergeStrategy}.
 * A value present on either side is never dropped. Each field whose merged value differs
 * from the existing record's value produces one {@link AuditEntry}, in field order and
 * then attribute order.</p>
 *
 * <p>The merged record keeps the existing record's id (the incoming id only when the
 * existing one has none) and the later of the two last-updated markers. Those two are
 * record metadata and are not audited. Nothing is written back to storage.</p>
 */
public class DataMerger {
    private static final Logger log = LoggerFactory.getLogger(DataMerger.class);

    static final String ATTRIBUTE_PREFIX = "attributes.";

    private final MergeStrategy defaultStrategy;
    private final Clock clock;

    public DataMerger() {
        this(MergeStrategy.MOST_COMPLETE);
    }

    public DataMerger(MergeStrategy defaultStrategy) {
        this(defaultStrategy, Clock.systemUTC());
    }

    public DataMerger(MergeStrategy defaultStrategy, Clock clock) {
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public MergeStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    /**
     * Merges using the default strategy.
     */
    public MergeResult merge(ContactRecord existing, ContactRecord incoming) {
        return merge(existing, incoming, defaultStrategy);
    }

    /**
     * Merges the incoming record into the existing one.
     *
     * @param existing the record already in the store
     * @param incoming the record being merged in
     * @param strategy conflict resolution policy
     * @return merged record with audit trail
     */
    public MergeResult merge(ContactRecord existing, ContactRecord incoming, MergeStrategy strategy) {
        Objects.requireNonNull(existing, "existing record is required");
        Objects.requireNonNull(incoming, "incoming record is required");
        Objects.requireNonNull(strategy, "strategy is required");

        FieldResolver resolver = new FieldResolver(strategy, existing.getUpdatedAt(), incoming.getUpdatedAt());
        ContactRecord.Builder merged = ContactRecord.builder()
                .id(existing.getId() != null ? existing.getId() : incoming.getId())
                .updatedAt(later(existing.getUpdatedAt(), incoming.getUpdatedAt()));
        List<AuditEntry> auditTrail = new ArrayList<>();

        for (ContactField field : ContactField.values()) {
            String before = field.get(existing);
            FieldResolver.Resolution resolution = resolver.resolve(before, field.get(incoming));
            field.set(merged, (String) resolution.value());
            audit(field.fieldName(), before, resolution, auditTrail);
        }

        Set<String> keys = new LinkedHashSet<>(existing.getAttributes().keySet());
        keys.addAll(incoming.getAttributes().keySet());
        for (String key : keys) {
            Object before = existing.getAttributes().get(key);
            FieldResolver.Resolution resolution = resolver.resolve(before, incoming.getAttributes().get(key));
            merged.attribute(key, resolution.value());
            audit(ATTRIBUTE_PREFIX + key, before, resolution, auditTrail);
        }

        MergeResult result = new MergeResult(merged.build(), auditTrail, strategy, clock.instant());
        log.debug("Merged {} into {} with {}: {}", incoming.getId(), existing.getId(), strategy, result.summary());
        return result;
    }

    private static void audit(String fieldName, Object before, FieldResolver.Resolution resolution,
                              List<AuditEntry> auditTrail) {
        if (!FieldResolver.changed(before, resolution.value())) {
            return;
        }
        auditTrail.add(new AuditEntry(fieldName, before, resolution.value(),
                changeType(before, resolution.rule()), resolution.rule(), resolution.reason()));
    }

    private static ChangeType changeType(Object before, MergeRule rule) {
        if (FieldResolver.isEmpty(before)) {
            return ChangeType.ADDED;
        }
        if (rule == MergeRule.DEEP_MERGE || rule == MergeRule.LIST_UNION) {
            return ChangeType.MERGED;
        }
        return ChangeType.UPDATED;
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isAfter(a) ? b : a;
    }
}

package com.contact.dedup.matching;

import com.contact.dedup.comparator.ComparatorRegistry;
import com.contact.dedup.comparator.FieldComparator;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs every registered comparator over one (incoming, existing) pair and combines the
 * signals into a single {@link MatchCandidate}.
 *
 * <p>The aggregate confidence is the maximum of the field confidences. Signals are not
 * averaged: one exact email match is conclusive no matter how many other fields are absent.</p>
 */
public class MatchAggregator {
    private static final Logger log = LoggerFactory.getLogger(MatchAggregator.class);

    private final ComparatorRegistry registry;

    public MatchAggregator() {
        this(ComparatorRegistry.defaults());
    }

    public MatchAggregator(ComparatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    public ComparatorRegistry getRegistry() {
        return registry;
    }

    /**
     * Compares the pair field by field.
     *
     * @return the candidate, or empty when no comparator produced a signal
     */
    public Optional<MatchCandidate> aggregate(ContactRecord incoming, ContactRecord existing) {
        List<FieldMatch> matches = compareAll(incoming, existing);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        MatchCandidate candidate = MatchCandidate.of(existing, matches);
        log.debug("Candidate {} matched on {} with confidence {}",
                existing.getId(), candidate.matchedFields(), candidate.confidence());
        return Optional.of(candidate);
    }

    /**
     * Non-empty field matches for the pair, in registry order.
     */
    public List<FieldMatch> compareAll(ContactRecord incoming, ContactRecord existing) {
        Objects.requireNonNull(incoming, "incoming record is required");
        Objects.requireNonNull(existing, "existing record is required");
        List<FieldMatch> matches = new ArrayList<>();
        for (FieldComparator comparator : registry.comparators()) {
            comparator.compare(incoming, existing).ifPresent(matches::add);
        }
        return matches;
    }

    /**
     * Names of the fields the incoming record can be compared on.
     */
    public List<String> checkedFields(ContactRecord incoming) {
        return registry.comparators().stream()
                .filter(c -> c.appliesTo(incoming))
                .map(FieldComparator::fieldName)
                .toList();
    }
}

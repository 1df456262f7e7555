package com.contact.dedup.matching;

import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.DuplicateDecision;
import com.contact.dedup.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Classifies an incoming record against a candidate set.
 *
 * <p>Candidates are ranked by aggregate confidence, ties going to the more recently
 * updated record (records with a recency marker ahead of those without) and otherwise
 * keeping input order. The record is a duplicate iff the top confidence reaches the
 * threshold. The full ranked list is always returned so callers can surface
 * "possible duplicates" below the threshold.</p>
 *
 * <p>Stateless and deterministic; holds no cache.</p>
 */
public class DuplicateResolver {
    private static final Logger log = LoggerFactory.getLogger(DuplicateResolver.class);

    public static final double DEFAULT_THRESHOLD = 85.0;

    static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::confidence).reversed()
            .thenComparing(c -> c.existing().getUpdatedAt(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final MatchAggregator aggregator;

    public DuplicateResolver() {
        this(new MatchAggregator());
    }

    public DuplicateResolver(MatchAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
    }

    public MatchAggregator getAggregator() {
        return aggregator;
    }

    /**
     * Resolves against the default threshold of {@value #DEFAULT_THRESHOLD}.
     */
    public DuplicateDecision resolve(ContactRecord incoming, List<ContactRecord> candidates) {
        return resolve(incoming, candidates, DEFAULT_THRESHOLD);
    }

    /**
     * Compares the incoming record with every candidate and decides.
     *
     * @throws InvalidConfigurationException if the threshold is outside [0, 100]
     */
    public DuplicateDecision resolve(ContactRecord incoming, List<ContactRecord> candidates, double threshold) {
        InvalidConfigurationException.requireThreshold(threshold, "threshold");
        Objects.requireNonNull(incoming, "incoming record is required");

        List<MatchCandidate> matches = new ArrayList<>();
        if (!aggregator.checkedFields(incoming).isEmpty() && candidates != null) {
            for (ContactRecord candidate : candidates) {
                aggregator.aggregate(incoming, candidate).ifPresent(matches::add);
            }
        }
        return decide(incoming, matches, threshold);
    }

    /**
     * Ranks precomputed candidates and decides. Lets callers fan the pairwise comparisons
     * out across threads and fan back in here; the list must be in candidate input order
     * for ties to stay stable.
     *
     * @throws InvalidConfigurationException if the threshold is outside [0, 100]
     */
    public DuplicateDecision decide(ContactRecord incoming, List<MatchCandidate> matches, double threshold) {
        InvalidConfigurationException.requireThreshold(threshold, "threshold");
        Objects.requireNonNull(incoming, "incoming record is required");

        String fingerprint = RecordFingerprint.of(incoming, aggregator.getRegistry());
        List<String> checkedFields = aggregator.checkedFields(incoming);
        if (checkedFields.isEmpty() || matches == null || matches.isEmpty()) {
            return DuplicateDecision.noMatch(fingerprint, threshold, checkedFields);
        }

        List<MatchCandidate> ranked = new ArrayList<>();
        for (MatchCandidate match : matches) {
            if (match != null && match.confidence() > 0.0) {
                ranked.add(match);
            }
        }
        ranked.sort(RANKING);

        boolean duplicate = !ranked.isEmpty() && ranked.get(0).confidence() >= threshold;
        log.debug("Resolved {} candidates, top confidence {}, duplicate={} at threshold {}",
                ranked.size(), ranked.isEmpty() ? 0.0 : ranked.get(0).confidence(), duplicate, threshold);
        return new DuplicateDecision(fingerprint, ranked, duplicate, threshold, checkedFields);
    }
}

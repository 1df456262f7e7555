package com.contact.dedup.comparator;

import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import com.contact.dedup.rules.CompanyNameRules;
import com.contact.dedup.rules.NormalizationEngine;
import com.contact.dedup.similarity.LevenshteinSimilarity;
import com.contact.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Fuzzy company-name match.
 *
 * <p>Names are normalized with {@link CompanyNameRules} and compared with Levenshtein
 * similarity. Similarity below the floor yields no signal; from the floor up to 1.0 the
 * confidence rises linearly from {@value #MIN_CONFIDENCE} to {@value #MAX_CONFIDENCE}.</p>
 */
public class CompanyNameComparator extends NormalizedValueComparator {
    private static final Logger log = LoggerFactory.getLogger(CompanyNameComparator.class);

    public static final String FIELD = "company_name";
    public static final double MIN_CONFIDENCE = 60.0;
    public static final double MAX_CONFIDENCE = 90.0;
    public static final double DEFAULT_SIMILARITY_FLOOR = 0.5;

    private final NormalizationEngine normalizationEngine;
    private final SimilarityAlgorithm similarity;
    private final double similarityFloor;

    public CompanyNameComparator() {
        this(DEFAULT_SIMILARITY_FLOOR);
    }

    public CompanyNameComparator(double similarityFloor) {
        this(CompanyNameRules.createDefaultEngine(), new LevenshteinSimilarity(), similarityFloor);
    }

    public CompanyNameComparator(NormalizationEngine normalizationEngine,
                                 SimilarityAlgorithm similarity,
                                 double similarityFloor) {
        this.normalizationEngine = normalizationEngine;
        this.similarity = similarity;
        this.similarityFloor = InvalidConfigurationException.requireRatio(similarityFloor, "similarityFloor");
    }

    @Override
    public String fieldName() {
        return FIELD;
    }

    public double getSimilarityFloor() {
        return similarityFloor;
    }

    /**
     * Canonical company form, e.g. {@code "Acme, Inc."} becomes {@code "acme"}.
     */
    public String normalize(String companyName) {
        return normalizationEngine.normalize(companyName);
    }

    @Override
    protected String normalizedValue(ContactRecord record) {
        String normalized = normalize(record.getCompanyName());
        return normalized.isEmpty() ? null : normalized;
    }

    @Override
    protected Optional<FieldMatch> compareValues(String incoming, String existing) {
        double score = similarity.compute(incoming, existing);
        if (score < similarityFloor) {
            return Optional.empty();
        }
        double confidence = toConfidence(score);
        log.debug("Company similarity '{}' vs '{}': {} -> confidence {}", incoming, existing, score, confidence);
        return Optional.of(new FieldMatch(FIELD, confidence, MatchType.FUZZY, existing,
                String.format(Locale.ROOT, "Company name similarity: %.1f%% ('%s' vs '%s')",
                        score * 100.0, incoming, existing)));
    }

    /**
     * Maps a similarity at or above the floor onto the 60-90 confidence scale.
     */
    double toConfidence(double score) {
        if (similarityFloor >= 1.0) {
            return MAX_CONFIDENCE;
        }
        double fraction = (score - similarityFloor) / (1.0 - similarityFloor);
        return MIN_CONFIDENCE + (MAX_CONFIDENCE - MIN_CONFIDENCE) * fraction;
    }
}

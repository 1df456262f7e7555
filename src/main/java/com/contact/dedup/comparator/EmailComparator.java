package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import com.contact.dedup.rules.ContactNormalizer;

import java.util.Optional;

/**
 * Case-insensitive exact email match. No partial credit for similar local parts.
 */
public class EmailComparator extends NormalizedValueComparator {

    public static final String FIELD = "email";
    public static final double CONFIDENCE = 100.0;

    @Override
    public String fieldName() {
        return FIELD;
    }

    @Override
    protected String normalizedValue(ContactRecord record) {
        return ContactNormalizer.normalizeEmail(record.getEmail());
    }

    @Override
    protected Optional<FieldMatch> compareValues(String incoming, String existing) {
        if (!incoming.equals(existing)) {
            return Optional.empty();
        }
        return Optional.of(new FieldMatch(FIELD, CONFIDENCE, MatchType.EXACT, existing,
                "Exact email match: " + existing));
    }
}

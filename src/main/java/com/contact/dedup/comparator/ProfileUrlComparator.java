package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import com.contact.dedup.rules.ContactNormalizer;

import java.util.Optional;

/**
 * Professional network profile URL match, ignoring scheme, {@code www.} and trailing slashes.
 */
public class ProfileUrlComparator extends NormalizedValueComparator {

    public static final String FIELD = "professional_profile_url";
    public static final double CONFIDENCE = 95.0;

    @Override
    public String fieldName() {
        return FIELD;
    }

    @Override
    protected String normalizedValue(ContactRecord record) {
        return ContactNormalizer.normalizeProfileUrl(record.getProfessionalProfileUrl());
    }

    @Override
    protected Optional<FieldMatch> compareValues(String incoming, String existing) {
        if (!incoming.equals(existing)) {
            return Optional.empty();
        }
        return Optional.of(new FieldMatch(FIELD, CONFIDENCE, MatchType.EXACT, existing,
                "Exact profile URL match: " + existing));
    }
}

package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import com.contact.dedup.rules.ContactNormalizer;

import java.util.Optional;

/**
 * Same company domain, taken from the explicit domain, the email or the website.
 * Weaker than an email match because colleagues share a domain.
 */
public class DomainComparator extends NormalizedValueComparator {

    public static final String FIELD = "domain";
    public static final double CONFIDENCE = 80.0;

    @Override
    public String fieldName() {
        return FIELD;
    }

    @Override
    protected String normalizedValue(ContactRecord record) {
        return ContactNormalizer.domainOf(record);
    }

    @Override
    protected Optional<FieldMatch> compareValues(String incoming, String existing) {
        if (!incoming.equals(existing)) {
            return Optional.empty();
        }
        return Optional.of(new FieldMatch(FIELD, CONFIDENCE, MatchType.DOMAIN, existing,
                "Same domain: @" + existing));
    }
}

package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import com.contact.dedup.rules.ContactNormalizer;

import java.util.Optional;

/**
 * Digits-only phone match. A single leading {@code 1} (US/Canada country code) on one
 * side is tolerated; other country codes are not recognised.
 */
public class PhoneComparator extends NormalizedValueComparator {

    public static final String FIELD = "phone";
    public static final double CONFIDENCE = 70.0;

    private static final char NANP_COUNTRY_CODE = '1';

    @Override
    public String fieldName() {
        return FIELD;
    }

    @Override
    protected String normalizedValue(ContactRecord record) {
        return ContactNormalizer.normalizePhone(record.getPhone());
    }

    @Override
    protected Optional<FieldMatch> compareValues(String incoming, String existing) {
        if (incoming.equals(existing)) {
            return Optional.of(new FieldMatch(FIELD, CONFIDENCE, MatchType.NORMALIZED, existing,
                    "Phone number match: " + existing));
        }
        if (differsByCountryCode(incoming, existing) || differsByCountryCode(existing, incoming)) {
            return Optional.of(new FieldMatch(FIELD, CONFIDENCE, MatchType.NORMALIZED, existing,
                    "Phone number match ignoring country code 1: " + existing));
        }
        return Optional.empty();
    }

    private static boolean differsByCountryCode(String longer, String shorter) {
        return longer.length() == shorter.length() + 1
                && longer.charAt(0) == NANP_COUNTRY_CODE
                && longer.endsWith(shorter);
    }
}

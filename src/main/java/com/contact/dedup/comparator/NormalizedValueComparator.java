package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;

import java.util.Optional;

/**
 * Base class for comparators that reduce each record to a single normalized value
 * and abstain whenever either side has none.
 */
public abstract class NormalizedValueComparator implements FieldComparator {

    @Override
    public final Optional<FieldMatch> compare(ContactRecord incoming, ContactRecord existing) {
        String incomingValue = normalizedValue(incoming);
        String existingValue = normalizedValue(existing);
        if (incomingValue == null || existingValue == null) {
            return Optional.empty();
        }
        return compareValues(incomingValue, existingValue);
    }

    @Override
    public boolean appliesTo(ContactRecord record) {
        return normalizedValue(record) != null;
    }

    @Override
    public String fingerprintValue(ContactRecord record) {
        return normalizedValue(record);
    }

    /**
     * Extracts and normalizes this comparator's value; null when absent.
     */
    protected abstract String normalizedValue(ContactRecord record);

    /**
     * Compares two non-null normalized values.
     */
    protected abstract Optional<FieldMatch> compareValues(String incoming, String existing);
}

package com.contact.dedup.comparator;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;

import java.util.Optional;

/**
 * Compares one identifying attribute of two contact records.
 *
 * <p>Implementations are pure functions: no state, no I/O, safe to call from any thread.
 * An empty result means "no signal" (a value is missing on either side, or the values
 * do not match), never an error.</p>
 */
public interface FieldComparator {

    /**
     * Name under which this comparator is registered and reported in {@link FieldMatch#fieldName()}.
     */
    String fieldName();

    /**
     * Compares the incoming record against an existing one.
     *
     * @param incoming the record being checked
     * @param existing a candidate already in the store
     * @return the match, or empty when there is no signal
     */
    Optional<FieldMatch> compare(ContactRecord incoming, ContactRecord existing);

    /**
     * Whether the record carries a value this comparator can use.
     */
    default boolean appliesTo(ContactRecord record) {
        return true;
    }

    /**
     * Canonical form of the compared value, folded into the record fingerprint so that
     * records differing only in this field are cached separately. The default of null
     * leaves the field out of the fingerprint.
     */
    default String fingerprintValue(ContactRecord record) {
        return null;
    }
}

package com.contact.dedup.matching;

import com.contact.dedup.comparator.ComparatorRegistry;
import com.contact.dedup.comparator.FieldComparator;
import com.contact.dedup.core.model.ContactRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the normalized values the registered comparators compare. Records that
 * differ only in case, punctuation or payload share a fingerprint, which makes it a cache
 * key for duplicate-check results.
 *
 * <p>A custom comparator contributes only if it overrides
 * {@link FieldComparator#fingerprintValue(ContactRecord)}; otherwise records that differ
 * only in its field share a fingerprint.</p>
 */
public final class RecordFingerprint {

    private static final ComparatorRegistry DEFAULT_REGISTRY = ComparatorRegistry.defaults();

    private RecordFingerprint() {
        // Utility class
    }

    /**
     * Fingerprint over the built-in identifying fields.
     */
    public static String of(ContactRecord record) {
        return of(record, DEFAULT_REGISTRY);
    }

    /**
     * Fingerprint over the fields of every comparator in the registry, in registry order.
     */
    public static String of(ContactRecord record, ComparatorRegistry registry) {
        StringBuilder canonical = new StringBuilder();
        for (FieldComparator comparator : registry.comparators()) {
            String value = comparator.fingerprintValue(record);
            if (canonical.length() > 0) {
                canonical.append('|');
            }
            canonical.append(comparator.fieldName()).append('=').append(value == null ? "" : value);
        }
        return sha256(canonical.toString());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

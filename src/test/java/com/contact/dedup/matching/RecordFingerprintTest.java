package com.contact.dedup.matching;

import com.contact.dedup.comparator.ComparatorRegistry;
import com.contact.dedup.comparator.CrmIdComparator;
import com.contact.dedup.core.model.ContactRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecordFingerprintTest {

    @Test
    @DisplayName("Fingerprint is a 64-character hex SHA-256")
    void testFormat() {
        String fingerprint = RecordFingerprint.of(ContactRecord.builder().email("a@acme.com").build());
        assertTrue(fingerprint.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("Formatting differences in identifying fields do not change the fingerprint")
    void testNormalizedInputs() {
        ContactRecord a = ContactRecord.builder()
                .email("John@Acme.com").phone("+1 (555) 123-4567").companyName("Acme, Inc.").build();
        ContactRecord b = ContactRecord.builder()
                .email(" john@acme.com").phone("1 555 123 4567").companyName("ACME inc").build();

        assertEquals(RecordFingerprint.of(a), RecordFingerprint.of(b));
    }

    @Test
    @DisplayName("Descriptive fields and payload are not part of the fingerprint")
    void testIgnoresDescriptiveFields() {
        ContactRecord a = ContactRecord.builder().email("a@acme.com").build();
        ContactRecord b = a.toBuilder().id("c-9").firstName("Ann").title("CTO")
                .attribute("source", "crm").build();

        assertEquals(RecordFingerprint.of(a), RecordFingerprint.of(b));
    }

    @Test
    @DisplayName("Different identifying values give different fingerprints")
    void testDifferentRecords() {
        ContactRecord a = ContactRecord.builder().email("a@acme.com").build();
        ContactRecord b = ContactRecord.builder().email("b@acme.com").build();
        assertNotEquals(RecordFingerprint.of(a), RecordFingerprint.of(b));
    }

    @Test
    @DisplayName("Registered custom fields take part in the fingerprint")
    void testCustomComparatorField() {
        ComparatorRegistry registry = ComparatorRegistry.defaults().with(new CrmIdComparator());
        ContactRecord a = ContactRecord.builder().email("a@acme.com").attribute("crm_id", "SF-1").build();
        ContactRecord b = ContactRecord.builder().email("a@acme.com").attribute("crm_id", "SF-2").build();

        assertNotEquals(RecordFingerprint.of(a, registry), RecordFingerprint.of(b, registry));
        assertEquals(RecordFingerprint.of(a), RecordFingerprint.of(b));
    }
}

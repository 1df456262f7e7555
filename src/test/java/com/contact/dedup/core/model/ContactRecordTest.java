package com.contact.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContactRecordTest {

    @Test
    @DisplayName("Empty record has no identifying fields")
    void testEmptyRecord() {
        ContactRecord empty = ContactRecord.empty();
        assertFalse(empty.hasIdentifyingFields());
        assertTrue(empty.getAttributes().isEmpty());
        assertNull(empty.getUpdatedAt());
    }

    @Test
    @DisplayName("Blank identifying values do not count as present")
    void testBlankValuesAreNotIdentifying() {
        ContactRecord record = ContactRecord.builder()
                .email("   ")
                .firstName("John")
                .title("CEO")
                .build();
        assertFalse(record.hasIdentifyingFields());
    }

    @Test
    @DisplayName("Any single identifying field makes the record comparable")
    void testSingleIdentifyingField() {
        assertTrue(ContactRecord.builder().phone("555-1234").build().hasIdentifyingFields());
        assertTrue(ContactRecord.builder().website("acme.com").build().hasIdentifyingFields());
        assertTrue(ContactRecord.builder().companyName("Acme").build().hasIdentifyingFields());
    }

    @Test
    @DisplayName("Null attribute values are dropped and the payload is unmodifiable")
    void testAttributes() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("source", "crm");
        payload.put("score", null);

        ContactRecord record = ContactRecord.builder()
                .attributes(payload)
                .attribute("tags", List.of("vip"))
                .build();

        assertEquals(Map.of("source", "crm", "tags", List.of("vip")), record.getAttributes());
        assertThrows(UnsupportedOperationException.class,
                () -> record.getAttributes().put("x", 1));
    }

    @Test
    @DisplayName("Records with the same values are equal")
    void testValueEquality() {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        ContactRecord a = ContactRecord.builder().id("c-1").email("a@acme.com").updatedAt(now)
                .attribute("source", "crm").build();
        ContactRecord b = ContactRecord.builder().id("c-1").email("a@acme.com").updatedAt(now)
                .attribute("source", "crm").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.toBuilder().email("b@acme.com").build());
    }

    @Test
    @DisplayName("toBuilder copies every field")
    void testToBuilder() {
        ContactRecord original = ContactRecord.builder()
                .id("c-1").email("a@acme.com").domain("acme.com").website("https://acme.com")
                .professionalProfileUrl("linkedin.com/in/a").phone("555").companyName("Acme")
                .firstName("Ann").lastName("Lee").title("CTO")
                .updatedAt(Instant.EPOCH)
                .attribute("source", "crm")
                .build();

        assertEquals(original, original.toBuilder().build());
    }

    @Test
    @DisplayName("Later changes to the caller's nested payload do not reach the record")
    void testNestedAttributesAreCopied() {
        Map<String, Object> enrichment = new HashMap<>();
        enrichment.put("industry", "Software");
        List<String> tags = new ArrayList<>(List.of("lead"));
        Map<String, Object> payload = new HashMap<>();
        payload.put("enrichment", enrichment);
        payload.put("tags", tags);

        ContactRecord record = ContactRecord.builder().attributes(payload).build();
        ContactRecord twin = ContactRecord.builder()
                .attribute("enrichment", Map.of("industry", "Software"))
                .attribute("tags", List.of("lead"))
                .build();
        int hashBefore = record.hashCode();

        enrichment.put("industry", "SaaS");
        tags.add("vip");
        payload.put("source", "crm");

        assertEquals(Map.of("industry", "Software"), record.getAttributes().get("enrichment"));
        assertEquals(List.of("lead"), record.getAttributes().get("tags"));
        assertEquals(hashBefore, record.hashCode());
        assertEquals(twin, record);
    }

    @Test
    @DisplayName("Nested payload values are unmodifiable and keep their shape")
    void testNestedAttributesAreUnmodifiable() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("b", 2);
        nested.put("a", Set.of("x"));

        ContactRecord record = ContactRecord.builder().attribute("nested", nested).build();

        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) record.getAttributes().get("nested");
        assertEquals(List.of("b", "a"), new ArrayList<>(copy.keySet()));
        assertInstanceOf(Set.class, copy.get("a"));
        assertThrows(UnsupportedOperationException.class, () -> copy.put("c", 3));
    }
}

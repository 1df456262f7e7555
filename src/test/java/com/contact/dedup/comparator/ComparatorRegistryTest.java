package com.contact.dedup.comparator;

import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.FieldMatch;
import com.contact.dedup.core.model.MatchType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ComparatorRegistryTest {

    @Test
    @DisplayName("Defaults register the five identifying comparators in order")
    void testDefaults() {
        ComparatorRegistry registry = ComparatorRegistry.defaults();
        assertEquals(List.of("email", "domain", "professional_profile_url", "phone", "company_name"),
                registry.fieldNames());
        assertEquals(5, registry.size());
    }

    @Test
    @DisplayName("Custom floor is passed to the company comparator")
    void testCustomFloor() {
        ComparatorRegistry registry = ComparatorRegistry.defaults(0.7);
        CompanyNameComparator company = (CompanyNameComparator) registry.get("company_name").orElseThrow();
        assertEquals(0.7, company.getSimilarityFloor());
        assertThrows(InvalidConfigurationException.class, () -> ComparatorRegistry.defaults(2.0));
    }

    @Test
    @DisplayName("with adds or replaces, without removes, and the original is untouched")
    void testWithAndWithout() {
        FieldComparator title = new FieldComparator() {
            @Override
            public String fieldName() {
                return "title";
            }

            @Override
            public Optional<FieldMatch> compare(ContactRecord incoming, ContactRecord existing) {
                return Optional.of(new FieldMatch("title", 10, MatchType.EXACT, existing.getTitle(), "title"));
            }
        };

        ComparatorRegistry base = ComparatorRegistry.defaults();
        ComparatorRegistry extended = base.with(title).without("phone");

        assertEquals(List.of("email", "domain", "professional_profile_url", "company_name", "title"),
                extended.fieldNames());
        assertEquals(5, base.size());
        assertTrue(base.get("title").isEmpty());
        assertSame(title, extended.get("title").orElseThrow());
    }
}

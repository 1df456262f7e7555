package com.contact.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchModelTest {

    private static final ContactRecord EXISTING = ContactRecord.builder().id("c-1").email("a@acme.com").build();

    private static FieldMatch match(String field, double confidence) {
        return new FieldMatch(field, confidence, MatchType.EXACT, "v", "reason");
    }

    @Nested
    @DisplayName("FieldMatch")
    class FieldMatchTests {

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 100.1, Double.NaN})
        @DisplayName("Should reject confidence outside 0-100")
        void testInvalidConfidence(double confidence) {
            assertThrows(IllegalArgumentException.class, () -> match("email", confidence));
        }

        @Test
        @DisplayName("Should accept the range boundaries")
        void testBoundaries() {
            assertEquals(0.0, match("email", 0.0).confidence());
            assertEquals(100.0, match("email", 100.0).confidence());
        }
    }

    @Nested
    @DisplayName("MatchCandidate")
    class MatchCandidateTests {

        @Test
        @DisplayName("Aggregate confidence is the maximum signal")
        void testMaxAggregation() {
            MatchCandidate candidate = MatchCandidate.of(EXISTING,
                    List.of(match("phone", 70), match("email", 100), match("domain", 80)));
            assertEquals(100.0, candidate.confidence());
            assertEquals(List.of("phone", "email", "domain"), candidate.matchedFields());
        }

        @Test
        @DisplayName("Needs at least one field match")
        void testEmptyMatches() {
            assertThrows(IllegalArgumentException.class, () -> MatchCandidate.of(EXISTING, List.of()));
        }
    }

    @Nested
    @DisplayName("DuplicateDecision")
    class DuplicateDecisionTests {

        @Test
        @DisplayName("No-match decision has zero confidence and no best match")
        void testNoMatch() {
            DuplicateDecision decision = DuplicateDecision.noMatch("fp", 85.0, List.of("email"));
            assertFalse(decision.isDuplicate());
            assertTrue(decision.bestMatch().isEmpty());
            assertEquals(0.0, decision.confidence());
            assertEquals(List.of("email"), decision.checkedFields());
        }

        @Test
        @DisplayName("Best match is the first ranked candidate")
        void testBestMatch() {
            MatchCandidate top = MatchCandidate.of(EXISTING, List.of(match("email", 100)));
            MatchCandidate second = MatchCandidate.of(EXISTING, List.of(match("phone", 70)));
            DuplicateDecision decision = new DuplicateDecision("fp", List.of(top, second), true, 85.0, List.of());

            assertSame(top, decision.bestMatch().orElseThrow());
            assertEquals(100.0, decision.confidence());
            assertTrue(decision.isDuplicate());
        }
    }
}

package com.contact.dedup.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @ParameterizedTest
    @DisplayName("Should compute edit distance")
    @CsvSource({
            "kitten,sitting,3",
            "flaw,lawn,2",
            "acme,acme,0",
            "'',abc,3",
            "abc,'',3"
    })
    void testDistance(String s1, String s2, int expected) {
        assertEquals(expected, LevenshteinSimilarity.distance(s1, s2));
    }

    @Test
    @DisplayName("Similarity is one minus distance over the longer length")
    void testSimilarity() {
        assertEquals(1.0, similarity.compute("acme", "acme"));
        assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
        assertEquals(similarity.compute("abc", "abd"), similarity.compute("abd", "abc"));
    }

    @Test
    @DisplayName("Null or one-sided empty input scores zero")
    void testAbsentInput() {
        assertEquals(0.0, similarity.compute(null, "acme"));
        assertEquals(0.0, similarity.compute("acme", null));
        assertEquals(0.0, similarity.compute("", "acme"));
    }

    @Test
    void testName() {
        assertEquals("Levenshtein", similarity.getName());
    }
}

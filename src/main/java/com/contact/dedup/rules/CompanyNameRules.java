package com.contact.dedup.rules;

import java.util.List;

/**
 * Built-in normalization rules for company names.
 *
 * <p>Punctuation goes first so that {@code "Acme, Inc."} and {@code "Acme Inc"} reduce to the
 * same tokens; legal-entity and generic business suffixes are then removed as whole words.
 * The resulting form contains only letters, digits and single spaces, which makes the
 * normalization idempotent.</p>
 */
public final class CompanyNameRules {

    /**
     * Suffix words removed from company names.
     */
    public static final List<String> LEGAL_SUFFIXES = List.of(
            "incorporated", "corporation", "technologies", "technology",
            "solutions", "enterprises", "holdings", "services",
            "limited", "company", "group", "inc", "corp", "llc",
            "ltd", "co", "tech", "plc", "gmbh"
    );

    private CompanyNameRules() {
        // Utility class
    }

    /**
     * Creates an engine with all default company rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                // Separators become spaces so "Acme-Corp" keeps two tokens
                NormalizationRule.builder()
                        .name("company-separators")
                        .pattern("[&/\\-_+]")
                        .replacement(" ")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("company-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("company-legal-suffixes")
                        .wholeWords(LEGAL_SUFFIXES.toArray(String[]::new))
                        .replacement(" ")
                        .priority(20)
                        .build()
        );
    }
}

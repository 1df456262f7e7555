package com.contact.dedup.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies an ordered list of {@link NormalizationRule}s to a name, then lower-cases,
 * trims and collapses whitespace. Immutable and safe to share between threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Returns a new engine with the given rule added.
     */
    public NormalizationEngine withRule(NormalizationRule rule) {
        List<NormalizationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new NormalizationEngine(extended);
    }

    /**
     * Returns a new engine without the named rule.
     */
    public NormalizationEngine withoutRule(String ruleName) {
        List<NormalizationRule> remaining = new ArrayList<>(rules);
        remaining.removeIf(r -> r.getName().equals(ruleName));
        return new NormalizationEngine(remaining);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the given name. Null or blank input yields an empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two names are equal after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}

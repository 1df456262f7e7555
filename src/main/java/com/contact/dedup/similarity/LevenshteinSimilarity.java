package com.contact.dedup.similarity;

/**
 * Levenshtein distance-based similarity: {@code 1 - distance / max(len(s1), len(s2))}.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int maxLength = Math.max(s1.length(), s2.length());
        return Math.max(0.0, 1.0 - ((double) distance(s1, s2) / maxLength));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Minimum number of single-character insertions, deletions and substitutions
     * turning one string into the other. Two-row Wagner-Fischer, O(min(m,n)) space.
     */
    public static int distance(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();
        if (m == 0) {
            return n;
        }

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            char c2 = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == c2 ? 0 : 1;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + cost
                );
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}

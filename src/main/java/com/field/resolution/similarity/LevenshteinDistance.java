package com.field.resolution.similarity;

/**
 * Levenshtein edit distance (insertions, deletions and substitutions, each costing 1).
 */
public final class LevenshteinDistance {

    private LevenshteinDistance() {
        // Utility class
    }

    /**
     * Computes the edit distance between two strings.
     * Uses the Wagner-Fischer algorithm with O(min(m,n)) space.
     */
    public static int between(String s1, String s2) {
        // Ensure s1 is the shorter string for space optimization
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

            for (int i = 1; i <= m; i++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
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

    /**
     * Similarity relative to a reference word: 1 - distance / reference length.
     * May be negative when the distance exceeds the reference length.
     */
    public static double similarityTo(String reference, int distance) {
        return 1.0 - ((double) distance / Math.max(reference.length(), 1));
    }
}

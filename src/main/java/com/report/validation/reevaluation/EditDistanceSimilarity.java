package com.report.validation.reevaluation;

/**
 * Normalized Levenshtein similarity: {@code (longer - distance) / longer}, in [0, 1].
 */
public final class EditDistanceSimilarity {

    private EditDistanceSimilarity() {
        // Utility class
    }

    public static double similarity(String a, String b) {
        String longer = a.length() >= b.length() ? a : b;
        String shorter = longer == a ? b : a;
        if (longer.isEmpty()) {
            return 1.0;
        }
        return (longer.length() - distance(longer, shorter)) / (double) longer.length();
    }

    public static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

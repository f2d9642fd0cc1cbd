package com.lucas.script.errors;

/**
 * "Did you mean" engine for undefined names.
 */
public final class Suggestions {

    /** Largest edit distance still worth proposing. */
    public static final int MAX_DISTANCE = 2;

    private Suggestions() {}

    /**
     * Returns the candidate closest to {@code name} by edit distance, or null when none
     * is within {@link #MAX_DISTANCE}. On ties the first candidate in iteration order wins.
     */
    public static String closest(String name, Iterable<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int d = levenshtein(name, candidate);
            if (d <= MAX_DISTANCE && d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        return best;
    }

    public static String didYouMean(String candidate) {
        return "Você quis dizer '" + candidate + "'?";
    }

    /** Classic dynamic-programming edit distance, counted in code points. */
    public static int levenshtein(String a, String b) {
        int[] s1 = a.codePoints().toArray();
        int[] s2 = b.codePoints().toArray();
        if (s1.length == 0) return s2.length;
        if (s2.length == 0) return s1.length;

        int[][] matrix = new int[s1.length + 1][s2.length + 1];
        for (int i = 0; i <= s1.length; i++) matrix[i][0] = i;
        for (int j = 0; j <= s2.length; j++) matrix[0][j] = j;

        for (int i = 0; i < s1.length; i++) {
            for (int j = 0; j < s2.length; j++) {
                int cost = (s1[i] == s2[j]) ? 0 : 1;
                matrix[i + 1][j + 1] = Math.min(
                        Math.min(matrix[i][j + 1] + 1, matrix[i + 1][j] + 1),
                        matrix[i][j] + cost);
            }
        }
        return matrix[s1.length][s2.length];
    }
}

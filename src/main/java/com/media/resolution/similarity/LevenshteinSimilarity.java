package com.media.resolution.similarity;

/**
 * Edit-distance similarity over Unicode code points, scored as
 * {@code 1 - distance / longerLength}.
 *
 * <p>Counting code points rather than UTF-16 units keeps a supplementary CJK character
 * to a single edit, so native titles score the same as romaji ones of equal length.</p>
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
        int[] a = s1.codePoints().toArray();
        int[] b = s2.codePoints().toArray();
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        return 1.0 - (double) distance(a, b) / Math.max(a.length, b.length);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    static int distance(String s1, String s2) {
        return distance(s1.codePoints().toArray(), s2.codePoints().toArray());
    }

    /**
     * Single-row dynamic programming; {@code row} is sized by the shorter input.
     */
    private static int distance(int[] a, int[] b) {
        int[] shorter = a.length <= b.length ? a : b;
        int[] longer = shorter == a ? b : a;

        int[] row = new int[shorter.length + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int cp : longer) {
            int diagonal = row[0];
            row[0]++;
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                int substitution = diagonal + (shorter[i - 1] == cp ? 0 : 1);
                row[i] = Math.min(substitution, Math.min(above, row[i - 1]) + 1);
                diagonal = above;
            }
        }
        return row[shorter.length];
    }
}

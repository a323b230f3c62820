package com.media.resolution.similarity;

/**
 * Share of the longer string covered by the common prefix of both strings.
 * Whitespace is ignored, so "one piece" and "onepiece" are identical.
 */
public class PrefixSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = stripWhitespace(s1);
        String b = stripWhitespace(s2);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        String longer = a.length() >= b.length() ? a : b;
        String shorter = longer == a ? b : a;

        int matches = 0;
        while (matches < shorter.length() && longer.charAt(matches) == shorter.charAt(matches)) {
            matches++;
        }
        return (double) matches / longer.length();
    }

    @Override
    public String getName() {
        return "Prefix";
    }

    private static String stripWhitespace(String s) {
        return s.replaceAll("\\s+", "");
    }
}

package com.airwave.resolution.similarity;

/**
 * Ratcliff/Obershelp "gestalt pattern matching" similarity.
 * Computes 2 * M / T where M is the number of characters in matching blocks,
 * found by recursively taking the longest common substring and matching
 * the text on either side of it, and T is the combined length of both strings.
 */
public class RatcliffObershelpSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0 || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int matches = matchingCharacters(s1, 0, s1.length(), s2, 0, s2.length());
        return 2.0 * matches / total;
    }

    @Override
    public String getName() {
        return "RatcliffObershelp";
    }

    private int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int[] longest = longestMatch(a, aLo, aHi, b, bLo, bHi);
        int size = longest[2];
        if (size == 0) {
            return 0;
        }
        int i = longest[0];
        int j = longest[1];
        return size
                + matchingCharacters(a, aLo, i, b, bLo, j)
                + matchingCharacters(a, i + size, aHi, b, j + size, bHi);
    }

    /**
     * Longest common substring of a[aLo:aHi] and b[bLo:bHi], earliest in a on ties.
     * Returns {start in a, start in b, length}.
     */
    private int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];

        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    if (current[k] > bestSize) {
                        bestSize = current[k];
                        bestI = i - bestSize + 1;
                        bestJ = j - bestSize + 1;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}

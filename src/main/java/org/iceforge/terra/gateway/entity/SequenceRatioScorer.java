package org.iceforge.terra.gateway.entity;

/**
 * Ratcliff/Obershelp "gestalt" ratio: {@code 2 * M / (|a| + |b|)} where M is the number of
 * characters in recursively found longest common blocks.
 */
public class SequenceRatioScorer extends TieredScorer {

    @Override
    protected double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matches(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matches(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int bestI = aLo;
        int bestJ = bLo;
        int bestLen = 0;
        // lengths of common suffixes ending at (i, j), one row at a time
        int[] prev = new int[bHi - bLo + 1];
        int[] cur = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = 0;
                if (a.charAt(i) == b.charAt(j)) {
                    k = prev[j - bLo] + 1;
                    if (k > bestLen) {
                        bestLen = k;
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                    }
                }
                cur[j - bLo + 1] = k;
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        if (bestLen == 0) {
            return 0;
        }
        return bestLen
                + matches(a, aLo, bestI, b, bLo, bestJ)
                + matches(a, bestI + bestLen, aHi, b, bestJ + bestLen, bHi);
    }
}

package org.iceforge.terra.gateway.entity;

import java.util.Locale;

/**
 * Case-insensitive scoring in three tiers: exact match 1.0, containment either way 0.9,
 * otherwise the subclass's similarity ratio.
 */
public abstract class TieredScorer implements SimilarityScorer {

    static final double EXACT = 1.0;
    static final double CONTAINS = 0.9;

    @Override
    public double score(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return 0.0;
        }
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        if (x.equals(y)) {
            return EXACT;
        }
        if (x.contains(y) || y.contains(x)) {
            return CONTAINS;
        }
        return ratio(x, y);
    }

    /**
     * Similarity of two lower-cased, non-empty, unequal strings.
     */
    protected abstract double ratio(String a, String b);
}

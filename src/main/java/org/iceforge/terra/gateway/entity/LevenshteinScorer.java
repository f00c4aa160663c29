package org.iceforge.terra.gateway.entity;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Edit-distance scorer: {@code 1 - distance / max(|a|, |b|)}.
 */
public class LevenshteinScorer extends TieredScorer {

    private static final LevenshteinDistance DISTANCE = LevenshteinDistance.getDefaultInstance();

    @Override
    protected double ratio(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) DISTANCE.apply(a, b) / longest;
    }
}

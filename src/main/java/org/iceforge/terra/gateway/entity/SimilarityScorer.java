package org.iceforge.terra.gateway.entity;

/**
 * Scores how alike two names are, in {@code [0, 1]}. 1.0 means identical.
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(String a, String b);
}

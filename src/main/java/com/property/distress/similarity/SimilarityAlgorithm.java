package com.property.distress.similarity;

/**
 * String similarity used by the fuzzy resolver tiers.
 * Implementations return 0.0 (nothing in common) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Similarity on the 0-100 scale that resolver thresholds are expressed in.
     */
    default double score(String s1, String s2) {
        return compute(s1, s2) * 100.0;
    }

    String getName();
}

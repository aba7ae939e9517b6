package com.speaker.identity.similarity;

/**
 * Interface for similarity measures between speaker embeddings.
 * Implementations return a score in [-1.0, 1.0], where 1.0 means identical direction.
 */
public interface EmbeddingSimilarity {

    /**
     * Computes the similarity between two embeddings of equal dimension.
     *
     * @param a first embedding
     * @param b second embedding
     * @return similarity score, or 0.0 if either vector is null, empty or the dimensions differ
     */
    double compute(float[] a, float[] b);

    /**
     * Returns the name of this measure.
     */
    String getName();
}

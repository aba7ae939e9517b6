package com.speaker.identity.clustering;

/**
 * Configuration for the unknown-speaker clusterer.
 *
 * @param similarityThreshold   minimum similarity to join an existing unknown cluster
 * @param confidenceMargin      margin reported for diagnostics; ambiguity never blocks assignment
 * @param maxUnknownSpeakers    cluster cap; beyond it utterances are forced into the best cluster
 * @param minSegmentsForCluster clusters smaller than this are not reported as unknown speakers
 * @param undoHistoryDepth      exact undo snapshots kept per cluster
 */
public record UnknownClusteringOptions(
        double similarityThreshold,
        double confidenceMargin,
        int maxUnknownSpeakers,
        int minSegmentsForCluster,
        int undoHistoryDepth
) {

    public UnknownClusteringOptions {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
        }
        if (confidenceMargin < 0.0 || confidenceMargin > 1.0) {
            throw new IllegalArgumentException("confidenceMargin must be between 0.0 and 1.0");
        }
        if (maxUnknownSpeakers <= 0) {
            throw new IllegalArgumentException("maxUnknownSpeakers must be > 0");
        }
        if (minSegmentsForCluster <= 0) {
            throw new IllegalArgumentException("minSegmentsForCluster must be > 0");
        }
        if (undoHistoryDepth < 0) {
            throw new IllegalArgumentException("undoHistoryDepth must be >= 0");
        }
    }

    /**
     * Default configuration: threshold 0.70, margin 0.10, up to 5 clusters, 2 segments to report.
     */
    public static UnknownClusteringOptions defaults() {
        return new UnknownClusteringOptions(0.70, 0.10, 5, 2, 16);
    }

    public UnknownClusteringOptions withMaxUnknownSpeakers(int maxUnknownSpeakers) {
        return new UnknownClusteringOptions(similarityThreshold, confidenceMargin, maxUnknownSpeakers,
                minSegmentsForCluster, undoHistoryDepth);
    }

    public UnknownClusteringOptions withSimilarityThreshold(double similarityThreshold) {
        return new UnknownClusteringOptions(similarityThreshold, confidenceMargin, maxUnknownSpeakers,
                minSegmentsForCluster, undoHistoryDepth);
    }

    public UnknownClusteringOptions withMinSegmentsForCluster(int minSegmentsForCluster) {
        return new UnknownClusteringOptions(similarityThreshold, confidenceMargin, maxUnknownSpeakers,
                minSegmentsForCluster, undoHistoryDepth);
    }
}

package com.speaker.identity.clustering;

/**
 * Options for the primary speaker clustering engine.
 * Configures thresholds, the speaker cap, unknown routing and the enrolled-centroid policy.
 */
public class ClusteringOptions {

    public static final int MIN_SPEAKERS = 1;
    public static final int MAX_SPEAKERS = 10;

    private static final int DEFAULT_NUM_SPEAKERS = 2;
    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;
    private static final double DEFAULT_MINIMUM_SIMILARITY_THRESHOLD = 0.5;
    private static final double DEFAULT_CONFIDENCE_MARGIN = 0.15;
    private static final double DEFAULT_INTER_ENROLLMENT_WARNING_THRESHOLD = 0.72;
    private static final double DEFAULT_ENROLLED_TIE_TOLERANCE = 0.01;
    private static final int DEFAULT_UNDO_HISTORY_DEPTH = 16;

    private final int numSpeakers;
    private final double similarityThreshold;
    private final double minimumSimilarityThreshold;
    private final double confidenceMargin;
    private final double interEnrollmentWarningThreshold;
    private final double enrolledTieTolerance;
    private final boolean updateEnrolledCentroids;
    private final UnknownRoutingPolicy unknownRoutingPolicy;
    private final int undoHistoryDepth;

    private ClusteringOptions(Builder builder) {
        this.numSpeakers = builder.numSpeakers;
        this.similarityThreshold = builder.similarityThreshold;
        this.minimumSimilarityThreshold = builder.minimumSimilarityThreshold;
        this.confidenceMargin = builder.confidenceMargin;
        this.interEnrollmentWarningThreshold = builder.interEnrollmentWarningThreshold;
        this.enrolledTieTolerance = builder.enrolledTieTolerance;
        this.updateEnrolledCentroids = builder.updateEnrolledCentroids;
        this.unknownRoutingPolicy = builder.unknownRoutingPolicy;
        this.undoHistoryDepth = builder.undoHistoryDepth;
    }

    /**
     * Maximum number of live primary speakers (enrolled plus discovered).
     */
    public int getNumSpeakers() {
        return numSpeakers;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public double getMinimumSimilarityThreshold() {
        return minimumSimilarityThreshold;
    }

    public double getConfidenceMargin() {
        return confidenceMargin;
    }

    public double getInterEnrollmentWarningThreshold() {
        return interEnrollmentWarningThreshold;
    }

    /**
     * Candidates whose similarities differ by no more than this are treated as tied,
     * and ties resolve toward enrolled speakers.
     */
    public double getEnrolledTieTolerance() {
        return enrolledTieTolerance;
    }

    /**
     * When false (the default) enrolled centroids are fixed anchors and confident
     * matches only refine discovered speakers.
     */
    public boolean isUpdateEnrolledCentroids() {
        return updateEnrolledCentroids;
    }

    public UnknownRoutingPolicy getUnknownRoutingPolicy() {
        return unknownRoutingPolicy;
    }

    public int getUndoHistoryDepth() {
        return undoHistoryDepth;
    }

    /**
     * Clamps a requested speaker count to the supported range.
     */
    public static int clampNumSpeakers(int numSpeakers) {
        return Math.max(MIN_SPEAKERS, Math.min(numSpeakers, MAX_SPEAKERS));
    }

    /**
     * Creates default options.
     */
    public static ClusteringOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .numSpeakers(numSpeakers)
                .similarityThreshold(similarityThreshold)
                .minimumSimilarityThreshold(minimumSimilarityThreshold)
                .confidenceMargin(confidenceMargin)
                .interEnrollmentWarningThreshold(interEnrollmentWarningThreshold)
                .enrolledTieTolerance(enrolledTieTolerance)
                .updateEnrolledCentroids(updateEnrolledCentroids)
                .unknownRoutingPolicy(unknownRoutingPolicy)
                .undoHistoryDepth(undoHistoryDepth);
    }

    public static class Builder {
        private int numSpeakers = DEFAULT_NUM_SPEAKERS;
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private double minimumSimilarityThreshold = DEFAULT_MINIMUM_SIMILARITY_THRESHOLD;
        private double confidenceMargin = DEFAULT_CONFIDENCE_MARGIN;
        private double interEnrollmentWarningThreshold = DEFAULT_INTER_ENROLLMENT_WARNING_THRESHOLD;
        private double enrolledTieTolerance = DEFAULT_ENROLLED_TIE_TOLERANCE;
        private boolean updateEnrolledCentroids = false;
        private UnknownRoutingPolicy unknownRoutingPolicy = UnknownRoutingPolicy.WHEN_ENROLLED;
        private int undoHistoryDepth = DEFAULT_UNDO_HISTORY_DEPTH;

        /**
         * Sets the speaker cap, clamped to [1, 10].
         */
        public Builder numSpeakers(int numSpeakers) {
            this.numSpeakers = clampNumSpeakers(numSpeakers);
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            validateThreshold(similarityThreshold, "similarityThreshold");
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder minimumSimilarityThreshold(double minimumSimilarityThreshold) {
            validateThreshold(minimumSimilarityThreshold, "minimumSimilarityThreshold");
            this.minimumSimilarityThreshold = minimumSimilarityThreshold;
            return this;
        }

        public Builder confidenceMargin(double confidenceMargin) {
            validateThreshold(confidenceMargin, "confidenceMargin");
            this.confidenceMargin = confidenceMargin;
            return this;
        }

        public Builder interEnrollmentWarningThreshold(double interEnrollmentWarningThreshold) {
            validateThreshold(interEnrollmentWarningThreshold, "interEnrollmentWarningThreshold");
            this.interEnrollmentWarningThreshold = interEnrollmentWarningThreshold;
            return this;
        }

        public Builder enrolledTieTolerance(double enrolledTieTolerance) {
            validateThreshold(enrolledTieTolerance, "enrolledTieTolerance");
            this.enrolledTieTolerance = enrolledTieTolerance;
            return this;
        }

        public Builder updateEnrolledCentroids(boolean updateEnrolledCentroids) {
            this.updateEnrolledCentroids = updateEnrolledCentroids;
            return this;
        }

        public Builder unknownRoutingPolicy(UnknownRoutingPolicy unknownRoutingPolicy) {
            if (unknownRoutingPolicy == null) {
                throw new IllegalArgumentException("unknownRoutingPolicy is required");
            }
            this.unknownRoutingPolicy = unknownRoutingPolicy;
            return this;
        }

        public Builder undoHistoryDepth(int undoHistoryDepth) {
            if (undoHistoryDepth < 0) {
                throw new IllegalArgumentException("undoHistoryDepth must be >= 0");
            }
            this.undoHistoryDepth = undoHistoryDepth;
            return this;
        }

        public ClusteringOptions build() {
            if (similarityThreshold < minimumSimilarityThreshold) {
                throw new IllegalArgumentException(
                        "similarityThreshold must be >= minimumSimilarityThreshold");
            }
            return new ClusteringOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ClusteringOptions{" +
                "numSpeakers=" + numSpeakers +
                ", similarityThreshold=" + similarityThreshold +
                ", minimumSimilarityThreshold=" + minimumSimilarityThreshold +
                ", confidenceMargin=" + confidenceMargin +
                ", interEnrollmentWarningThreshold=" + interEnrollmentWarningThreshold +
                ", enrolledTieTolerance=" + enrolledTieTolerance +
                ", updateEnrolledCentroids=" + updateEnrolledCentroids +
                ", unknownRoutingPolicy=" + unknownRoutingPolicy +
                ", undoHistoryDepth=" + undoHistoryDepth +
                '}';
    }
}

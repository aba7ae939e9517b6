package com.speaker.identity.core.model;

/**
 * Why a speaker assignment was made.
 * Every outcome of the clustering pipeline, including degraded ones, is one of these
 * values, so callers never need to catch exceptions on the assignment path.
 */
public enum AssignmentReason {
    /**
     * The utterance carried no usable embedding. Defaults to speaker 0 without
     * touching any centroid.
     */
    NO_EMBEDDING("no_embedding"),

    /**
     * A new discovered speaker was created for this utterance.
     */
    NEW_SPEAKER("new_speaker"),

    /**
     * Best similarity cleared the threshold with a comfortable margin over the runner-up.
     */
    CONFIDENT_MATCH("confident_match"),

    /**
     * Best similarity cleared the threshold but the runner-up was too close.
     * The best candidate is still assigned; the decision is flagged for display.
     */
    AMBIGUOUS_MATCH("ambiguous_match"),

    /**
     * Forced assignment to the best candidate because the speaker cap was reached.
     */
    BELOW_MINIMUM_THRESHOLD("below_minimum_threshold"),

    /**
     * Handed off to the unknown-speaker clusterer.
     */
    NO_CONFIDENT_MATCH("no_confident_match"),

    /**
     * The unknown-speaker clusterer opened a new pseudo-speaker.
     */
    UNKNOWN_NEW_CLUSTER("unknown_new_cluster"),

    /**
     * The unknown-speaker clusterer matched an existing pseudo-speaker.
     */
    UNKNOWN_CLUSTER_MATCH("unknown_cluster_match"),

    /**
     * Carried over from the previous utterance without fresh evidence.
     */
    INHERITED("inherited"),

    /**
     * Reserved for an upstream confidence-boosting collaborator. Never produced here.
     */
    BOOSTED_MATCH("boosted_match");

    private final String code;

    AssignmentReason(String code) {
        this.code = code;
    }

    /**
     * Returns the stable lowercase code used by downstream consumers and stored transcripts.
     */
    public String getCode() {
        return code;
    }

    /**
     * Looks up a reason by its code.
     *
     * @throws IllegalArgumentException if the code is not recognised
     */
    public static AssignmentReason fromCode(String code) {
        for (AssignmentReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown assignment reason: " + code);
    }

    /**
     * Returns true if an assignment with this reason folded its embedding into a centroid
     * (or founded one), and so has a contribution that a correction must undo.
     */
    public boolean contributesToCentroid() {
        return this == CONFIDENT_MATCH || this == NEW_SPEAKER || this == NO_CONFIDENT_MATCH;
    }
}

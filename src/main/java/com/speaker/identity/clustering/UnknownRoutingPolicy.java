package com.speaker.identity.clustering;

/**
 * When the clustering engine hands low-confidence utterances to the unknown-speaker
 * clusterer instead of discovering or forcing a primary speaker.
 */
public enum UnknownRoutingPolicy {
    /**
     * Route only while at least one enrolled voice is live. Without enrolled voices
     * every speaker is discovered, so the engine creates speakers up to the cap and then
     * forces assignments.
     */
    WHEN_ENROLLED,

    /**
     * Always route below-minimum and at-cap utterances to the unknown bucket.
     */
    ALWAYS,

    /**
     * Never route; discover up to the cap, then force.
     */
    NEVER
}

package com.speaker.identity.core.model;

/**
 * Storage shape of one unknown cluster. Retired clusters are stored too so the id
 * sequence survives a restore.
 */
public record UnknownClusterSnapshot(
        int id,
        float[] centroid,
        int count,
        ClosestEnrolledAggregate closestEnrolledAggregate,
        boolean retired
) {
}

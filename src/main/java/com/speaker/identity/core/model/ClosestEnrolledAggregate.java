package com.speaker.identity.core.model;

/**
 * Consensus over a cluster's closest-enrolled history: the enrolled name seen most
 * often, its average similarity, how often it won and how many entries were tallied.
 * A hint only; it never promotes an unknown voice to a match.
 */
public record ClosestEnrolledAggregate(
        String name,
        double similarity,
        int occurrences,
        int totalSegments
) {
}

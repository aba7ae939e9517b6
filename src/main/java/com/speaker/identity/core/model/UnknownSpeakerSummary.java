package com.speaker.identity.core.model;

/**
 * Reportable view of an unknown pseudo-speaker.
 *
 * @param speakerName     display label such as "Unknown 1"
 * @param unknownId       cluster id
 * @param segmentCount    utterances assigned to the cluster
 * @param closestEnrolled consensus closest enrolled voice, or null
 * @param confidence      heuristic {@code min(0.9, 0.5 + 0.05 * segmentCount)}; not a probability
 */
public record UnknownSpeakerSummary(
        String speakerName,
        int unknownId,
        int segmentCount,
        ClosestEnrolledAggregate closestEnrolled,
        double confidence
) {
}

package com.speaker.identity.core.model;

/**
 * Outcome of routing one utterance through the unknown-speaker clusterer.
 *
 * @param unknownId        pseudo-speaker id (always at or below the unknown base id)
 * @param closestEnrolled  nearest enrolled voice for this utterance, or null
 * @param reason           {@link AssignmentReason#UNKNOWN_NEW_CLUSTER},
 *                         {@link AssignmentReason#UNKNOWN_CLUSTER_MATCH} or
 *                         {@link AssignmentReason#NO_EMBEDDING}
 * @param similarity       similarity to the chosen cluster (1.0 for a new cluster)
 * @param margin           gap to the runner-up cluster, informational only
 * @param forcedAssignment true if the cluster cap forced a below-threshold match
 * @param clusterCount     number of clusters after this call
 */
public record UnknownClusterResult(
        int unknownId,
        ClosestEnrolled closestEnrolled,
        AssignmentReason reason,
        double similarity,
        double margin,
        boolean forcedAssignment,
        int clusterCount
) {

    public boolean isNewCluster() {
        return reason == AssignmentReason.UNKNOWN_NEW_CLUSTER;
    }
}

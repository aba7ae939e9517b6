package com.speaker.identity.metrics;

import com.speaker.identity.core.model.AssignmentReason;

import java.time.Duration;

/**
 * Interface for recording speaker identity metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordAssignment(AssignmentReason reason, Duration duration);

    void incrementSpeakerCreated();

    void incrementUnknownClusterCreated();

    void recordSimilarityScore(double score);

    void recordReplay(int replayedSegments, int reassignedSegments);

    void recordCentroidUndo(boolean applied);

    void recordEnrollmentImport(int enrolledCount);
}

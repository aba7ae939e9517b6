package com.speaker.identity.metrics;

import com.speaker.identity.core.model.AssignmentReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAssignment(AssignmentReason reason, Duration duration) {
    }

    @Override
    public void incrementSpeakerCreated() {
    }

    @Override
    public void incrementUnknownClusterCreated() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordReplay(int replayedSegments, int reassignedSegments) {
    }

    @Override
    public void recordCentroidUndo(boolean applied) {
    }

    @Override
    public void recordEnrollmentImport(int enrolledCount) {
    }
}

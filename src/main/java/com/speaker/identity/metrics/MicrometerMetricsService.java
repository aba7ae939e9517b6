package com.speaker.identity.metrics;

import com.speaker.identity.core.model.AssignmentReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code speaker.assignment}: Timer (tag: reason)</li>
 *   <li>{@code speaker.created}: Counter</li>
 *   <li>{@code speaker.unknown.cluster.created}: Counter</li>
 *   <li>{@code speaker.similarity.score}: DistributionSummary</li>
 *   <li>{@code speaker.replay.segments}: DistributionSummary</li>
 *   <li>{@code speaker.replay.reassigned}: DistributionSummary</li>
 *   <li>{@code speaker.centroid.undo}: Counter (tag: outcome)</li>
 *   <li>{@code speaker.enrollment.imported}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<AssignmentReason, Timer> assignmentTimers = new EnumMap<>(AssignmentReason.class);
    private final Counter speakerCreatedCounter;
    private final Counter unknownClusterCreatedCounter;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary replaySegmentsSummary;
    private final DistributionSummary replayReassignedSummary;
    private final Counter undoAppliedCounter;
    private final Counter undoRejectedCounter;
    private final DistributionSummary enrollmentImportSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (AssignmentReason reason : AssignmentReason.values()) {
            assignmentTimers.put(reason, Timer.builder("speaker.assignment")
                    .description("Duration of speaker assignment decisions")
                    .tag("reason", reason.getCode())
                    .register(registry));
        }
        this.speakerCreatedCounter = Counter.builder("speaker.created")
                .description("Number of discovered speakers created")
                .register(registry);
        this.unknownClusterCreatedCounter = Counter.builder("speaker.unknown.cluster.created")
                .description("Number of unknown pseudo-speakers created")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("speaker.similarity.score")
                .description("Distribution of best-candidate similarity scores")
                .register(registry);
        this.replaySegmentsSummary = DistributionSummary.builder("speaker.replay.segments")
                .description("Segments re-decided per correction replay")
                .register(registry);
        this.replayReassignedSummary = DistributionSummary.builder("speaker.replay.reassigned")
                .description("Segments whose speaker changed per correction replay")
                .register(registry);
        this.undoAppliedCounter = Counter.builder("speaker.centroid.undo")
                .description("Centroid contribution removals")
                .tag("outcome", "applied")
                .register(registry);
        this.undoRejectedCounter = Counter.builder("speaker.centroid.undo")
                .description("Centroid contribution removals")
                .tag("outcome", "rejected")
                .register(registry);
        this.enrollmentImportSummary = DistributionSummary.builder("speaker.enrollment.imported")
                .description("Enrolled speakers per import")
                .register(registry);
    }

    @Override
    public void recordAssignment(AssignmentReason reason, Duration duration) {
        assignmentTimers.get(reason).record(duration);
    }

    @Override
    public void incrementSpeakerCreated() {
        speakerCreatedCounter.increment();
    }

    @Override
    public void incrementUnknownClusterCreated() {
        unknownClusterCreatedCounter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordReplay(int replayedSegments, int reassignedSegments) {
        replaySegmentsSummary.record(replayedSegments);
        replayReassignedSummary.record(reassignedSegments);
    }

    @Override
    public void recordCentroidUndo(boolean applied) {
        if (applied) {
            undoAppliedCounter.increment();
        } else {
            undoRejectedCounter.increment();
        }
    }

    @Override
    public void recordEnrollmentImport(int enrolledCount) {
        enrollmentImportSummary.record(enrolledCount);
    }
}

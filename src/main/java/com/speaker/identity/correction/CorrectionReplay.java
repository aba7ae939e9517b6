package com.speaker.identity.correction;

import com.speaker.identity.clustering.SpeakerClusteringEngine;
import com.speaker.identity.core.model.AssignmentDecision;
import com.speaker.identity.core.model.AssignmentReason;
import com.speaker.identity.core.model.Segment;
import com.speaker.identity.core.model.SegmentReassignment;
import com.speaker.identity.logging.LogContext;
import com.speaker.identity.metrics.MetricsService;
import com.speaker.identity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies user corrections to a session and recomputes downstream assignments.
 *
 * <p>A replay from index {@code k} first undoes, newest first, every centroid
 * contribution the recorded segments {@code k..n-1} made, then feeds the same segments
 * through {@link SpeakerClusteringEngine#assignSpeaker(float[])} again in order. A speaker
 * founded inside the replayed range is suspended rather than undone: it returns under its
 * old id when the same utterance founds a speaker again, and is otherwise left as a
 * retired hole.</p>
 *
 * <p>Replays are deterministic: two engines in the same state replaying the same
 * segments produce identical reassignments.</p>
 */
public class CorrectionReplay {
    private static final Logger log = LoggerFactory.getLogger(CorrectionReplay.class);

    private final SpeakerClusteringEngine engine;
    private final String channelId;
    private final MetricsService metricsService;

    public CorrectionReplay(SpeakerClusteringEngine engine) {
        this(engine, "default", new NoOpMetricsService());
    }

    public CorrectionReplay(SpeakerClusteringEngine engine, String channelId, MetricsService metricsService) {
        this.engine = engine;
        this.channelId = channelId;
        this.metricsService = metricsService;
    }

    /**
     * Removes one embedding's contribution from a centroid.
     *
     * @see SpeakerClusteringEngine#removeFromCentroid(int, float[])
     */
    public boolean removeFromCentroid(int speakerId, float[] embedding) {
        return engine.removeFromCentroid(speakerId, embedding);
    }

    /**
     * Folds one embedding into a centroid.
     *
     * @see SpeakerClusteringEngine#addToCentroid(int, float[])
     */
    public boolean addToCentroid(int speakerId, float[] embedding) {
        return engine.addToCentroid(speakerId, embedding);
    }

    /**
     * Re-runs assignment for every segment from {@code fromIndex} on.
     *
     * @param orderedSegments the session in arrival order, with recorded assignments
     * @param fromIndex       first segment to recompute
     * @return segments whose speaker id changed; empty if {@code fromIndex} is out of range
     */
    public List<SegmentReassignment> reclusterFromIndex(List<Segment> orderedSegments, int fromIndex) {
        return replayFromIndex(orderedSegments, fromIndex).reassignments();
    }

    /**
     * Same as {@link #reclusterFromIndex(List, int)} but also returns the session with the
     * fresh assignments, so the caller can record the new reasons as well as the new ids.
     */
    public ReplayOutcome replayFromIndex(List<Segment> orderedSegments, int fromIndex) {
        List<Segment> segments = orderedSegments != null ? orderedSegments : List.of();
        if (fromIndex < 0 || fromIndex >= segments.size()) {
            log.debug("replay.skipped fromIndex={} segments={}", fromIndex, segments.size());
            return ReplayOutcome.unchanged(segments);
        }

        try (LogContext ctx = LogContext.forReplay(channelId, fromIndex)) {
            undoContributions(segments, fromIndex);
            ReplayOutcome outcome = replay(segments, fromIndex, new ArrayList<>());
            metricsService.recordReplay(segments.size() - fromIndex, outcome.reassignments().size());
            log.info("replay.completed fromIndex={} replayed={} reassigned={}",
                    fromIndex, segments.size() - fromIndex, outcome.reassignments().size());
            return outcome;
        } finally {
            engine.releaseSuspended();
        }
    }

    /**
     * Moves one segment to another speaker and replays everything after it.
     * The relabelled segment's embedding leaves its recorded speaker's centroid and joins
     * {@code newSpeakerId}'s, unless that speaker is a frozen enrolled voice.
     *
     * @return the relabelled segment first (when its id changed), then downstream changes
     */
    public List<SegmentReassignment> relabelSegment(List<Segment> orderedSegments, int index, int newSpeakerId) {
        return relabel(orderedSegments, index, newSpeakerId).reassignments();
    }

    /**
     * Same as {@link #relabelSegment(List, int, int)} but also returns the updated session.
     */
    public ReplayOutcome relabel(List<Segment> orderedSegments, int index, int newSpeakerId) {
        List<Segment> segments = orderedSegments != null ? orderedSegments : List.of();
        if (index < 0 || index >= segments.size() || !segments.get(index).isAssignable()) {
            log.debug("relabel.skipped index={} segments={}", index, segments.size());
            return ReplayOutcome.unchanged(segments);
        }

        try (LogContext ctx = LogContext.forReplay(channelId, index).with("targetSpeakerId",
                Integer.toString(newSpeakerId))) {
            // Later contributions sit on top of this one, so they come off first.
            undoContributions(segments, index + 1);

            Segment target = segments.get(index);
            if (target.reason() != null && target.reason().contributesToCentroid()
                    && !engine.removeFromCentroid(target.speakerId(), target.embedding())
                    && !engine.suspendFounder(target.speakerId(), target.embedding())) {
                log.debug("relabel.undo_skipped index={} speakerId={}", index, target.speakerId());
            }
            boolean folded = engine.addToCentroid(newSpeakerId, target.embedding());

            // CONFIDENT_MATCH only if a centroid absorbed the sample; replays undo by reason.
            AssignmentReason reason = folded ? AssignmentReason.CONFIDENT_MATCH : AssignmentReason.INHERITED;
            List<SegmentReassignment> reassignments = new ArrayList<>();
            if (target.speakerId() != newSpeakerId) {
                reassignments.add(new SegmentReassignment(index, target.speakerId(), newSpeakerId,
                        engine.getSpeakerLabel(newSpeakerId), reason));
            }

            List<Segment> updated = new ArrayList<>(segments);
            updated.set(index, target.withAssignment(newSpeakerId, reason));
            ReplayOutcome outcome = replay(updated, index + 1, reassignments);
            metricsService.recordReplay(segments.size() - index, outcome.reassignments().size());
            log.info("relabel.completed index={} oldSpeakerId={} newSpeakerId={} reassigned={}",
                    index, target.speakerId(), newSpeakerId, outcome.reassignments().size());
            return outcome;
        } finally {
            engine.releaseSuspended();
        }
    }

    private void undoContributions(List<Segment> segments, int fromIndex) {
        int undone = 0;
        for (int i = segments.size() - 1; i >= fromIndex; i--) {
            Segment segment = segments.get(i);
            if (!segment.isAssignable() || segment.reason() == null || !segment.reason().contributesToCentroid()) {
                continue;
            }
            if (engine.removeFromCentroid(segment.speakerId(), segment.embedding())) {
                undone++;
            } else if (engine.suspendFounder(segment.speakerId(), segment.embedding())) {
                log.debug("replay.founder_suspended index={} speakerId={}", i, segment.speakerId());
            } else {
                log.debug("replay.undo_skipped index={} speakerId={} reason={}",
                        i, segment.speakerId(), segment.reason().getCode());
            }
        }
        log.debug("replay.undone fromIndex={} contributions={}", fromIndex, undone);
    }

    private ReplayOutcome replay(List<Segment> segments, int fromIndex, List<SegmentReassignment> reassignments) {
        List<Segment> updated = new ArrayList<>(segments);
        for (int i = fromIndex; i < updated.size(); i++) {
            Segment segment = updated.get(i);
            if (!segment.isAssignable()) {
                continue;
            }
            AssignmentDecision decision = engine.assignSpeaker(segment.embedding());
            updated.set(i, segment.withAssignment(decision));
            if (decision.getSpeakerId() != segment.speakerId()) {
                reassignments.add(new SegmentReassignment(i, segment.speakerId(), decision.getSpeakerId(),
                        engine.getSpeakerLabel(decision.getSpeakerId()), decision.getReason()));
            }
        }
        return new ReplayOutcome(updated, reassignments);
    }
}

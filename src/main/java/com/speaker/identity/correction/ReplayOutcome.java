package com.speaker.identity.correction;

import com.speaker.identity.core.model.Segment;
import com.speaker.identity.core.model.SegmentReassignment;

import java.util.List;

/**
 * Result of a correction replay.
 *
 * @param segments      the full session with fresh assignments from the replay point on
 * @param reassignments segments whose speaker id changed, in session order
 */
public record ReplayOutcome(List<Segment> segments, List<SegmentReassignment> reassignments) {

    public ReplayOutcome {
        segments = List.copyOf(segments);
        reassignments = List.copyOf(reassignments);
    }

    public static ReplayOutcome unchanged(List<Segment> segments) {
        return new ReplayOutcome(segments, List.of());
    }

    public boolean hasChanges() {
        return !reassignments.isEmpty();
    }
}

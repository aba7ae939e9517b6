package com.speaker.identity.core.model;

/**
 * One entry in a correction diff: a segment whose speaker changed on replay.
 *
 * @param index      position of the segment in the ordered session
 * @param oldSpeaker previously recorded speaker id
 * @param newSpeaker freshly computed speaker id
 * @param newLabel   display label of the new speaker
 * @param reason     reason of the fresh decision
 */
public record SegmentReassignment(
        int index,
        int oldSpeaker,
        int newSpeaker,
        String newLabel,
        AssignmentReason reason
) {
}

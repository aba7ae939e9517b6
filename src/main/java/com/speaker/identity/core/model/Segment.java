package com.speaker.identity.core.model;

/**
 * One utterance in a session's ordered history, as the transcript keeps it.
 *
 * @param embedding     speaker embedding, or null if the phrase was too short to embed
 * @param environmental true for non-speech markers that never receive a speaker
 * @param speakerId     speaker recorded for the utterance
 * @param reason        reason recorded with that speaker, or null if never assigned
 */
public record Segment(float[] embedding, boolean environmental, int speakerId, AssignmentReason reason) {

    /**
     * A speech utterance that has not been assigned yet.
     */
    public static Segment of(float[] embedding) {
        return new Segment(embedding, false, SpeakerIds.UNASSIGNED_SPEAKER_ID, null);
    }

    /**
     * A non-speech marker.
     */
    public static Segment nonSpeech() {
        return new Segment(null, true, SpeakerIds.UNASSIGNED_SPEAKER_ID, null);
    }

    public Segment withAssignment(AssignmentDecision decision) {
        return new Segment(embedding, environmental, decision.getSpeakerId(), decision.getReason());
    }

    public Segment withAssignment(int speakerId, AssignmentReason reason) {
        return new Segment(embedding, environmental, speakerId, reason);
    }

    /**
     * Returns true if this segment takes part in speaker assignment.
     */
    public boolean isAssignable() {
        return !environmental && embedding != null && embedding.length > 0;
    }
}

package com.speaker.identity.core.model;

/**
 * Similarity of one utterance to one live speaker candidate.
 */
public record SpeakerSimilarity(
        int speakerId,
        String speakerName,
        double similarity,
        boolean enrolled
) {
}

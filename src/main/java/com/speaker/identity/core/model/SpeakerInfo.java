package com.speaker.identity.core.model;

/**
 * Read-only snapshot of a live primary speaker, for visualisation and diagnostics.
 *
 * @param id          arena id
 * @param key         enrollment id for enrolled speakers, {@code discovered-<id>} otherwise
 * @param name        display label
 * @param centroid    copy of the unit-length centroid
 * @param enrolled    true for enrolled voices
 * @param colorIndex  UI colour slot
 * @param sampleCount samples folded into the centroid
 */
public record SpeakerInfo(
        int id,
        String key,
        String name,
        float[] centroid,
        boolean enrolled,
        int colorIndex,
        int sampleCount
) {
}

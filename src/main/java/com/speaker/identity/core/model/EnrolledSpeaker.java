package com.speaker.identity.core.model;

/**
 * Storage shape of one enrolled voice, as exchanged with the enrollment registry and
 * between per-channel engines.
 *
 * @param id         enrollment id
 * @param name       display name
 * @param centroid   reference centroid; entries without one are skipped on import
 * @param colorIndex UI colour slot, or null to default to the entry's position
 */
public record EnrolledSpeaker(String id, String name, float[] centroid, Integer colorIndex) {
}

package com.speaker.identity.core.model;

/**
 * Two enrolled voices whose reference centroids are similar enough to be confused.
 */
public record EnrollmentWarning(String speaker1, String speaker2, double similarity) {
}

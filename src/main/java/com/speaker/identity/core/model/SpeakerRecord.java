package com.speaker.identity.core.model;

import com.speaker.identity.similarity.EmbeddingSimilarity;
import com.speaker.identity.similarity.EmbeddingVectors;

import java.util.Objects;

/**
 * One primary speaker identity, either enrolled from a registry or discovered during
 * the session.
 *
 * <p>Ids are arena slots: assigned once, never reused. A record whose enrollment was
 * replaced is {@linkplain #isRetired() retired} rather than removed, so decisions that
 * reference its id stay meaningful.</p>
 */
public final class SpeakerRecord {
    private static final double SAME_SAMPLE_TOLERANCE = 1e-6;

    private final int id;
    private final RunningCentroid centroid;
    private final boolean enrolled;
    private final String enrollmentId;
    private final String name;
    private final int colorIndex;
    private final float[] foundingSample;
    private boolean retired;

    private SpeakerRecord(int id, RunningCentroid centroid, boolean enrolled,
                          String enrollmentId, String name, int colorIndex, float[] foundingSample) {
        if (id < 0) {
            throw new IllegalArgumentException("Speaker id must be non-negative");
        }
        this.id = id;
        this.centroid = Objects.requireNonNull(centroid, "centroid is required");
        this.enrolled = enrolled;
        this.enrollmentId = enrollmentId;
        this.name = name;
        this.colorIndex = colorIndex;
        this.foundingSample = foundingSample;
    }

    /**
     * Creates a discovered speaker founded by one unit-length sample.
     */
    public static SpeakerRecord discovered(int id, float[] normalizedSample, int historyDepth) {
        return new SpeakerRecord(id, new RunningCentroid(normalizedSample, 1, historyDepth),
                false, null, null, id, normalizedSample.clone());
    }

    /**
     * Creates an enrolled speaker anchored at a unit-length reference centroid.
     */
    public static SpeakerRecord enrolled(int id, String enrollmentId, String name,
                                         float[] normalizedCentroid, int colorIndex, int historyDepth) {
        Objects.requireNonNull(enrollmentId, "enrollmentId is required");
        return new SpeakerRecord(id, new RunningCentroid(normalizedCentroid, 1, historyDepth),
                true, enrollmentId, name, colorIndex, null);
    }

    public int getId() {
        return id;
    }

    /**
     * Returns a copy of the unit-length centroid.
     */
    public float[] getCentroid() {
        return centroid.copy();
    }

    public int getSampleCount() {
        return centroid.count();
    }

    public int getDimension() {
        return centroid.dimension();
    }

    public boolean isEnrolled() {
        return enrolled;
    }

    public String getEnrollmentId() {
        return enrollmentId;
    }

    /**
     * Display name for enrolled speakers; null for discovered ones.
     */
    public String getName() {
        return name;
    }

    public int getColorIndex() {
        return colorIndex;
    }

    /**
     * Retired records keep their id but no longer take part in matching.
     */
    public boolean isRetired() {
        return retired;
    }

    public void retire() {
        this.retired = true;
    }

    /**
     * Returns true if this discovered speaker was founded by this unit-length sample.
     */
    public boolean isFoundedBy(float[] normalizedSample) {
        return foundingSample != null
                && EmbeddingVectors.sameSample(foundingSample, normalizedSample, SAME_SAMPLE_TOLERANCE);
    }

    public double similarityTo(float[] embedding, EmbeddingSimilarity similarity) {
        return centroid.similarityTo(embedding, similarity);
    }

    /**
     * Folds a unit-length sample into the centroid.
     */
    public void addSample(float[] normalizedSample) {
        centroid.add(normalizedSample);
    }

    /**
     * Removes a unit-length sample from the centroid.
     *
     * @return false if only the founding sample remains
     */
    public boolean removeSample(float[] normalizedSample) {
        return centroid.remove(normalizedSample);
    }

    @Override
    public String toString() {
        return "SpeakerRecord{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", enrolled=" + enrolled +
                ", sampleCount=" + centroid.count() +
                ", retired=" + retired +
                '}';
    }
}

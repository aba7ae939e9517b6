package com.speaker.identity.core.model;

import com.speaker.identity.similarity.EmbeddingSimilarity;
import com.speaker.identity.similarity.EmbeddingVectors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A pseudo-speaker inside the unknown bucket.
 *
 * <p>Besides its centroid, the cluster remembers which enrolled voice each of its
 * utterances was closest to, and keeps a consensus of that history in
 * {@link #getClosestEnrolledAggregate()}.</p>
 */
public final class UnknownClusterRecord {
    private static final double SAME_SAMPLE_TOLERANCE = 1e-6;

    private final int id;
    private final RunningCentroid centroid;
    private final List<ClosestEnrolled> closestEnrolledHistory = new ArrayList<>();
    private final float[] foundingSample;
    private ClosestEnrolledAggregate closestEnrolledAggregate;
    private boolean retired;

    public UnknownClusterRecord(int id, float[] normalizedSample, ClosestEnrolled closestEnrolled, int historyDepth) {
        if (!SpeakerIds.isUnknownId(id)) {
            throw new IllegalArgumentException("Not an unknown cluster id: " + id);
        }
        this.id = id;
        this.centroid = new RunningCentroid(normalizedSample, 1, historyDepth);
        this.foundingSample = normalizedSample.clone();
        if (closestEnrolled != null) {
            closestEnrolledHistory.add(closestEnrolled);
            recomputeAggregate();
        }
    }

    private UnknownClusterRecord(int id, RunningCentroid centroid, float[] foundingSample,
                                 ClosestEnrolledAggregate aggregate, boolean retired) {
        this.id = id;
        this.centroid = centroid;
        this.foundingSample = foundingSample;
        this.closestEnrolledAggregate = aggregate;
        this.retired = retired;
    }

    /**
     * Rebuilds a cluster from a snapshot. The per-utterance history is not part of a
     * snapshot, so only the stored aggregate survives until the next update. A
     * single-sample centroid doubles as the founding sample.
     */
    public static UnknownClusterRecord restored(int id, float[] normalizedCentroid, int count,
                                                ClosestEnrolledAggregate aggregate, boolean retired,
                                                int historyDepth) {
        if (!SpeakerIds.isUnknownId(id)) {
            throw new IllegalArgumentException("Not an unknown cluster id: " + id);
        }
        int samples = Math.max(1, count);
        return new UnknownClusterRecord(id, new RunningCentroid(normalizedCentroid, samples, historyDepth),
                samples == 1 ? normalizedCentroid.clone() : null, aggregate, retired);
    }

    public int getId() {
        return id;
    }

    /**
     * Retired clusters keep their id but no longer take part in matching or reporting.
     */
    public boolean isRetired() {
        return retired;
    }

    public void retire() {
        this.retired = true;
    }

    /**
     * Returns true if this cluster was founded by this unit-length sample.
     */
    public boolean isFoundedBy(float[] normalizedSample) {
        return foundingSample != null
                && EmbeddingVectors.sameSample(foundingSample, normalizedSample, SAME_SAMPLE_TOLERANCE);
    }

    public float[] getCentroid() {
        return centroid.copy();
    }

    public int getCount() {
        return centroid.count();
    }

    public int getDimension() {
        return centroid.dimension();
    }

    public List<ClosestEnrolled> getClosestEnrolledHistory() {
        return Collections.unmodifiableList(closestEnrolledHistory);
    }

    /**
     * Consensus closest enrolled voice, or null if no history has been recorded.
     */
    public ClosestEnrolledAggregate getClosestEnrolledAggregate() {
        return closestEnrolledAggregate;
    }

    public double similarityTo(float[] embedding, EmbeddingSimilarity similarity) {
        return centroid.similarityTo(embedding, similarity);
    }

    /**
     * Folds a sample into the cluster and records its closest enrolled voice, if any.
     */
    public void addSample(float[] normalizedSample, ClosestEnrolled closestEnrolled) {
        centroid.add(normalizedSample);
        if (closestEnrolled != null) {
            closestEnrolledHistory.add(closestEnrolled);
            recomputeAggregate();
        }
    }

    /**
     * Removes a sample's centroid contribution. The closest-enrolled history is left
     * as recorded.
     */
    public boolean removeSample(float[] normalizedSample) {
        return centroid.remove(normalizedSample);
    }

    /**
     * Tallies count and total similarity per enrolled name; the winner has the most
     * occurrences, ties broken by the higher average similarity. Names are visited in
     * first-seen order so the result is deterministic.
     */
    private void recomputeAggregate() {
        if (closestEnrolledHistory.isEmpty()) {
            closestEnrolledAggregate = null;
            return;
        }

        Map<String, double[]> tallies = new LinkedHashMap<>();
        for (ClosestEnrolled entry : closestEnrolledHistory) {
            double[] tally = tallies.computeIfAbsent(entry.name(), k -> new double[2]);
            tally[0]++;
            tally[1] += entry.similarity();
        }

        String bestName = null;
        int bestCount = 0;
        double bestAverage = 0.0;
        for (Map.Entry<String, double[]> e : tallies.entrySet()) {
            int count = (int) e.getValue()[0];
            double average = e.getValue()[1] / count;
            if (count > bestCount || (count == bestCount && average > bestAverage)) {
                bestName = e.getKey();
                bestCount = count;
                bestAverage = average;
            }
        }

        closestEnrolledAggregate = new ClosestEnrolledAggregate(
                bestName, bestAverage, bestCount, closestEnrolledHistory.size());
    }

    @Override
    public String toString() {
        return "UnknownClusterRecord{" +
                "id=" + id +
 ", count=" + centroid.count() +
                ", retired=" + retired +
                ", closestEnrolled=" + closestEnrolledAggregate +
                '}';
    }
}

package com.speaker.identity.core.model;

import com.speaker.identity.similarity.EmbeddingSimilarity;
import com.speaker.identity.similarity.EmbeddingVectors;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Unit-length running-average centroid with a bounded undo history.
 *
 * <p>Each fold-in pushes the exact prior state onto a ring buffer of at most
 * {@code historyDepth} entries. Removing the most recent contribution restores that
 * state bit-exactly; removing any other sample falls back to inverse arithmetic and
 * clears the buffer.</p>
 *
 * <p>Not thread-safe. Callers serialise access per engine instance.</p>
 */
public final class RunningCentroid {

    private record Snapshot(float[] centroid, int count, float[] sample) {
    }

    private final float[] centroid;
    private final int historyDepth;
    private final Deque<Snapshot> history = new ArrayDeque<>();
    private int count;

    /**
     * Starts a centroid from a founding sample.
     *
     * @param normalizedSample unit-length founding sample (copied)
     * @param count            number of samples the centroid represents
     * @param historyDepth     maximum number of exact undo snapshots kept; 0 disables them
     */
    public RunningCentroid(float[] normalizedSample, int count, int historyDepth) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        if (historyDepth < 0) {
            throw new IllegalArgumentException("historyDepth must be >= 0");
        }
        this.centroid = normalizedSample.clone();
        this.count = count;
        this.historyDepth = historyDepth;
    }

    public int dimension() {
        return centroid.length;
    }

    public int count() {
        return count;
    }

    /**
     * Returns a copy of the centroid.
     */
    public float[] copy() {
        return centroid.clone();
    }

    /**
     * Scores an embedding against this centroid without copying it.
     */
    public double similarityTo(float[] embedding, EmbeddingSimilarity similarity) {
        return similarity.compute(embedding, centroid);
    }

    /**
     * Folds a unit-length sample into the centroid.
     */
    public void add(float[] normalizedSample) {
        if (historyDepth > 0) {
            if (history.size() == historyDepth) {
                history.removeFirst();
            }
            history.addLast(new Snapshot(centroid.clone(), count, normalizedSample.clone()));
        }
        EmbeddingVectors.foldIn(centroid, count, normalizedSample);
        count++;
    }

    /**
     * Removes a unit-length sample previously folded in.
     *
     * @return false (no change) if only the founding sample remains or the inverse degenerates
     */
    public boolean remove(float[] normalizedSample) {
        if (count <= 1) {
            return false;
        }
        Snapshot last = history.peekLast();
        if (last != null && last.count() == count - 1 && Arrays.equals(last.sample(), normalizedSample)) {
            history.removeLast();
            System.arraycopy(last.centroid(), 0, centroid, 0, centroid.length);
            count = last.count();
            return true;
        }
        if (!EmbeddingVectors.foldOut(centroid, count, normalizedSample)) {
            return false;
        }
        count--;
        history.clear();
        return true;
    }

    /**
     * Number of exact undo snapshots currently held.
     */
    public int historySize() {
        return history.size();
    }
}

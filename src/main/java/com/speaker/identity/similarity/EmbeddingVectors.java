package com.speaker.identity.similarity;

/**
 * Vector helpers for unit-normalised speaker centroids.
 *
 * <p>Centroids are maintained as a running average of L2-normalised embeddings and are
 * re-normalised after every change, so similarity scores stay comparable across
 * speakers with different sample counts.</p>
 */
public final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    /**
     * Returns the L2 norm of a vector.
     */
    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Normalises a vector in place. A zero vector is left untouched.
     *
     * @return true if the vector had a non-zero norm
     */
    public static boolean normalizeInPlace(float[] vector) {
        double norm = norm(vector);
        if (norm == 0.0 || Double.isNaN(norm)) {
            return false;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return true;
    }

    /**
     * Returns a normalised copy, or null if the input is null, empty or has zero norm.
     */
    public static float[] normalizedCopy(float[] vector) {
        if (vector == null || vector.length == 0) {
            return null;
        }
        float[] copy = vector.clone();
        return normalizeInPlace(copy) ? copy : null;
    }

    /**
     * Returns true if both unit vectors have the same length and every component differs by
     * at most {@code tolerance}. Re-normalising a unit vector can move its last bits, so
     * founding samples are compared this way rather than bit for bit.
     */
    public static boolean sameSample(float[] a, float[] b, double tolerance) {
        if (a == null || b == null || a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (Math.abs((double) a[i] - b[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * Folds a normalised sample into a centroid that already holds {@code count} samples:
     * {@code c' = normalize((c * n + e) / (n + 1))}.
     */
    public static void foldIn(float[] centroid, int count, float[] normalizedSample) {
        for (int i = 0; i < centroid.length; i++) {
            centroid[i] = (float) (((double) centroid[i] * count + normalizedSample[i]) / (count + 1));
        }
        normalizeInPlace(centroid);
    }

    /**
     * Inverse of {@link #foldIn}: removes a normalised sample from a centroid holding
     * {@code count} samples, {@code c' = normalize((c * n - e) / (n - 1))}.
     *
     * <p>Because the centroid is re-normalised after each fold-in, this is only an
     * approximation of the state before the sample was added.</p>
     *
     * @return false (centroid untouched) if {@code count <= 1} or the result would be a zero vector
     */
    public static boolean foldOut(float[] centroid, int count, float[] normalizedSample) {
        if (count <= 1) {
            return false;
        }
        float[] result = new float[centroid.length];
        for (int i = 0; i < centroid.length; i++) {
            result[i] = (float) (((double) centroid[i] * count - normalizedSample[i]) / (count - 1));
        }
        if (!normalizeInPlace(result)) {
            return false;
        }
        System.arraycopy(result, 0, centroid, 0, centroid.length);
        return true;
    }
}

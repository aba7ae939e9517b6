package com.speaker.identity.similarity;

import com.speaker.identity.Embeddings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityTest {

    private final CosineSimilarity cosine = new CosineSimilarity();

    @Test
    @DisplayName("Identical vectors should score 1.0")
    void testIdentical() {
        float[] a = Embeddings.combine(0.3, -0.2, 0.9);
        assertEquals(1.0, cosine.compute(a, a), 1e-9);
    }

    @Test
    @DisplayName("Orthogonal vectors should score 0.0")
    void testOrthogonal() {
        assertEquals(0.0, cosine.compute(Embeddings.axis(0), Embeddings.axis(1)), 1e-9);
    }

    @Test
    @DisplayName("Opposite vectors should score -1.0")
    void testOpposite() {
        float[] a = Embeddings.combine(1.0, 2.0);
        float[] b = Embeddings.combine(-1.0, -2.0);
        assertEquals(-1.0, cosine.compute(a, b), 1e-9);
    }

    @Test
    @DisplayName("Should not depend on vector length")
    void testScaleInvariant() {
        float[] a = Embeddings.combine(0.6, 0.8);
        float[] scaled = Embeddings.combine(6.0, 8.0);
        assertEquals(0.6, cosine.compute(a, Embeddings.axis(0)), 1e-6);
        assertEquals(0.6, cosine.compute(scaled, Embeddings.axis(0)), 1e-6);
    }

    @Test
    @DisplayName("Degenerate inputs should score 0.0")
    void testDegenerateInputs() {
        float[] a = Embeddings.axis(0);
        assertEquals(0.0, cosine.compute(null, a));
        assertEquals(0.0, cosine.compute(a, null));
        assertEquals(0.0, cosine.compute(new float[0], new float[0]));
        assertEquals(0.0, cosine.compute(a, new float[]{1.0f, 0.0f}));
        assertEquals(0.0, cosine.compute(a, new float[Embeddings.DIMENSION]));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L})
    @DisplayName("Random vectors should score within [-1, 1] and be symmetric")
    void testBoundedAndSymmetric(long seed) {
        Random random = new Random(seed);
        for (int n = 0; n < 50; n++) {
            float[] a = new float[Embeddings.DIMENSION];
            float[] b = new float[Embeddings.DIMENSION];
            for (int i = 0; i < a.length; i++) {
                a[i] = (float) random.nextGaussian();
                b[i] = (float) random.nextGaussian();
            }
            double ab = cosine.compute(a, b);
            assertTrue(ab >= -1.0 && ab <= 1.0);
            assertEquals(ab, cosine.compute(b, a), 1e-12);
            assertEquals(1.0, cosine.compute(a, a), 1e-6);
        }
    }

    @Test
    @DisplayName("Should expose its name")
    void testName() {
        assertEquals("Cosine", cosine.getName());
    }
}

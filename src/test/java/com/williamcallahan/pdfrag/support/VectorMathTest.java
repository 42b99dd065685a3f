package com.williamcallahan.pdfrag.support;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Verifies cosine similarity, normalization and the streaming mean used for the centroid.
 */
class VectorMathTest {

    @Test
    void cosineOfZeroVectorIsZero() {
        assertEquals(0.0, VectorMath.cosine(new float[] {0f, 0f}, new float[] {1f, 0f}));
    }

    @Test
    void cosineRejectsMismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> VectorMath.cosine(new float[] {1f}, new float[] {1f, 0f}));
    }

    @Test
    void normalizeRejectsWrongDimensionAndNonFiniteValues() {
        assertNull(VectorMath.normalizeOrNull(new float[] {1f, 2f}, 3));
        assertNull(VectorMath.normalizeOrNull(new float[] {Float.NaN, 1f}, 2));
        assertNull(VectorMath.normalizeOrNull(new float[] {0f, 0f}, 2));
        assertArrayEquals(new float[] {0.6f, 0.8f}, VectorMath.normalizeOrNull(new float[] {3f, 4f}, 2), 1e-6f);
    }

    @Test
    void meanAccumulatorNormalizesInputsAndSkipsUnusableOnes() {
        VectorMath.MeanAccumulator accumulator = new VectorMath.MeanAccumulator(2);

        accumulator.add(new float[] {10f, 0f});
        accumulator.add(new float[] {0f, 1f});
        accumulator.add(new float[] {0f, 0f});

        assertEquals(2, accumulator.count());
        float expected = (float) Math.sqrt(0.5);
        assertArrayEquals(new float[] {expected, expected}, accumulator.normalizedMean(), 1e-6f);
    }
}

package com.williamcallahan.pdfrag.support;

import java.util.Objects;

/**
 * Dense vector helpers shared by deduplication, reranking, MMR and centroid gating.
 */
public final class VectorMath {
    private static final double EPSILON = 1e-12;

    private VectorMath() {}

    /**
     * Cosine similarity of two vectors of equal length; 0 when either has zero norm.
     */
    public static double cosine(float[] left, float[] right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Vector length mismatch: " + left.length + " vs " + right.length);
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftNorm += (double) left[i] * left[i];
            rightNorm += (double) right[i] * right[i];
        }
        if (leftNorm < EPSILON || rightNorm < EPSILON) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    /**
     * Returns a unit-length copy, or null when the vector is missing, has the wrong dimension,
     * contains non-finite values or has zero norm.
     *
     * @param vector candidate vector
     * @param expectedDimensions required length
     * @return normalized copy or null
     */
    public static float[] normalizeOrNull(float[] vector, int expectedDimensions) {
        if (vector == null || vector.length != expectedDimensions) {
            return null;
        }
        double norm = 0.0;
        for (float component : vector) {
            if (!Float.isFinite(component)) {
                return null;
            }
            norm += (double) component * component;
        }
        if (norm < EPSILON) {
            return null;
        }
        double length = Math.sqrt(norm);
        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / length);
        }
        return normalized;
    }

    /** True when every component is exactly zero. */
    public static boolean isZero(float[] vector) {
        if (vector == null) {
            return true;
        }
        for (float component : vector) {
            if (component != 0.0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Streaming mean of normalized vectors; the final mean is renormalized.
     */
    public static final class MeanAccumulator {
        private final int dimensions;
        private final double[] sum;
        private long count;

        public MeanAccumulator(int dimensions) {
            if (dimensions <= 0) {
                throw new IllegalArgumentException("dimensions must be positive");
            }
            this.dimensions = dimensions;
            this.sum = new double[dimensions];
        }

        /**
         * Adds a vector after normalizing it; unusable vectors are ignored.
         *
         * @return true when the vector contributed
         */
        public boolean add(float[] vector) {
            float[] normalized = normalizeOrNull(vector, dimensions);
            if (normalized == null) {
                return false;
            }
            for (int i = 0; i < dimensions; i++) {
                sum[i] += normalized[i];
            }
            count++;
            return true;
        }

        public long count() {
            return count;
        }

        /** Normalized mean, or null when nothing usable was added. */
        public float[] normalizedMean() {
            if (count == 0) {
                return null;
            }
            float[] mean = new float[dimensions];
            for (int i = 0; i < dimensions; i++) {
                mean[i] = (float) (sum[i] / count);
            }
            return normalizeOrNull(mean, dimensions);
        }
    }
}

package com.shopsense.engine.model;

public final class VectorMath {

    private VectorMath() {}

    /**
     * Cosine similarity of two vectors of equal length.
     * Returns 0 when either vector has zero norm.
     *
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Clamps to [0, 1]; NaN becomes 0. */
    public static double clamp(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return 0;
        }
        return Math.min(value, 1.0);
    }
}

package com.phonepe.memsight.core.utils;

import lombok.experimental.UtilityClass;

/**
 * Vector math helpers
 */
@UtilityClass
public class VectorUtils {
    /**
     * Cosine similarity between two vectors, in [-1, 1]. Missing, empty, mismatched or zero vectors give 0.
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs == null || rhs == null || lhs.length == 0 || lhs.length != rhs.length) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += lhs[i] * rhs[i];
            normLhs += lhs[i] * lhs[i];
            normRhs += rhs[i] * rhs[i];
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs));
    }

    /**
     * True for missing, empty and all-zero vectors, which have no direction to compare
     */
    public static boolean isZero(float[] vector) {
        if (vector == null) {
            return true;
        }
        for (final var value : vector) {
            if (value != 0.0f) {
                return false;
            }
        }
        return true;
    }
}

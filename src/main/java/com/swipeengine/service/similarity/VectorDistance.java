package com.swipeengine.service.similarity;

/**
 * Distance kernel over fixed-length embedding vectors.
 *
 * All functions are pure. Vectors of different length are a programming
 * error and rejected with {@link IllegalArgumentException}.
 */
public final class VectorDistance {

    private VectorDistance() {
    }

    /**
     * Distance between two vectors using the given function.
     *
     * @param a first vector
     * @param b second vector, same length as {@code a}
     * @param function distance function
     * @return non-negative distance, 0 for identical vectors
     */
    public static double distance(float[] a, float[] b, DistanceFunction function) {
        return switch (function) {
            case EUCLIDEAN -> euclidean(a, b);
            case COSINE -> cosine(a, b);
            case MANHATTAN -> manhattan(a, b);
        };
    }

    public static double euclidean(float[] a, float[] b) {
        requireSameLength(a, b);

        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine distance = 1 - dot product / (norm1 * norm2).
     */
    public static double cosine(float[] a, float[] b) {
        requireSameLength(a, b);

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            norm1 += (double) a[i] * a[i];
            norm2 += (double) b[i] * b[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 1.0;
        }

        double cosineSimilarity = dotProduct / Math.sqrt(norm1 * norm2);

        // Rounding can push identical directions slightly past 1
        cosineSimilarity = Math.max(-1.0, Math.min(1.0, cosineSimilarity));
        return 1.0 - cosineSimilarity;
    }

    public static double manhattan(float[] a, float[] b) {
        requireSameLength(a, b);

        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs((double) a[i] - b[i]);
        }
        return sum;
    }

    private static void requireSameLength(float[] a, float[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Vectors must not be null");
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}

package ru.tigran.stylistengine.scoring;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Numeric primitives shared by fusion and outfit matching.
 *
 * Every method is total: degenerate input (null, empty, zero-norm vectors, NaN)
 * produces a value inside the documented range instead of an exception or NaN.
 */
public final class ScoringUtils {

    private static final double EPSILON = 1e-10;

    private ScoringUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Clamps a value to [0, 1]. NaN maps to 0.
     */
    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Raw cosine similarity in [-1, 1].
     * Returns 0 for vectors of different length, empty vectors or zero-norm vectors.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        normA = Math.sqrt(normA);
        normB = Math.sqrt(normB);
        if (normA < EPSILON || normB < EPSILON) {
            return 0.0;
        }
        return clamp(dot / (normA * normB), -1.0, 1.0);
    }

    /**
     * Cosine similarity mapped to [0, 1]: (cos + 1) / 2.
     */
    public static double normalizedCosine(float[] a, float[] b) {
        return clamp01((cosineSimilarity(a, b) + 1.0) / 2.0);
    }

    /**
     * Plain Jaccard index |A ∩ B| / |A ∪ B|. Two empty sets give 0.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || (a.isEmpty() && b.isEmpty())) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        long intersection = a.stream().filter(b::contains).count();
        return clamp01((double) intersection / union.size());
    }

    /**
     * Weighted Jaccard over confidence maps: Σ min(a, b) / Σ max(a, b).
     */
    public static double weightedJaccard(Map<String, Double> a, Map<String, Double> b) {
        if (a == null || b == null || (a.isEmpty() && b.isEmpty())) {
            return 0.0;
        }
        Set<String> keys = new HashSet<>(a.keySet());
        keys.addAll(b.keySet());
        double minSum = 0;
        double maxSum = 0;
        for (String key : keys) {
            double x = clamp01(a.getOrDefault(key, 0.0));
            double y = clamp01(b.getOrDefault(key, 0.0));
            minSum += Math.min(x, y);
            maxSum += Math.max(x, y);
        }
        if (maxSum < EPSILON) {
            return 0.0;
        }
        return clamp01(minSum / maxSum);
    }

    /**
     * Linear combination Σ(w_i · v_i). Lengths must match.
     */
    public static double weightedSum(List<Double> values, List<Double> weights) {
        if (values.size() != weights.size()) {
            throw new IllegalArgumentException(
                    "values and weights differ in size: " + values.size() + " vs " + weights.size());
        }
        double sum = 0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.get(i) * weights.get(i);
        }
        return Double.isNaN(sum) ? 0.0 : sum;
    }

    /**
     * Weighted mean Σ(w_i · v_i) / Σ(w_i), clamped to [0, 1].
     * Returns 0 when the total weight is not positive.
     */
    public static double weightedMean(List<Double> values, List<Double> weights) {
        double totalWeight = 0;
        for (Double weight : weights) {
            totalWeight += weight;
        }
        if (totalWeight < EPSILON) {
            return 0.0;
        }
        return clamp01(weightedSum(values, weights) / totalWeight);
    }

    /**
     * Confidence of a conclusion drawn from two independent signals:
     * the product of both, clamped.
     */
    public static double propagateConfidence(double upstream, double local) {
        return clamp01(clamp01(upstream) * clamp01(local));
    }
}

package com.leaksentinel.core.clustering;

import com.leaksentinel.core.config.DistanceMetricType;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.ml.distance.ManhattanDistance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pairwise distances between feature vectors.
 *
 * <p>
 * Euclidean, Manhattan and Pearson correlation come from Commons Math.
 * Cosine and correlation distances are {@code 1 - similarity}. When the
 * similarity is undefined (a zero vector, or a constant or single-element
 * vector for correlation) the distance is {@code 0} for identical vectors and
 * {@code 1} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistanceMetrics {

    private static final EuclideanDistance EUCLIDEAN = new EuclideanDistance();
    private static final ManhattanDistance MANHATTAN = new ManhattanDistance();

    private DistanceMetrics() {
        // utility class, not instantiable
    }

    public static double distance(DistanceMetricType metric, double[] a, double[] b) {
        Objects.requireNonNull(metric, "metric must not be null");
        return switch (metric) {
            case EUCLIDEAN -> euclidean(a, b);
            case MANHATTAN -> manhattan(a, b);
            case COSINE -> cosine(a, b);
            case CORRELATION -> correlation(a, b);
        };
    }

    static double euclidean(double[] a, double[] b) {
        return EUCLIDEAN.compute(a, b);
    }

    static double manhattan(double[] a, double[] b) {
        return MANHATTAN.compute(a, b);
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return undefined(a, b);
        }
        return clampDistance(1 - dot / Math.sqrt(na * nb));
    }

    static double correlation(double[] a, double[] b) {
        if (a.length < 2) {
            return undefined(a, b);
        }
        double r = new PearsonsCorrelation().correlation(a, b);
        if (Double.isNaN(r)) {
            return undefined(a, b);
        }
        return clampDistance(1 - r);
    }

    private static double undefined(double[] a, double[] b) {
        return Arrays.equals(a, b) ? 0.0 : 1.0;
    }

    // Rounding can push 1 - similarity slightly outside [0, 2].
    private static double clampDistance(double d) {
        return Math.max(0.0, Math.min(2.0, d));
    }
}

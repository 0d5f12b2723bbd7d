package com.leaksentinel.core.feature;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Clips values to the Tukey fences {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}.
 *
 * @since 1.0.0
 */
public final class OutlierClipper {

    static final double FENCE_FACTOR = 1.5;

    private OutlierClipper() {
        // utility class, not instantiable
    }

    /**
     * @param values input values; not modified
     * @return a clipped copy
     */
    public static double[] clip(double[] values) {
        if (values.length < 4) {
            return values.clone();
        }
        Percentile q = FeatureCalculator.quantiles(values);
        double q1 = q.evaluate(25);
        double q3 = q.evaluate(75);
        double iqr = q3 - q1;
        double low = q1 - FENCE_FACTOR * iqr;
        double high = q3 + FENCE_FACTOR * iqr;

        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.max(low, Math.min(high, values[i]));
        }
        return out;
    }
}

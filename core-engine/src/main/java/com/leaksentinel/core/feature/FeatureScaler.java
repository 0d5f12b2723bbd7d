package com.leaksentinel.core.feature;

import com.leaksentinel.core.model.FeatureVector;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Z-score scaling fitted on reference windows.
 *
 * <p>
 * Means and population standard deviations come from the reference vectors
 * only. A dimension that does not vary in the reference keeps scale 1 so it
 * is centred but not blown up.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;
    private final boolean degenerate;

    private FeatureScaler(double[] mean, double[] scale, boolean degenerate) {
        this.mean = mean;
        this.scale = scale;
        this.degenerate = degenerate;
    }

    /**
     * @param reference vectors to fit on; must not be empty
     * @return fitted scaler
     */
    public static FeatureScaler fit(List<FeatureVector> reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        if (reference.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero vectors");
        }
        int d = reference.get(0).dimension();
        int n = reference.size();
        Mean meanOf = new Mean();
        StandardDeviation stdOf = new StandardDeviation(false);
        double[] mean = new double[d];
        double[] scale = new double[d];
        double[] column = new double[n];
        boolean degenerate = true;
        for (int k = 0; k < d; k++) {
            for (int i = 0; i < n; i++) {
                column[i] = reference.get(i).get(k);
            }
            mean[k] = meanOf.evaluate(column);
            double std = stdOf.evaluate(column, mean[k]);
            if (std > 0) {
                scale[k] = std;
                degenerate = false;
            } else {
                scale[k] = 1.0;
            }
        }
        return new FeatureScaler(mean, scale, degenerate);
    }

    /**
     * @return a scaler that leaves vectors unchanged
     */
    public static FeatureScaler identity(int dimension) {
        double[] ones = new double[dimension];
        Arrays.fill(ones, 1.0);
        return new FeatureScaler(new double[dimension], ones, false);
    }

    public FeatureVector transform(FeatureVector v) {
        double[] out = new double[mean.length];
        for (int k = 0; k < mean.length; k++) {
            out[k] = (v.get(k) - mean[k]) / scale[k];
        }
        return new FeatureVector(out);
    }

    /**
     * @return {@code true} if no dimension varied across the reference
     */
    public boolean isDegenerate() {
        return degenerate;
    }
}

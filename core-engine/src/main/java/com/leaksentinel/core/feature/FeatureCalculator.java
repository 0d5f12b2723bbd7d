package com.leaksentinel.core.feature;

import com.leaksentinel.core.model.FeatureVector;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Computes the 17 window features listed in {@link FeatureVector#NAMES}.
 *
 * <p>
 * Standard deviations and variances are population statistics. Quantiles use
 * linear interpolation between order statistics. Slopes are least-squares
 * slopes per grid step. Undefined values (slope of a single point, correlation
 * of a constant signal) are reported as {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureCalculator {

    private FeatureCalculator() {
        // utility class, not instantiable
    }

    /**
     * @param pressure  pressure values of the window
     * @param frequency frequency values of the window, same length
     * @return the feature vector
     * @throws IllegalArgumentException if the arrays are empty or differ in
     *                                  length
     */
    public static FeatureVector compute(double[] pressure, double[] frequency) {
        if (pressure.length == 0 || pressure.length != frequency.length) {
            throw new IllegalArgumentException("pressure and frequency must have the same non-zero length");
        }
        DescriptiveStatistics p = new DescriptiveStatistics(pressure);
        DescriptiveStatistics f = new DescriptiveStatistics(frequency);
        Percentile pq = quantiles(pressure);
        Percentile fq = quantiles(frequency);

        double pVar = p.getPopulationVariance();
        double fVar = f.getPopulationVariance();

        return new FeatureVector(new double[] {
                p.getMean(),
                Math.sqrt(pVar),
                p.getMin(),
                p.getMax(),
                pq.evaluate(50),
                pq.evaluate(25),
                pq.evaluate(75),
                f.getMean(),
                Math.sqrt(fVar),
                f.getMin(),
                f.getMax(),
                fq.evaluate(50),
                slope(pressure),
                slope(frequency),
                pVar,
                fVar,
                correlation(pressure, frequency)
        });
    }

    /**
     * Least-squares slope of {@code values} against their index.
     */
    public static double slope(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        return Double.isFinite(slope) ? slope : 0.0;
    }

    /**
     * Pearson correlation, with undefined results mapped to {@code 0} and the
     * value clamped to {@code [-1, 1]}.
     */
    public static double correlation(double[] a, double[] b) {
        if (a.length < 2 || a.length != b.length) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(a, b);
        if (!Double.isFinite(r)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }

    static Percentile quantiles(double[] values) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return percentile;
    }
}

package com.leaksentinel.core.correlation;

/**
 * Measurements the correlator took for one candidate and its conclusion.
 *
 * @since 1.0.0
 */
public final class CorrelationFinding {

    private final double frequencyVariance;
    private final double correlation;
    private final boolean operational;

    public CorrelationFinding(double frequencyVariance, double correlation, boolean operational) {
        this.frequencyVariance = frequencyVariance;
        this.correlation = correlation;
        this.operational = operational;
    }

    /**
     * @return population variance of pump frequency within the window
     */
    public double getFrequencyVariance() {
        return frequencyVariance;
    }

    /**
     * @return pressure/frequency Pearson correlation over the horizon, in
     *         {@code [-1, 1]}
     */
    public double getCorrelation() {
        return correlation;
    }

    /**
     * @return {@code true} if the candidate should become a false anomaly
     */
    public boolean isOperational() {
        return operational;
    }

    @Override
    public String toString() {
        return "CorrelationFinding{" +
                "frequencyVariance=" + frequencyVariance +
                ", correlation=" + correlation +
                ", operational=" + operational +
                '}';
    }
}

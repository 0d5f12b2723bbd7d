package com.leaksentinel.core.correlation;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.feature.FeatureCalculator;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Window;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Third stage: checks surviving anomalies against pump frequency.
 *
 * <p>
 * A pressure excursion that moves in lockstep with a steady pump is the
 * signature of an operational change rather than a leak. For each candidate
 * the correlator measures
 * </p>
 * <ol>
 * <li>the population variance of frequency within the window, and</li>
 * <li>the Pearson correlation of pressure and frequency over the window
 * extended by {@code correlation_horizon_windows} windows on each side.</li>
 * </ol>
 * <p>
 * The candidate is operational when the variance is below
 * {@code variance_threshold} and {@code |correlation|} exceeds
 * {@code correlation_threshold}. With time alignment the measurements use the
 * resampled grid; without it they use the raw readings in the same time span
 * for which both signals are present.
 * </p>
 *
 * @since 1.0.0
 */
public class MultiSourceCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(MultiSourceCorrelator.class);

    private final double varianceThreshold;
    private final double correlationThreshold;
    private final boolean timeAlignment;
    private final int horizon;

    /**
     * @param config a validated configuration
     */
    public MultiSourceCorrelator(AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.varianceThreshold = config.getVarianceThreshold();
        this.correlationThreshold = config.getCorrelationThreshold();
        this.timeAlignment = config.isTimeAlignment();
        this.horizon = config.getCorrelationHorizonWindows();
    }

    /**
     * @param window          the candidate window
     * @param pipelineWindows all windows of the same pipeline, indexed by
     *                        window index
     * @param rawSeries       raw readings of the pipeline
     * @return the measurements and the verdict
     */
    public CorrelationFinding evaluate(Window window, List<Window> pipelineWindows, SensorSeries rawSeries) {
        Objects.requireNonNull(window, "window must not be null");
        int from = Math.max(0, window.getIndex() - horizon);
        int to = Math.min(pipelineWindows.size() - 1, window.getIndex() + horizon);

        double variance;
        double correlation;
        if (timeAlignment) {
            variance = populationVariance(window.getRealFrequency());
            correlation = alignedCorrelation(pipelineWindows, from, to);
        } else {
            Objects.requireNonNull(rawSeries, "rawSeries is required without time alignment");
            double[][] inWindow = rawPairs(rawSeries, window.getStart(), window.getEnd());
            variance = inWindow[1].length > 0
                    ? populationVariance(inWindow[1])
                    : populationVariance(window.getRealFrequency());
            double[][] inHorizon = rawPairs(rawSeries, pipelineWindows.get(from).getStart(),
                    pipelineWindows.get(to).getEnd());
            correlation = FeatureCalculator.correlation(inHorizon[0], inHorizon[1]);
        }

        boolean operational = variance < varianceThreshold && Math.abs(correlation) > correlationThreshold;
        if (operational) {
            LOG.debug("Pipeline '{}' window {}: frequency variance {} and correlation {} -> operational",
                    window.getPipelineId(), window.getIndex(), variance, correlation);
        }
        return new CorrelationFinding(variance, correlation, operational);
    }

    private static double alignedCorrelation(List<Window> windows, int from, int to) {
        int length = 0;
        for (int i = from; i <= to; i++) {
            length += windows.get(i).getRealCount();
        }
        double[] pressure = new double[length];
        double[] frequency = new double[length];
        int offset = 0;
        for (int i = from; i <= to; i++) {
            Window w = windows.get(i);
            System.arraycopy(w.getRealPressure(), 0, pressure, offset, w.getRealCount());
            System.arraycopy(w.getRealFrequency(), 0, frequency, offset, w.getRealCount());
            offset += w.getRealCount();
        }
        return FeatureCalculator.correlation(pressure, frequency);
    }

    /** Raw readings in {@code [from, to)} where both signals are present. */
    private static double[][] rawPairs(SensorSeries series, Instant from, Instant to) {
        List<Sample> samples = series.getSamples();
        int count = 0;
        for (Sample s : samples) {
            if (inRange(s, from, to) && s.hasPressure() && s.hasFrequency()) {
                count++;
            }
        }
        double[] pressure = new double[count];
        double[] frequency = new double[count];
        int k = 0;
        for (Sample s : samples) {
            if (inRange(s, from, to) && s.hasPressure() && s.hasFrequency()) {
                pressure[k] = s.getPressure();
                frequency[k] = s.getFrequency();
                k++;
            }
        }
        return new double[][] { pressure, frequency };
    }

    private static boolean inRange(Sample s, Instant from, Instant to) {
        return !s.getTimestamp().isBefore(from) && s.getTimestamp().isBefore(to);
    }

    private static double populationVariance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Variance(false).evaluate(values);
    }
}

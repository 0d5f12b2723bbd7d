package com.leaksentinel.core.feature;

import com.leaksentinel.core.config.InterpolationMethod;
import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorSeries;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunctionLagrangeForm;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Places irregular readings on a regular time grid.
 *
 * <p>
 * The grid starts at the first reading and spans the series with the
 * configured step. Each signal is interpolated independently from its own
 * finite readings, so a missing pressure value does not discard the
 * frequency value of the same sample. Readings sharing a timestamp collapse
 * to the last one. Grid points before the first or after the last reading of
 * a signal take the nearest edge value.
 * </p>
 *
 * <h3>Gaps</h3>
 * <p>
 * A silence longer than {@code maxGapSeconds} between two readings of a
 * signal, or between the series bounds and the first/last reading of that
 * signal, raises {@link DataGapException}. Shorter gaps are interpolated.
 * </p>
 *
 * @since 1.0.0
 */
public final class Resampler {

    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    private static final int LOCAL_POLYNOMIAL_POINTS = 4;

    private final double stepSeconds;
    private final InterpolationMethod method;
    private final double maxGapSeconds;

    /**
     * @param stepSeconds   grid spacing in seconds; must be positive
     * @param method        interpolation scheme; must not be {@code null}
     * @param maxGapSeconds largest tolerated silence of one signal in seconds
     */
    public Resampler(double stepSeconds, InterpolationMethod method, double maxGapSeconds) {
        if (!(stepSeconds > 0)) {
            throw new IllegalArgumentException("stepSeconds must be > 0, got: " + stepSeconds);
        }
        this.stepSeconds = stepSeconds;
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.maxGapSeconds = maxGapSeconds;
    }

    /**
     * @param series the raw readings; must not be empty
     * @return the regular-grid version of {@code series}
     * @throws DataGapException         if a signal has an intolerable gap or
     *                                  no readings at all
     * @throws IllegalArgumentException if the series is empty
     */
    public ResampledSeries resample(SensorSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        List<Sample> samples = series.getSamples();
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot resample empty series '" + series.getPipelineId() + "'");
        }

        Instant origin = samples.get(0).getTimestamp();
        Instant last = samples.get(samples.size() - 1).getTimestamp();
        double span = seconds(origin, last);
        int size = (int) Math.floor(span / stepSeconds + 1e-9) + 1;

        double[] grid = new double[size];
        for (int i = 0; i < size; i++) {
            grid[i] = i * stepSeconds;
        }

        double[] pressure = interpolate(series, origin, span, grid, true);
        double[] frequency = interpolate(series, origin, span, grid, false);
        AnomalyType[] labels = series.isFullyLabelled() ? nearestLabels(samples, origin, grid) : null;

        LOG.debug("Resampled pipeline '{}': {} readings -> {} grid points ({})",
                series.getPipelineId(), samples.size(), size, method.configName());
        return new ResampledSeries(series.getPipelineId(), origin,
                Duration.ofNanos(Math.round(stepSeconds * 1e9)), pressure, frequency, labels);
    }

    // ---------------------------------------------------------------
    // Per-signal interpolation
    // ---------------------------------------------------------------

    private double[] interpolate(SensorSeries series, Instant origin, double span, double[] grid,
            boolean pressureSignal) {
        String signal = pressureSignal ? "pressure" : "frequency";
        List<Sample> samples = series.getSamples();

        double[] xs = new double[samples.size()];
        double[] ys = new double[samples.size()];
        int k = 0;
        for (Sample s : samples) {
            double v = pressureSignal ? s.getPressure() : s.getFrequency();
            if (!Double.isFinite(v)) {
                continue;
            }
            double t = seconds(origin, s.getTimestamp());
            if (k > 0 && t == xs[k - 1]) {
                ys[k - 1] = v;
            } else {
                xs[k] = t;
                ys[k] = v;
                k++;
            }
        }
        if (k == 0) {
            throw new DataGapException(series.getPipelineId(), signal, origin,
                    origin.plusNanos(Math.round(span * 1e9)), maxGapSeconds);
        }
        xs = Arrays.copyOf(xs, k);
        ys = Arrays.copyOf(ys, k);
        checkGaps(series.getPipelineId(), signal, origin, span, xs);

        double[] out = new double[grid.length];
        if (k == 1) {
            Arrays.fill(out, ys[0]);
            return out;
        }

        InterpolationMethod effective = method;
        if (effective == InterpolationMethod.CUBIC && k < 3) {
            effective = InterpolationMethod.LINEAR;
        }
        if (effective == InterpolationMethod.POLYNOMIAL && k < LOCAL_POLYNOMIAL_POINTS) {
            effective = InterpolationMethod.LINEAR;
        }

        switch (effective) {
            case LINEAR -> fillFromSpline(new LinearInterpolator().interpolate(xs, ys), xs, grid, out);
            case CUBIC -> fillFromSpline(new SplineInterpolator().interpolate(xs, ys), xs, grid, out);
            case NEAREST -> {
                for (int i = 0; i < grid.length; i++) {
                    out[i] = ys[nearestIndex(xs, grid[i])];
                }
            }
            case POLYNOMIAL -> {
                for (int i = 0; i < grid.length; i++) {
                    out[i] = localPolynomial(xs, ys, clamp(grid[i], xs));
                }
            }
            default -> throw new IllegalStateException("Unhandled interpolation method: " + effective);
        }
        return out;
    }

    private void checkGaps(String pipelineId, String signal, Instant origin, double span, double[] xs) {
        if (xs[0] > maxGapSeconds) {
            throw gap(pipelineId, signal, origin, 0, xs[0]);
        }
        for (int i = 1; i < xs.length; i++) {
            if (xs[i] - xs[i - 1] > maxGapSeconds) {
                throw gap(pipelineId, signal, origin, xs[i - 1], xs[i]);
            }
        }
        if (span - xs[xs.length - 1] > maxGapSeconds) {
            throw gap(pipelineId, signal, origin, xs[xs.length - 1], span);
        }
    }

    private DataGapException gap(String pipelineId, String signal, Instant origin, double from, double to) {
        return new DataGapException(pipelineId, signal,
                origin.plusNanos(Math.round(from * 1e9)),
                origin.plusNanos(Math.round(to * 1e9)),
                maxGapSeconds);
    }

    private static void fillFromSpline(PolynomialSplineFunction f, double[] xs, double[] grid, double[] out) {
        for (int i = 0; i < grid.length; i++) {
            out[i] = f.value(clamp(grid[i], xs));
        }
    }

    /** Cubic through the four readings closest to {@code x}. */
    private static double localPolynomial(double[] xs, double[] ys, double x) {
        int pos = Arrays.binarySearch(xs, x);
        if (pos >= 0) {
            return ys[pos];
        }
        int insertion = -pos - 1;
        int from = Math.max(0, Math.min(insertion - LOCAL_POLYNOMIAL_POINTS / 2,
                xs.length - LOCAL_POLYNOMIAL_POINTS));
        double[] px = Arrays.copyOfRange(xs, from, from + LOCAL_POLYNOMIAL_POINTS);
        double[] py = Arrays.copyOfRange(ys, from, from + LOCAL_POLYNOMIAL_POINTS);
        return PolynomialFunctionLagrangeForm.evaluate(px, py, x);
    }

    private static AnomalyType[] nearestLabels(List<Sample> samples, Instant origin, double[] grid) {
        double[] xs = new double[samples.size()];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = seconds(origin, samples.get(i).getTimestamp());
        }
        AnomalyType[] labels = new AnomalyType[grid.length];
        for (int i = 0; i < grid.length; i++) {
            labels[i] = samples.get(nearestIndex(xs, grid[i])).getLabel();
        }
        return labels;
    }

    /**
     * Index of the element of sorted {@code xs} closest to {@code x}; on a tie
     * the later element wins, so duplicates resolve to their last reading.
     */
    static int nearestIndex(double[] xs, double x) {
        int pos = Arrays.binarySearch(xs, x);
        if (pos >= 0) {
            while (pos + 1 < xs.length && xs[pos + 1] == x) {
                pos++;
            }
            return pos;
        }
        int insertion = -pos - 1;
        if (insertion == 0) {
            return 0;
        }
        if (insertion >= xs.length) {
            return xs.length - 1;
        }
        return (x - xs[insertion - 1]) < (xs[insertion] - x) ? insertion - 1 : insertion;
    }

    private static double clamp(double x, double[] xs) {
        return Math.max(xs[0], Math.min(xs[xs.length - 1], x));
    }

    static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1e9;
    }
}

package com.leaksentinel.core.feature;

import com.leaksentinel.core.model.AnomalyType;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A series placed on the regular grid {@code origin + k * step}.
 *
 * @since 1.0.0
 */
public final class ResampledSeries {

    private final String pipelineId;
    private final Instant origin;
    private final Duration step;
    private final double[] pressure;
    private final double[] frequency;
    private final AnomalyType[] labels;

    ResampledSeries(String pipelineId, Instant origin, Duration step,
            double[] pressure, double[] frequency, AnomalyType[] labels) {
        this.pipelineId = Objects.requireNonNull(pipelineId);
        this.origin = Objects.requireNonNull(origin);
        this.step = Objects.requireNonNull(step);
        this.pressure = pressure;
        this.frequency = frequency;
        this.labels = labels;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public Instant getOrigin() {
        return origin;
    }

    public Duration getStep() {
        return step;
    }

    public int size() {
        return pressure.length;
    }

    double[] pressure() {
        return pressure;
    }

    double[] frequency() {
        return frequency;
    }

    AnomalyType[] labels() {
        return labels;
    }

    public double pressureAt(int i) {
        return pressure[i];
    }

    public double frequencyAt(int i) {
        return frequency[i];
    }

    /**
     * @return label of grid point {@code i}, or {@code null} if unlabelled
     */
    public AnomalyType labelAt(int i) {
        return labels == null ? null : labels[i];
    }
}

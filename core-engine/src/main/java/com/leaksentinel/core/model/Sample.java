package com.leaksentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single pressure / pump-frequency reading of one pipeline.
 *
 * <p>
 * Either signal may be {@link Double#NaN} when that sensor did not report.
 * The optional {@code label} carries ground truth for evaluation runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample {

    private final Instant timestamp;
    private final double pressure;
    private final double frequency;
    private final AnomalyType label;

    /**
     * @param timestamp reading time; must not be {@code null}
     * @param pressure  pressure in MPa, or {@code NaN} when missing
     * @param frequency pump frequency in Hz, or {@code NaN} when missing
     * @param label     ground truth, or {@code null} when unknown
     */
    public Sample(Instant timestamp, double pressure, double frequency, AnomalyType label) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.pressure = pressure;
        this.frequency = frequency;
        this.label = label;
    }

    public static Sample of(Instant timestamp, double pressure, double frequency) {
        return new Sample(timestamp, pressure, frequency, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPressure() {
        return pressure;
    }

    public double getFrequency() {
        return frequency;
    }

    /**
     * @return ground-truth label, or {@code null} if the sample is unlabelled
     */
    public AnomalyType getLabel() {
        return label;
    }

    public boolean hasPressure() {
        return !Double.isNaN(pressure);
    }

    public boolean hasFrequency() {
        return !Double.isNaN(frequency);
    }

    public boolean isLabelled() {
        return label != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(pressure, that.pressure) == 0
                && Double.compare(frequency, that.frequency) == 0
                && timestamp.equals(that.timestamp)
                && label == that.label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, pressure, frequency, label);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "timestamp=" + timestamp +
                ", pressure=" + pressure +
                ", frequency=" + frequency +
                ", label=" + label +
                '}';
    }
}

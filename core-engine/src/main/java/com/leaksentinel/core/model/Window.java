package com.leaksentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length span of resampled readings of one pipeline.
 *
 * <p>
 * Windows partition a series without overlap. The last window of a series may
 * be padded by repeating its final real reading; {@link #getRealCount()}
 * tells how many leading points are genuine. Grid point {@code i} lies at
 * {@code start + i * step}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Window {

    private final String pipelineId;
    private final int index;
    private final Instant start;
    private final Duration step;
    private final double[] pressure;
    private final double[] frequency;
    private final AnomalyType[] labels;
    private final int realCount;

    /**
     * @param pipelineId pipeline the window belongs to
     * @param index      position of the window within its series (0-based)
     * @param start      time of the first grid point
     * @param step       grid spacing
     * @param pressure   resampled pressure, padded to full length
     * @param frequency  resampled frequency, same length as {@code pressure}
     * @param labels     ground truth per grid point, or {@code null}
     * @param realCount  number of leading non-padded points
     */
    public Window(String pipelineId, int index, Instant start, Duration step,
            double[] pressure, double[] frequency, AnomalyType[] labels, int realCount) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.step = Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(pressure, "pressure must not be null");
        Objects.requireNonNull(frequency, "frequency must not be null");
        if (pressure.length != frequency.length || pressure.length == 0) {
            throw new IllegalArgumentException("pressure and frequency must have the same non-zero length");
        }
        if (labels != null && labels.length != pressure.length) {
            throw new IllegalArgumentException("labels must match the window length");
        }
        if (realCount < 1 || realCount > pressure.length) {
            throw new IllegalArgumentException("realCount must be in [1, " + pressure.length
                    + "], got: " + realCount);
        }
        this.index = index;
        this.pressure = pressure.clone();
        this.frequency = frequency.clone();
        this.labels = labels != null ? labels.clone() : null;
        this.realCount = realCount;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public int getIndex() {
        return index;
    }

    public Instant getStart() {
        return start;
    }

    public Duration getStep() {
        return step;
    }

    /**
     * @return exclusive end of the real part of the window
     */
    public Instant getEnd() {
        return start.plus(step.multipliedBy(realCount));
    }

    /**
     * @return exclusive end of the nominal window, padding included
     */
    public Instant getNominalEnd() {
        return start.plus(step.multipliedBy(length()));
    }

    public Instant timeAt(int i) {
        return start.plus(step.multipliedBy(i));
    }

    public int length() {
        return pressure.length;
    }

    public int getRealCount() {
        return realCount;
    }

    public int getPaddedCount() {
        return pressure.length - realCount;
    }

    public boolean isPadded() {
        return realCount < pressure.length;
    }

    /**
     * @return copy of the full (padded) pressure series
     */
    public double[] getPressure() {
        return pressure.clone();
    }

    /**
     * @return copy of the full (padded) frequency series
     */
    public double[] getFrequency() {
        return frequency.clone();
    }

    public double[] getRealPressure() {
        return Arrays.copyOf(pressure, realCount);
    }

    public double[] getRealFrequency() {
        return Arrays.copyOf(frequency, realCount);
    }

    public boolean isLabelled() {
        return labels != null;
    }

    /**
     * @param type the label to look for
     * @return {@code true} if any real grid point carries {@code type}
     */
    public boolean containsLabel(AnomalyType type) {
        if (labels == null) {
            return false;
        }
        for (int i = 0; i < realCount; i++) {
            if (labels[i] == type) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if labelled and every real grid point is normal
     */
    public boolean isAllNormal() {
        if (labels == null) {
            return false;
        }
        for (int i = 0; i < realCount; i++) {
            if (labels[i] != AnomalyType.NORMAL) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the real part of this window intersects {@code [from, to]}.
     */
    public boolean overlaps(Instant from, Instant to) {
        return start.compareTo(to) <= 0 && getEnd().isAfter(from);
    }

    @Override
    public String toString() {
        return "Window{" +
                "pipelineId='" + pipelineId + '\'' +
                ", index=" + index +
                ", start=" + start +
                ", realCount=" + realCount +
                ", padded=" + getPaddedCount() +
                '}';
    }
}

package com.leaksentinel.core.synthetic;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable parameters of a {@link SyntheticPipelineDataGenerator} run.
 *
 * <p>
 * Instances are created through {@link #builder()}; every field has a default
 * so {@code SyntheticSettings.builder().build()} yields a 19-pipeline day of
 * data with 12 leaks and 150 operational events.
 * </p>
 *
 * @since 1.0.0
 */
public final class SyntheticSettings {

    public static final Instant DEFAULT_ORIGIN = Instant.parse("2024-01-01T00:00:00Z");

    private final int pipelines;
    private final double durationHours;
    private final int samplingRateSeconds;
    private final int leakEvents;
    private final int operationalEvents;
    private final long seed;
    private final Instant origin;

    private SyntheticSettings(Builder builder) {
        this.pipelines = builder.pipelines;
        this.durationHours = builder.durationHours;
        this.samplingRateSeconds = builder.samplingRateSeconds;
        this.leakEvents = builder.leakEvents;
        this.operationalEvents = builder.operationalEvents;
        this.seed = builder.seed;
        this.origin = builder.origin;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getPipelines() {
        return pipelines;
    }

    public double getDurationHours() {
        return durationHours;
    }

    public int getSamplingRateSeconds() {
        return samplingRateSeconds;
    }

    public int getLeakEvents() {
        return leakEvents;
    }

    public int getOperationalEvents() {
        return operationalEvents;
    }

    public long getSeed() {
        return seed;
    }

    public Instant getOrigin() {
        return origin;
    }

    /**
     * @return number of samples per pipeline
     */
    public int samplesPerPipeline() {
        return (int) Math.round(durationHours * 3600.0 / samplingRateSeconds);
    }

    @Override
    public String toString() {
        return "SyntheticSettings{pipelines=" + pipelines
                + ", durationHours=" + durationHours
                + ", samplingRateSeconds=" + samplingRateSeconds
                + ", leakEvents=" + leakEvents
                + ", operationalEvents=" + operationalEvents
                + ", seed=" + seed
                + ", origin=" + origin + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {

        private int pipelines = 19;
        private double durationHours = 24;
        private int samplingRateSeconds = 2;
        private int leakEvents = 12;
        private int operationalEvents = 150;
        private long seed = 42L;
        private Instant origin = DEFAULT_ORIGIN;

        private Builder() {
        }

        public Builder pipelines(int pipelines) {
            this.pipelines = pipelines;
            return this;
        }

        public Builder durationHours(double durationHours) {
            this.durationHours = durationHours;
            return this;
        }

        public Builder samplingRateSeconds(int samplingRateSeconds) {
            this.samplingRateSeconds = samplingRateSeconds;
            return this;
        }

        public Builder leakEvents(int leakEvents) {
            this.leakEvents = leakEvents;
            return this;
        }

        public Builder operationalEvents(int operationalEvents) {
            this.operationalEvents = operationalEvents;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder origin(Instant origin) {
            this.origin = origin;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid field
         */
        public SyntheticSettings build() {
            List<String> errors = new ArrayList<>();
            if (pipelines < 1) {
                errors.add("pipelines must be >= 1, got: " + pipelines);
            }
            if (!(durationHours >= 3)) {
                errors.add("durationHours must be >= 3, got: " + durationHours);
            }
            if (samplingRateSeconds < 1) {
                errors.add("samplingRateSeconds must be >= 1, got: " + samplingRateSeconds);
            }
            if (leakEvents < 0) {
                errors.add("leakEvents must be >= 0, got: " + leakEvents);
            }
            if (operationalEvents < 0) {
                errors.add("operationalEvents must be >= 0, got: " + operationalEvents);
            }
            if (origin == null) {
                errors.add("origin must not be null");
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid synthetic data settings:\n  - " + String.join("\n  - ", errors));
            }
            return new SyntheticSettings(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntheticSettings)) {
            return false;
        }
        SyntheticSettings that = (SyntheticSettings) o;
        return pipelines == that.pipelines
                && Double.compare(durationHours, that.durationHours) == 0
                && samplingRateSeconds == that.samplingRateSeconds
                && leakEvents == that.leakEvents
                && operationalEvents == that.operationalEvents
                && seed == that.seed
                && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelines, durationHours, samplingRateSeconds, leakEvents, operationalEvents, seed,
                origin);
    }
}

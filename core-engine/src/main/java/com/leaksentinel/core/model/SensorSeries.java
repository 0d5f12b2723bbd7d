package com.leaksentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Time-ordered readings of a single pipeline.
 *
 * <p>
 * Timestamps must be non-decreasing. Equal timestamps are permitted and are
 * collapsed by the resampler (the last reading wins).
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorSeries {

    private final String pipelineId;
    private final List<Sample> samples;

    /**
     * @param pipelineId identifier of the pipeline; must not be blank
     * @param samples    readings in time order; must not be {@code null}
     * @throws IllegalArgumentException if the id is blank or samples go back
     *                                  in time
     */
    public SensorSeries(String pipelineId, List<Sample> samples) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        if (pipelineId.isBlank()) {
            throw new IllegalArgumentException("pipelineId must not be blank");
        }
        for (int i = 1; i < samples.size(); i++) {
            if (samples.get(i).getTimestamp().isBefore(samples.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException("Samples of pipeline '" + pipelineId
                        + "' are not time-ordered at index " + i);
            }
        }
        this.pipelineId = pipelineId;
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public String getPipelineId() {
        return pipelineId;
    }

    /**
     * @return unmodifiable list of samples
     */
    public List<Sample> getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @return {@code true} if every sample carries a ground-truth label
     */
    public boolean isFullyLabelled() {
        for (Sample sample : samples) {
            if (!sample.isLabelled()) {
                return false;
            }
        }
        return !samples.isEmpty();
    }

    @Override
    public String toString() {
        return "SensorSeries{pipelineId='" + pipelineId + "', samples=" + samples.size() + '}';
    }
}

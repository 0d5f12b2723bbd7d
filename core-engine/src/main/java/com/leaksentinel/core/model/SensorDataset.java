package com.leaksentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered collection of per-pipeline series analysed as one run.
 *
 * @since 1.0.0
 */
public final class SensorDataset {

    private final List<SensorSeries> series;

    /**
     * @param series the series; pipeline ids must be unique
     * @throws IllegalArgumentException if two series share a pipeline id
     */
    public SensorDataset(List<SensorSeries> series) {
        Objects.requireNonNull(series, "series must not be null");
        Set<String> ids = new HashSet<>();
        for (SensorSeries s : series) {
            Objects.requireNonNull(s, "series entries must not be null");
            if (!ids.add(s.getPipelineId())) {
                throw new IllegalArgumentException("Duplicate pipeline id: " + s.getPipelineId());
            }
        }
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
    }

    public static SensorDataset of(SensorSeries... series) {
        return new SensorDataset(List.of(series));
    }

    public List<SensorSeries> getSeries() {
        return series;
    }

    public Optional<SensorSeries> find(String pipelineId) {
        for (SensorSeries s : series) {
            if (s.getPipelineId().equals(pipelineId)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public int sampleCount() {
        int total = 0;
        for (SensorSeries s : series) {
            total += s.size();
        }
        return total;
    }

    /**
     * Ground truth is only usable when every sample of every series is
     * labelled.
     *
     * @return {@code true} if the dataset can be scored against labels
     */
    public boolean isFullyLabelled() {
        if (series.isEmpty()) {
            return false;
        }
        for (SensorSeries s : series) {
            if (!s.isFullyLabelled()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cheap content fingerprint used to decide whether a cached model still
     * matches the data it was trained on.
     *
     * @return order-sensitive hash of all readings
     */
    public long fingerprint() {
        long hash = 1125899906842597L;
        for (SensorSeries s : series) {
            hash = 31 * hash + s.getPipelineId().hashCode();
            for (Sample sample : s.getSamples()) {
                hash = 31 * hash + sample.getTimestamp().hashCode();
                hash = 31 * hash + Double.hashCode(sample.getPressure());
                hash = 31 * hash + Double.hashCode(sample.getFrequency());
                hash = 31 * hash + (sample.getLabel() == null ? 0 : sample.getLabel().ordinal() + 1);
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        return "SensorDataset{pipelines=" + series.size() + ", samples=" + sampleCount() + '}';
    }
}

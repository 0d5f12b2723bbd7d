package com.leaksentinel.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Volume and label counts of a {@link SensorDataset}.
 *
 * <p>
 * {@code start}, {@code end} and {@code durationHours} span the earliest to
 * the latest reading over all pipelines; they are {@code null} (and the
 * duration zero) for a dataset without samples.
 * </p>
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class DatasetStatistics {

    private final int pipelines;
    private final long totalSamples;
    private final long normalSamples;
    private final long leakSamples;
    private final long operationalSamples;
    private final long unlabelledSamples;
    private final long missingReadings;
    private final Instant start;
    private final Instant end;
    private final double durationHours;

    private DatasetStatistics(int pipelines, long totalSamples, long normalSamples, long leakSamples,
            long operationalSamples, long unlabelledSamples, long missingReadings, Instant start, Instant end) {
        this.pipelines = pipelines;
        this.totalSamples = totalSamples;
        this.normalSamples = normalSamples;
        this.leakSamples = leakSamples;
        this.operationalSamples = operationalSamples;
        this.unlabelledSamples = unlabelledSamples;
        this.missingReadings = missingReadings;
        this.start = start;
        this.end = end;
        this.durationHours = start == null ? 0.0 : Duration.between(start, end).toMillis() / 3_600_000.0;
    }

    public static DatasetStatistics of(SensorDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        long total = 0;
        long normal = 0;
        long leak = 0;
        long operational = 0;
        long unlabelled = 0;
        long missing = 0;
        Instant start = null;
        Instant end = null;
        for (SensorSeries series : dataset.getSeries()) {
            for (Sample s : series.getSamples()) {
                total++;
                if (s.getLabel() == null) {
                    unlabelled++;
                } else {
                    switch (s.getLabel()) {
                        case NORMAL -> normal++;
                        case LEAK -> leak++;
                        case OPERATIONAL -> operational++;
                    }
                }
                if (!s.hasPressure() || !s.hasFrequency()) {
                    missing++;
                }
                if (start == null || s.getTimestamp().isBefore(start)) {
                    start = s.getTimestamp();
                }
                if (end == null || s.getTimestamp().isAfter(end)) {
                    end = s.getTimestamp();
                }
            }
        }
        return new DatasetStatistics(dataset.getSeries().size(), total, normal, leak, operational,
                unlabelled, missing, start, end);
    }

    public int getPipelines() {
        return pipelines;
    }

    public long getTotalSamples() {
        return totalSamples;
    }

    public long getNormalSamples() {
        return normalSamples;
    }

    public long getLeakSamples() {
        return leakSamples;
    }

    public long getOperationalSamples() {
        return operationalSamples;
    }

    public long getUnlabelledSamples() {
        return unlabelledSamples;
    }

    /**
     * @return samples missing the pressure or the frequency reading
     */
    public long getMissingReadings() {
        return missingReadings;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public double getDurationHours() {
        return durationHours;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DatasetStatistics that))
            return false;
        return pipelines == that.pipelines
                && totalSamples == that.totalSamples
                && normalSamples == that.normalSamples
                && leakSamples == that.leakSamples
                && operationalSamples == that.operationalSamples
                && unlabelledSamples == that.unlabelledSamples
                && missingReadings == that.missingReadings
                && Objects.equals(start, that.start)
                && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelines, totalSamples, normalSamples, leakSamples, operationalSamples,
                unlabelledSamples, missingReadings, start, end);
    }

    @Override
    public String toString() {
        return "DatasetStatistics{" +
                "pipelines=" + pipelines +
                ", totalSamples=" + totalSamples +
                ", normalSamples=" + normalSamples +
                ", leakSamples=" + leakSamples +
                ", operationalSamples=" + operationalSamples +
                ", unlabelledSamples=" + unlabelledSamples +
                ", missingReadings=" + missingReadings +
                ", durationHours=" + durationHours +
                '}';
    }
}

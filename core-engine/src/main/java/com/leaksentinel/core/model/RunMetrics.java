package com.leaksentinel.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate quality and volume figures of one completed run.
 *
 * <p>
 * Precision, recall and F1 are {@code null} ("N/A") whenever they are not
 * defined: no ground truth, no leak events (recall) or no surviving anomaly
 * (precision).
 * </p>
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class RunMetrics {

    private final Double precision;
    private final Double recall;
    private final Double f1Score;
    private final double falseAnomalyExclusionRate;
    private final long normalSamples;
    private final long trueAnomalySamples;
    private final long falseAnomalySamples;
    private final int totalWindows;
    private final int trainingWindows;
    private final int flaggedWindows;
    private final int clusterExcluded;
    private final int correlatorExcluded;
    private final int finalAnomalies;
    private final boolean groundTruthAvailable;
    private final int leakEvents;
    private final int detectedLeakEvents;
    private final int solverIterations;
    private final boolean solverConverged;
    private final List<String> warnings;

    private RunMetrics(Builder b) {
        this.precision = b.precision;
        this.recall = b.recall;
        this.f1Score = b.f1Score;
        this.falseAnomalyExclusionRate = b.falseAnomalyExclusionRate;
        this.normalSamples = b.normalSamples;
        this.trueAnomalySamples = b.trueAnomalySamples;
        this.falseAnomalySamples = b.falseAnomalySamples;
        this.totalWindows = b.totalWindows;
        this.trainingWindows = b.trainingWindows;
        this.flaggedWindows = b.flaggedWindows;
        this.clusterExcluded = b.clusterExcluded;
        this.correlatorExcluded = b.correlatorExcluded;
        this.finalAnomalies = b.finalAnomalies;
        this.groundTruthAvailable = b.groundTruthAvailable;
        this.leakEvents = b.leakEvents;
        this.detectedLeakEvents = b.detectedLeakEvents;
        this.solverIterations = b.solverIterations;
        this.solverConverged = b.solverConverged;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Double getPrecision() {
        return precision;
    }

    public Double getRecall() {
        return recall;
    }

    public Double getF1Score() {
        return f1Score;
    }

    /**
     * @return percentage of flagged windows reclassified as false anomalies
     */
    public double getFalseAnomalyExclusionRate() {
        return falseAnomalyExclusionRate;
    }

    public long getNormalSamples() {
        return normalSamples;
    }

    public long getTrueAnomalySamples() {
        return trueAnomalySamples;
    }

    public long getFalseAnomalySamples() {
        return falseAnomalySamples;
    }

    public int getTotalWindows() {
        return totalWindows;
    }

    public int getTrainingWindows() {
        return trainingWindows;
    }

    public int getFlaggedWindows() {
        return flaggedWindows;
    }

    public int getClusterExcluded() {
        return clusterExcluded;
    }

    public int getCorrelatorExcluded() {
        return correlatorExcluded;
    }

    public int getFinalAnomalies() {
        return finalAnomalies;
    }

    public boolean isGroundTruthAvailable() {
        return groundTruthAvailable;
    }

    public int getLeakEvents() {
        return leakEvents;
    }

    public int getDetectedLeakEvents() {
        return detectedLeakEvents;
    }

    public int getSolverIterations() {
        return solverIterations;
    }

    public boolean isSolverConverged() {
        return solverConverged;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Double precision;
        private Double recall;
        private Double f1Score;
        private double falseAnomalyExclusionRate;
        private long normalSamples;
        private long trueAnomalySamples;
        private long falseAnomalySamples;
        private int totalWindows;
        private int trainingWindows;
        private int flaggedWindows;
        private int clusterExcluded;
        private int correlatorExcluded;
        private int finalAnomalies;
        private boolean groundTruthAvailable;
        private int leakEvents;
        private int detectedLeakEvents;
        private int solverIterations;
        private boolean solverConverged = true;
        private final List<String> warnings = new ArrayList<>();

        public Builder precision(Double v) {
            this.precision = v;
            return this;
        }

        public Builder recall(Double v) {
            this.recall = v;
            return this;
        }

        public Builder f1Score(Double v) {
            this.f1Score = v;
            return this;
        }

        public Builder falseAnomalyExclusionRate(double v) {
            this.falseAnomalyExclusionRate = v;
            return this;
        }

        public Builder normalSamples(long v) {
            this.normalSamples = v;
            return this;
        }

        public Builder trueAnomalySamples(long v) {
            this.trueAnomalySamples = v;
            return this;
        }

        public Builder falseAnomalySamples(long v) {
            this.falseAnomalySamples = v;
            return this;
        }

        public Builder totalWindows(int v) {
            this.totalWindows = v;
            return this;
        }

        public Builder trainingWindows(int v) {
            this.trainingWindows = v;
            return this;
        }

        public Builder flaggedWindows(int v) {
            this.flaggedWindows = v;
            return this;
        }

        public Builder clusterExcluded(int v) {
            this.clusterExcluded = v;
            return this;
        }

        public Builder correlatorExcluded(int v) {
            this.correlatorExcluded = v;
            return this;
        }

        public Builder finalAnomalies(int v) {
            this.finalAnomalies = v;
            return this;
        }

        public Builder groundTruthAvailable(boolean v) {
            this.groundTruthAvailable = v;
            return this;
        }

        public Builder leakEvents(int v) {
            this.leakEvents = v;
            return this;
        }

        public Builder detectedLeakEvents(int v) {
            this.detectedLeakEvents = v;
            return this;
        }

        public Builder solverIterations(int v) {
            this.solverIterations = v;
            return this;
        }

        public Builder solverConverged(boolean v) {
            this.solverConverged = v;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
            return this;
        }

        public Builder warnings(List<String> warnings) {
            warnings.forEach(this::warning);
            return this;
        }

        public RunMetrics build() {
            return new RunMetrics(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RunMetrics that))
            return false;
        return Double.compare(falseAnomalyExclusionRate, that.falseAnomalyExclusionRate) == 0
                && normalSamples == that.normalSamples
                && trueAnomalySamples == that.trueAnomalySamples
                && falseAnomalySamples == that.falseAnomalySamples
                && totalWindows == that.totalWindows
                && trainingWindows == that.trainingWindows
                && flaggedWindows == that.flaggedWindows
                && clusterExcluded == that.clusterExcluded
                && correlatorExcluded == that.correlatorExcluded
                && finalAnomalies == that.finalAnomalies
                && groundTruthAvailable == that.groundTruthAvailable
                && leakEvents == that.leakEvents
                && detectedLeakEvents == that.detectedLeakEvents
                && solverIterations == that.solverIterations
                && solverConverged == that.solverConverged
                && Objects.equals(precision, that.precision)
                && Objects.equals(recall, that.recall)
                && Objects.equals(f1Score, that.f1Score)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, recall, f1Score, falseAnomalyExclusionRate,
                flaggedWindows, finalAnomalies, solverIterations);
    }

    @Override
    public String toString() {
        return "RunMetrics{" +
                "precision=" + precision +
                ", recall=" + recall +
                ", f1=" + f1Score +
                ", exclusionRate=" + falseAnomalyExclusionRate +
                ", flagged=" + flaggedWindows +
                ", final=" + finalAnomalies +
                ", leakEvents=" + detectedLeakEvents + "/" + leakEvents +
                '}';
    }
}

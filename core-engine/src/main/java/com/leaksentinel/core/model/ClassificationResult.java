package com.leaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Objects;

/**
 * Final classification of one flagged window.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code window}, {@code verdict} and
 * {@code decidedBy} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ClassificationResult {

    private final Window window;
    private final double decisionScore;
    private final Integer clusterId;
    private final ClusterLabel clusterLabel;
    private final Double frequencyVariance;
    private final Double correlation;
    private final Verdict verdict;
    private final PipelineStage decidedBy;

    private ClassificationResult(Builder b) {
        this.window = Objects.requireNonNull(b.window, "window must not be null");
        this.decisionScore = b.decisionScore;
        this.clusterId = b.clusterId;
        this.clusterLabel = b.clusterLabel;
        this.frequencyVariance = b.frequencyVariance;
        this.correlation = b.correlation;
        this.verdict = Objects.requireNonNull(b.verdict, "verdict must not be null");
        this.decidedBy = Objects.requireNonNull(b.decidedBy, "decidedBy must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonIgnore
    public Window getWindow() {
        return window;
    }

    public String getPipelineId() {
        return window.getPipelineId();
    }

    public int getWindowIndex() {
        return window.getIndex();
    }

    public Instant getWindowStart() {
        return window.getStart();
    }

    public Instant getWindowEnd() {
        return window.getEnd();
    }

    public double getDecisionScore() {
        return decisionScore;
    }

    public Integer getClusterId() {
        return clusterId;
    }

    public ClusterLabel getClusterLabel() {
        return clusterLabel;
    }

    /**
     * @return frequency variance measured by the correlator, or {@code null}
     *         if the candidate never reached that stage
     */
    public Double getFrequencyVariance() {
        return frequencyVariance;
    }

    public Double getCorrelation() {
        return correlation;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public PipelineStage getDecidedBy() {
        return decidedBy;
    }

    @JsonIgnore
    public boolean isTrueAnomaly() {
        return verdict == Verdict.TRUE_ANOMALY;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Window window;
        private double decisionScore;
        private Integer clusterId;
        private ClusterLabel clusterLabel;
        private Double frequencyVariance;
        private Double correlation;
        private Verdict verdict;
        private PipelineStage decidedBy;

        public Builder window(Window window) {
            this.window = window;
            return this;
        }

        public Builder decisionScore(double decisionScore) {
            this.decisionScore = decisionScore;
            return this;
        }

        public Builder clusterId(Integer clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder clusterLabel(ClusterLabel clusterLabel) {
            this.clusterLabel = clusterLabel;
            return this;
        }

        public Builder frequencyVariance(Double frequencyVariance) {
            this.frequencyVariance = frequencyVariance;
            return this;
        }

        public Builder correlation(Double correlation) {
            this.correlation = correlation;
            return this;
        }

        public Builder verdict(Verdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder decidedBy(PipelineStage decidedBy) {
            this.decidedBy = decidedBy;
            return this;
        }

        /**
         * @throws NullPointerException if a required field is missing
         */
        public ClassificationResult build() {
            return new ClassificationResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationResult that))
            return false;
        return Double.compare(decisionScore, that.decisionScore) == 0
                && window.getPipelineId().equals(that.window.getPipelineId())
                && window.getIndex() == that.window.getIndex()
                && Objects.equals(clusterId, that.clusterId)
                && clusterLabel == that.clusterLabel
                && Objects.equals(frequencyVariance, that.frequencyVariance)
                && Objects.equals(correlation, that.correlation)
                && verdict == that.verdict
                && decidedBy == that.decidedBy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(window.getPipelineId(), window.getIndex(), decisionScore, verdict, decidedBy);
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "pipelineId='" + window.getPipelineId() + '\'' +
                ", window=" + window.getIndex() +
                ", score=" + decisionScore +
                ", clusterId=" + clusterId +
                ", verdict=" + verdict +
                ", decidedBy=" + decidedBy +
                '}';
    }
}

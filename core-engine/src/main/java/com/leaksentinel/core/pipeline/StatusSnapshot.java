package com.leaksentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.leaksentinel.core.model.RunMetrics;

import java.util.Objects;

/**
 * Immutable view of an analysis at one point in time.
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StatusSnapshot {

    private final AnalysisStatus status;
    private final int progress;
    private final String currentStep;
    private final RunMetrics results;
    private final String error;

    public StatusSnapshot(AnalysisStatus status, int progress, String currentStep, RunMetrics results,
            String error) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.progress = progress;
        this.currentStep = currentStep;
        this.results = results;
        this.error = error;
    }

    static StatusSnapshot idle() {
        return new StatusSnapshot(AnalysisStatus.IDLE, 0, "", null, null);
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    /**
     * @return progress in percent, never decreasing within one run
     */
    public int getProgress() {
        return progress;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    /**
     * @return metrics of the completed run, or {@code null}
     */
    public RunMetrics getResults() {
        return results;
    }

    /**
     * @return failure message of an errored run, or {@code null}
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "StatusSnapshot{" +
                "status=" + status +
                ", progress=" + progress +
                ", currentStep='" + currentStep + '\'' +
                ", error='" + error + '\'' +
                '}';
    }
}

package com.leaksentinel.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.leaksentinel.core.synthetic.SyntheticSettings;

/**
 * Body of a data generation request. Absent fields keep the value of the
 * settings the request is applied to.
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyntheticDataRequest {

    private Integer pipelines;
    private Double durationHours;
    private Integer samplingRateSeconds;
    private Integer leakEvents;
    private Integer operationalEvents;
    private Long seed;

    /**
     * @param base settings supplying every absent field
     * @return the resulting settings
     * @throws IllegalArgumentException if a resulting field is invalid
     */
    public SyntheticSettings applyTo(SyntheticSettings base) {
        return SyntheticSettings.builder()
                .pipelines(pipelines != null ? pipelines : base.getPipelines())
                .durationHours(durationHours != null ? durationHours : base.getDurationHours())
                .samplingRateSeconds(samplingRateSeconds != null ? samplingRateSeconds : base.getSamplingRateSeconds())
                .leakEvents(leakEvents != null ? leakEvents : base.getLeakEvents())
                .operationalEvents(operationalEvents != null ? operationalEvents : base.getOperationalEvents())
                .seed(seed != null ? seed : base.getSeed())
                .origin(base.getOrigin())
                .build();
    }

    public Integer getPipelines() {
        return pipelines;
    }

    public void setPipelines(Integer pipelines) {
        this.pipelines = pipelines;
    }

    public Double getDurationHours() {
        return durationHours;
    }

    public void setDurationHours(Double durationHours) {
        this.durationHours = durationHours;
    }

    public Integer getSamplingRateSeconds() {
        return samplingRateSeconds;
    }

    public void setSamplingRateSeconds(Integer samplingRateSeconds) {
        this.samplingRateSeconds = samplingRateSeconds;
    }

    public Integer getLeakEvents() {
        return leakEvents;
    }

    public void setLeakEvents(Integer leakEvents) {
        this.leakEvents = leakEvents;
    }

    public Integer getOperationalEvents() {
        return operationalEvents;
    }

    public void setOperationalEvents(Integer operationalEvents) {
        this.operationalEvents = operationalEvents;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }
}

package com.leaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage that produced a candidate's current verdict.
 *
 * @since 1.0.0
 */
public enum PipelineStage {

    BOUNDARY_CLASSIFIER("boundary_classifier"),
    CLUSTER_FILTER("cluster_filter"),
    MULTI_SOURCE_CORRELATOR("multi_source_correlator");

    private final String wireName;

    PipelineStage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

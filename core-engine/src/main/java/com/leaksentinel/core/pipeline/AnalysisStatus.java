package com.leaksentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an {@link AnalysisContext}.
 *
 * <pre>
 * IDLE -&gt; RUNNING -&gt; COMPLETED | ERROR
 * </pre>
 *
 * @since 1.0.0
 */
public enum AnalysisStatus {

    IDLE("idle"),
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    AnalysisStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}

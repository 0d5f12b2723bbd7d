package com.leaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-candidate classification outcome.
 *
 * @since 1.0.0
 */
public enum Verdict {

    /** Still believed to be a leak. */
    TRUE_ANOMALY("true_anomaly"),

    /** Reclassified as an operational false alarm. */
    FALSE_ANOMALY("false_anomaly");

    private final String wireName;

    Verdict(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

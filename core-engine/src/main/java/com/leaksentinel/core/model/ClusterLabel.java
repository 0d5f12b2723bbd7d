package com.leaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Decision the cluster filter attaches to a whole cluster.
 *
 * @since 1.0.0
 */
public enum ClusterLabel {

    LEAK("leak"),
    OPERATIONAL("operational");

    private final String wireName;

    ClusterLabel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

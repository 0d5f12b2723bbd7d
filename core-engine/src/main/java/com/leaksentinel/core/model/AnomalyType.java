package com.leaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ground-truth or predicted nature of a sample.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    NORMAL("normal"),
    LEAK("leak"),
    OPERATIONAL("operational");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return lower-case name used in JSON and CSV
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a wire name, ignoring case and surrounding blanks.
     *
     * @param value the textual label
     * @return the matching type
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static AnomalyType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AnomalyType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown anomaly type: '" + value + "'. Supported types: normal, leak, operational");
    }
}

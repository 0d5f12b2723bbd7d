package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * Merge rule of the agglomerative cluster filter.
 *
 * @since 1.0.0
 */
public enum LinkageMethod {

    /** Minimum variance increase; Euclidean distances only. */
    WARD("ward"),
    COMPLETE("complete"),
    AVERAGE("average"),
    SINGLE("single");

    private final String configName;

    LinkageMethod(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * @param value configuration value, case-insensitive
     * @return the matching constant
     * @throws IllegalArgumentException if {@code value} is not supported
     */
    public static LinkageMethod parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (LinkageMethod candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: ward, complete, average, single");
    }
}

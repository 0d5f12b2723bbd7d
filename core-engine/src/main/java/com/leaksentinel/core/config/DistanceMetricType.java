package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * Pairwise distance used between candidate feature vectors.
 *
 * @since 1.0.0
 */
public enum DistanceMetricType {

    EUCLIDEAN("euclidean"),
    MANHATTAN("manhattan"),
    COSINE("cosine"),
    CORRELATION("correlation");

    private final String configName;

    DistanceMetricType(String configName) {
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
    public static DistanceMetricType parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DistanceMetricType candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: euclidean, manhattan, cosine, correlation");
    }
}

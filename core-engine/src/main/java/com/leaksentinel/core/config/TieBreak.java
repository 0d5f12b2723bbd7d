package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * Label given to a cluster whose decision falls inside the tie tolerance.
 *
 * <p>
 * {@link #LEAK} keeps borderline clusters as anomalies and never costs recall.
 * </p>
 *
 * @since 1.0.0
 */
public enum TieBreak {

    LEAK("leak"),
    OPERATIONAL("operational");

    private final String configName;

    TieBreak(String configName) {
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
    public static TieBreak parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TieBreak candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: leak, operational");
    }
}

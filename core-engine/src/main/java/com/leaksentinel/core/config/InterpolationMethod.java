package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * Resampling scheme used to place readings on the nominal grid.
 *
 * @since 1.0.0
 */
public enum InterpolationMethod {

    LINEAR("linear"),
    CUBIC("cubic"),
    NEAREST("nearest"),
    POLYNOMIAL("polynomial");

    private final String configName;

    InterpolationMethod(String configName) {
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
    public static InterpolationMethod parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (InterpolationMethod candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: linear, cubic, nearest, polynomial");
    }
}

package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * Kernel of the one-class boundary classifier.
 *
 * @since 1.0.0
 */
public enum KernelType {

    LINEAR("linear"),
    RBF("rbf"),
    POLY("poly"),
    SIGMOID("sigmoid");

    private final String configName;

    KernelType(String configName) {
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
    public static KernelType parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (KernelType candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: linear, rbf, poly, sigmoid");
    }
}

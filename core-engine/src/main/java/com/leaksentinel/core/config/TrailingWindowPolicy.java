package com.leaksentinel.core.config;

import java.util.Locale;

/**
 * What to do with the incomplete last window of a series.
 *
 * @since 1.0.0
 */
public enum TrailingWindowPolicy {

    /** Repeat the last real reading up to the full window length. */
    PAD("pad"),

    /** Discard the partial window. */
    DROP("drop");

    private final String configName;

    TrailingWindowPolicy(String configName) {
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
    public static TrailingWindowPolicy parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TrailingWindowPolicy candidate : values()) {
                if (candidate.configName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unsupported value '" + value + "'. Supported values: pad, drop");
    }
}

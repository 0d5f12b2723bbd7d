package com.leaksentinel.core.config;

import java.util.Collections;
import java.util.List;

/**
 * Raised when an {@link AnalysisConfig} violates one or more constraints.
 *
 * <p>
 * All violations found by {@link AnalysisConfig#validate()} are collected
 * into one exception so callers can report them together.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public InvalidConfigurationException(List<String> errors) {
        super("Analysis configuration validation failed:\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.singletonList(message);
    }

    /**
     * @return every individual violation message
     */
    public List<String> getErrors() {
        return errors;
    }
}

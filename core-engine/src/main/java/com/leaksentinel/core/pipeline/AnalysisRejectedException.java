package com.leaksentinel.core.pipeline;

/**
 * An operation is not allowed in the current analysis state, for example
 * starting a second run while one is in progress.
 *
 * @since 1.0.0
 */
public class AnalysisRejectedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AnalysisRejectedException(String message) {
        super(message);
    }
}

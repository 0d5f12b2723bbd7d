package com.leaksentinel.core.model;

/**
 * Base type for input data that cannot be analysed, such as unbridgeable
 * gaps or too little normal data to learn from. Always fatal for the run.
 *
 * @since 1.0.0
 */
public class AnalysisDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnalysisDataException(String message) {
        super(message);
    }
}

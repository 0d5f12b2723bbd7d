package com.leaksentinel.core.detection;

import com.leaksentinel.core.model.AnalysisDataException;

/**
 * Not enough usable normal windows to learn a boundary from.
 *
 * @since 1.0.0
 */
public class InsufficientTrainingDataException extends AnalysisDataException {

    private static final long serialVersionUID = 1L;

    public InsufficientTrainingDataException(String message) {
        super(message);
    }
}

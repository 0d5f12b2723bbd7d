package com.leaksentinel.core.feature;

import com.leaksentinel.core.model.AnalysisDataException;

import java.time.Instant;

/**
 * A signal went silent for longer than the configured tolerance.
 *
 * @since 1.0.0
 */
public class DataGapException extends AnalysisDataException {

    private static final long serialVersionUID = 1L;

    private final String pipelineId;
    private final Instant gapStart;
    private final Instant gapEnd;

    public DataGapException(String pipelineId, String signal, Instant gapStart, Instant gapEnd,
            double toleranceSeconds) {
        super(String.format("Data gap in %s of pipeline '%s' between %s and %s exceeds %.1f s",
                signal, pipelineId, gapStart, gapEnd, toleranceSeconds));
        this.pipelineId = pipelineId;
        this.gapStart = gapStart;
        this.gapEnd = gapEnd;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public Instant getGapStart() {
        return gapStart;
    }

    public Instant getGapEnd() {
        return gapEnd;
    }
}

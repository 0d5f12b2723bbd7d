package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.Window;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw readings to the prediction of the window they fall into.
 *
 * <p>
 * A reading belongs to the window holding its nearest grid point. Readings
 * past the last window (a dropped trailing window) are predicted normal.
 * </p>
 */
final class SamplePredictions {

    private final Map<String, List<Window>> windowsByPipeline = new HashMap<>();
    private final Map<String, AnomalyType[]> predictionByPipeline = new HashMap<>();

    SamplePredictions(List<Window> windows, List<ClassificationResult> results) {
        for (Window w : windows) {
            windowsByPipeline.computeIfAbsent(w.getPipelineId(), k -> new ArrayList<>()).add(w);
        }
        windowsByPipeline.forEach((id, list) -> {
            AnomalyType[] predictions = new AnomalyType[list.size()];
            Arrays.fill(predictions, AnomalyType.NORMAL);
            predictionByPipeline.put(id, predictions);
        });
        for (ClassificationResult r : results) {
            predictionByPipeline.get(r.getPipelineId())[r.getWindowIndex()] =
                    r.isTrueAnomaly() ? AnomalyType.LEAK : AnomalyType.OPERATIONAL;
        }
    }

    /**
     * @return {@link AnomalyType#LEAK} for final anomalies,
     *         {@link AnomalyType#OPERATIONAL} for excluded ones and
     *         {@link AnomalyType#NORMAL} otherwise
     */
    AnomalyType predict(String pipelineId, Sample sample) {
        List<Window> windows = windowsByPipeline.get(pipelineId);
        if (windows == null || windows.isEmpty()) {
            return AnomalyType.NORMAL;
        }
        Window first = windows.get(0);
        Instant origin = first.getStart();
        Duration step = first.getStep();
        double offset = Duration.between(origin, sample.getTimestamp()).toNanos() / (double) step.toNanos();
        long gridIndex = Math.round(offset);
        int windowIndex = (int) Math.floorDiv(gridIndex, (long) first.length());
        if (windowIndex < 0 || windowIndex >= windows.size()) {
            return AnomalyType.NORMAL;
        }
        return predictionByPipeline.get(pipelineId)[windowIndex];
    }
}

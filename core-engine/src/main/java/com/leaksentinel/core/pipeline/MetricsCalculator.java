package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.PipelineStage;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Verdict;
import com.leaksentinel.core.model.Window;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives {@link RunMetrics} from a run's classifications.
 *
 * <h3>Ground truth</h3>
 * <p>
 * Precision, recall and F1 are only computed when every reading is labelled.
 * A leak event is a maximal run of leak-labelled readings of one pipeline.
 * Recall counts an event as detected when any final anomaly window overlaps
 * it, and is undefined without events. Precision is the share of final
 * anomaly windows that contain at least one leak reading, and is undefined
 * without final anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
        // utility class, not instantiable
    }

    /**
     * @param dataset         the analysed data
     * @param windows         every extracted window
     * @param trainingWindows size of the reference set
     * @param results         one classification per flagged window
     * @return builder pre-filled with every figure derivable from the inputs
     */
    public static RunMetrics.Builder compute(SensorDataset dataset, List<Window> windows, int trainingWindows,
            List<ClassificationResult> results) {
        int flagged = results.size();
        int clusterExcluded = 0;
        int correlatorExcluded = 0;
        List<Window> finalWindows = new ArrayList<>();
        for (ClassificationResult r : results) {
            if (r.getVerdict() == Verdict.TRUE_ANOMALY) {
                finalWindows.add(r.getWindow());
            } else if (r.getDecidedBy() == PipelineStage.CLUSTER_FILTER) {
                clusterExcluded++;
            } else if (r.getDecidedBy() == PipelineStage.MULTI_SOURCE_CORRELATOR) {
                correlatorExcluded++;
            }
        }
        double exclusionRate = flagged == 0 ? 0.0 : 100.0 * (flagged - finalWindows.size()) / flagged;

        long normal = 0;
        long trueAnomaly = 0;
        long falseAnomaly = 0;
        SamplePredictions predictions = new SamplePredictions(windows, results);
        for (SensorSeries series : dataset.getSeries()) {
            for (Sample sample : series.getSamples()) {
                switch (predictions.predict(series.getPipelineId(), sample)) {
                    case LEAK -> trueAnomaly++;
                    case OPERATIONAL -> falseAnomaly++;
                    default -> normal++;
                }
            }
        }

        RunMetrics.Builder builder = RunMetrics.builder()
                .falseAnomalyExclusionRate(exclusionRate)
                .normalSamples(normal)
                .trueAnomalySamples(trueAnomaly)
                .falseAnomalySamples(falseAnomaly)
                .totalWindows(windows.size())
                .trainingWindows(trainingWindows)
                .flaggedWindows(flagged)
                .clusterExcluded(clusterExcluded)
                .correlatorExcluded(correlatorExcluded)
                .finalAnomalies(finalWindows.size());

        boolean groundTruth = dataset.isFullyLabelled();
        builder.groundTruthAvailable(groundTruth);
        if (!groundTruth) {
            return builder;
        }

        List<LeakEvent> events = leakEvents(dataset);
        int detected = 0;
        for (LeakEvent event : events) {
            for (Window w : finalWindows) {
                if (w.getPipelineId().equals(event.pipelineId) && w.overlaps(event.start, event.end)) {
                    detected++;
                    break;
                }
            }
        }
        Double recall = events.isEmpty() ? null : (double) detected / events.size();

        int truePositives = 0;
        for (Window w : finalWindows) {
            if (w.containsLabel(AnomalyType.LEAK)) {
                truePositives++;
            }
        }
        Double precision = finalWindows.isEmpty() ? null : (double) truePositives / finalWindows.size();

        Double f1 = null;
        if (precision != null && recall != null) {
            f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        }

        return builder.leakEvents(events.size())
                .detectedLeakEvents(detected)
                .precision(precision)
                .recall(recall)
                .f1Score(f1);
    }

    static List<LeakEvent> leakEvents(SensorDataset dataset) {
        List<LeakEvent> events = new ArrayList<>();
        for (SensorSeries series : dataset.getSeries()) {
            Instant start = null;
            Instant last = null;
            for (Sample sample : series.getSamples()) {
                if (sample.getLabel() == AnomalyType.LEAK) {
                    if (start == null) {
                        start = sample.getTimestamp();
                    }
                    last = sample.getTimestamp();
                } else if (start != null) {
                    events.add(new LeakEvent(series.getPipelineId(), start, last));
                    start = null;
                }
            }
            if (start != null) {
                events.add(new LeakEvent(series.getPipelineId(), start, last));
            }
        }
        return events;
    }

    static final class LeakEvent {
        final String pipelineId;
        final Instant start;
        final Instant end;

        LeakEvent(String pipelineId, Instant start, Instant end) {
            this.pipelineId = pipelineId;
            this.start = start;
            this.end = end;
        }
    }
}

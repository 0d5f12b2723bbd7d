package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.ClusterLabel;
import com.leaksentinel.core.model.PipelineStage;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Verdict;
import com.leaksentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import static com.leaksentinel.core.model.WindowFixtures.STEP;
import static com.leaksentinel.core.model.WindowFixtures.T0;
import static com.leaksentinel.core.model.WindowFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricsCalculator}.
 */
class MetricsCalculatorTest {

    /** One pipeline of 30 readings aligned with three fixture windows. */
    private static SensorDataset dataset(IntFunction<AnomalyType> label) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            samples.add(new Sample(T0.plus(STEP.multipliedBy(i)), 2.0, 25.0, label.apply(i)));
        }
        return SensorDataset.of(new SensorSeries("p1", samples));
    }

    private static List<Window> windows(AnomalyType... labels) {
        List<Window> windows = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            windows.add(window("p1", i, labels[i]));
        }
        return windows;
    }

    private static ClassificationResult trueAnomaly(Window w) {
        return ClassificationResult.builder().window(w).decisionScore(-1.0).clusterId(0)
                .clusterLabel(ClusterLabel.LEAK).frequencyVariance(1.0).correlation(0.1)
                .verdict(Verdict.TRUE_ANOMALY).decidedBy(PipelineStage.BOUNDARY_CLASSIFIER).build();
    }

    private static ClassificationResult excluded(Window w, PipelineStage stage) {
        return ClassificationResult.builder().window(w).decisionScore(-0.2).clusterId(1)
                .clusterLabel(stage == PipelineStage.CLUSTER_FILTER ? ClusterLabel.OPERATIONAL : ClusterLabel.LEAK)
                .verdict(Verdict.FALSE_ANOMALY).decidedBy(stage).build();
    }

    @Test
    @DisplayName("Should compute counts, exclusion rate and perfect scores")
    void shouldComputePerfectRun() {
        SensorDataset dataset = dataset(i -> i >= 10 && i < 15 ? AnomalyType.LEAK : AnomalyType.NORMAL);
        List<Window> windows = windows(AnomalyType.NORMAL, AnomalyType.LEAK, AnomalyType.NORMAL);

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, 2, List.of(
                trueAnomaly(windows.get(1)), excluded(windows.get(2), PipelineStage.CLUSTER_FILTER))).build();

        assertThat(metrics.getTotalWindows()).isEqualTo(3);
        assertThat(metrics.getTrainingWindows()).isEqualTo(2);
        assertThat(metrics.getFlaggedWindows()).isEqualTo(2);
        assertThat(metrics.getFinalAnomalies()).isEqualTo(1);
        assertThat(metrics.getClusterExcluded()).isEqualTo(1);
        assertThat(metrics.getCorrelatorExcluded()).isZero();
        assertThat(metrics.getFalseAnomalyExclusionRate()).isEqualTo(50.0);
        assertThat(metrics.getNormalSamples()).isEqualTo(10);
        assertThat(metrics.getTrueAnomalySamples()).isEqualTo(10);
        assertThat(metrics.getFalseAnomalySamples()).isEqualTo(10);
        assertThat(metrics.isGroundTruthAvailable()).isTrue();
        assertThat(metrics.getLeakEvents()).isEqualTo(1);
        assertThat(metrics.getDetectedLeakEvents()).isEqualTo(1);
        assertThat(metrics.getPrecision()).isEqualTo(1.0);
        assertThat(metrics.getRecall()).isEqualTo(1.0);
        assertThat(metrics.getF1Score()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score a missed leak and a false alarm as zero")
    void shouldScoreMisses() {
        SensorDataset dataset = dataset(i -> i >= 10 && i < 15 ? AnomalyType.LEAK : AnomalyType.NORMAL);
        List<Window> windows = windows(AnomalyType.NORMAL, AnomalyType.LEAK, AnomalyType.NORMAL);

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, 2, List.of(
                excluded(windows.get(1), PipelineStage.MULTI_SOURCE_CORRELATOR),
                trueAnomaly(windows.get(2)))).build();

        assertThat(metrics.getCorrelatorExcluded()).isEqualTo(1);
        assertThat(metrics.getRecall()).isZero();
        assertThat(metrics.getPrecision()).isZero();
        assertThat(metrics.getF1Score()).isZero();
    }

    @Test
    @DisplayName("Should leave precision undefined without final anomalies")
    void shouldLeavePrecisionUndefined() {
        SensorDataset dataset = dataset(i -> i >= 10 && i < 15 ? AnomalyType.LEAK : AnomalyType.NORMAL);
        List<Window> windows = windows(AnomalyType.NORMAL, AnomalyType.LEAK, AnomalyType.NORMAL);

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, 2, List.of()).build();

        assertThat(metrics.getPrecision()).isNull();
        assertThat(metrics.getRecall()).isZero();
        assertThat(metrics.getF1Score()).isNull();
        assertThat(metrics.getFalseAnomalyExclusionRate()).isZero();
        assertThat(metrics.getNormalSamples()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should leave recall undefined without leak events")
    void shouldLeaveRecallUndefined() {
        SensorDataset dataset = dataset(i -> AnomalyType.NORMAL);
        List<Window> windows = windows(AnomalyType.NORMAL, AnomalyType.NORMAL, AnomalyType.NORMAL);

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, 3, List.of(trueAnomaly(windows.get(0))))
                .build();

        assertThat(metrics.getLeakEvents()).isZero();
        assertThat(metrics.getRecall()).isNull();
        assertThat(metrics.getPrecision()).isZero();
        assertThat(metrics.getF1Score()).isNull();
    }

    @Test
    @DisplayName("Should report no scores without ground truth")
    void shouldSkipScoresWithoutLabels() {
        SensorDataset dataset = dataset(i -> null);
        List<Window> windows = windows(null, null, null);

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, 3, List.of(trueAnomaly(windows.get(1))))
                .build();

        assertThat(metrics.isGroundTruthAvailable()).isFalse();
        assertThat(metrics.getPrecision()).isNull();
        assertThat(metrics.getRecall()).isNull();
        assertThat(metrics.getF1Score()).isNull();
        assertThat(metrics.getTrueAnomalySamples()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should split leak readings into maximal runs")
    void shouldFindLeakEvents() {
        SensorDataset dataset = dataset(i -> (i >= 3 && i < 6) || i >= 28 ? AnomalyType.LEAK : AnomalyType.NORMAL);

        List<MetricsCalculator.LeakEvent> events = MetricsCalculator.leakEvents(dataset);

        assertThat(events).hasSize(2);
        assertThat(events.get(0).start).isEqualTo(T0.plus(STEP.multipliedBy(3)));
        assertThat(events.get(0).end).isEqualTo(T0.plus(STEP.multipliedBy(5)));
        assertThat(events.get(1).end).isEqualTo(T0.plus(STEP.multipliedBy(29)));
    }
}

package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.DistanceMetricType;
import com.leaksentinel.core.config.KernelType;
import com.leaksentinel.core.config.LinkageMethod;
import com.leaksentinel.core.detection.InsufficientTrainingDataException;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.PipelineStage;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Verdict;
import com.leaksentinel.core.synthetic.SyntheticPipelineDataGenerator;
import com.leaksentinel.core.synthetic.SyntheticSettings;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisPipeline}.
 */
class AnalysisPipelineTest {

    private static SensorDataset labelled;

    @BeforeAll
    static void generate() {
        labelled = new SyntheticPipelineDataGenerator(SyntheticSettings.builder()
                .pipelines(3)
                .durationHours(8)
                .leakEvents(2)
                .operationalEvents(12)
                .seed(7)
                .build()).generate().getDataset();
    }

    private static AnalysisConfig config() {
        AnalysisConfig config = new AnalysisConfig();
        config.validate();
        return config;
    }

    /** Same readings without ground truth. */
    private static SensorDataset unlabelled(SensorDataset dataset) {
        List<SensorSeries> series = new ArrayList<>();
        for (SensorSeries s : dataset.getSeries()) {
            series.add(new SensorSeries(s.getPipelineId(), s.getSamples().stream()
                    .map(x -> Sample.of(x.getTimestamp(), x.getPressure(), x.getFrequency()))
                    .collect(Collectors.toList())));
        }
        return new SensorDataset(series);
    }

    @Test
    @DisplayName("Should give identical results for identical input")
    void shouldBeIdempotent() {
        AnalysisResult first = new AnalysisPipeline().run(labelled, config());
        AnalysisResult second = new AnalysisPipeline().run(labelled, config());

        assertThat(second.getMetrics()).isEqualTo(first.getMetrics());
        assertThat(second.getClassifications()).isEqualTo(first.getClassifications());
    }

    /** Every linkage and metric pair the clusterer accepts, for every kernel, with and without alignment. */
    static Stream<Arguments> refinementConfigurations() {
        List<Arguments> arguments = new ArrayList<>();
        for (LinkageMethod linkage : LinkageMethod.values()) {
            for (DistanceMetricType metric : DistanceMetricType.values()) {
                if (linkage == LinkageMethod.WARD && metric != DistanceMetricType.EUCLIDEAN) {
                    continue;
                }
                for (KernelType kernel : KernelType.values()) {
                    arguments.add(Arguments.of(linkage.configName(), metric.configName(), kernel.configName(), true));
                    arguments.add(Arguments.of(linkage.configName(), metric.configName(), kernel.configName(), false));
                }
            }
        }
        return arguments.stream();
    }

    @ParameterizedTest(name = "{0}/{1}, {2} kernel, time alignment {3}")
    @MethodSource("refinementConfigurations")
    @DisplayName("Should only refine flagged windows")
    void shouldRefineMonotonically(String linkage, String metric, String kernel, boolean timeAlignment) {
        AnalysisConfig config = config();
        config.setLinkage(linkage);
        config.setDistanceMetric(metric);
        config.setKernel(kernel);
        config.setTimeAlignment(timeAlignment);
        config.validate();

        AnalysisResult result = new AnalysisPipeline().run(labelled, config);
        RunMetrics metrics = result.getMetrics();

        assertThat(result.getClassifications()).hasSize(metrics.getFlaggedWindows());
        assertThat(metrics.getFinalAnomalies()).isLessThanOrEqualTo(metrics.getFlaggedWindows());
        assertThat(metrics.getFinalAnomalies() + metrics.getClusterExcluded() + metrics.getCorrelatorExcluded())
                .isEqualTo(metrics.getFlaggedWindows());
        for (ClassificationResult r : result.getClassifications()) {
            assertThat(r.getDecisionScore()).isNegative();
            if (r.getVerdict() == Verdict.TRUE_ANOMALY) {
                assertThat(r.getDecidedBy()).isEqualTo(PipelineStage.BOUNDARY_CLASSIFIER);
            }
        }
        assertThat(metrics.getNormalSamples() + metrics.getTrueAnomalySamples() + metrics.getFalseAnomalySamples())
                .isEqualTo(labelled.sampleCount());
    }

    @Test
    @DisplayName("Should flag windows with the default configuration")
    void shouldFlagWithDefaults() {
        RunMetrics metrics = new AnalysisPipeline().run(labelled, config()).getMetrics();

        assertThat(metrics.getFlaggedWindows()).isPositive();
    }

    @Test
    @DisplayName("Should report stage progress in order")
    void shouldReportProgress() {
        List<Integer> progress = new ArrayList<>();
        List<String> steps = new ArrayList<>();

        new AnalysisPipeline().run(labelled, config(), (step, p) -> {
            steps.add(step);
            progress.add(p);
        }, new CancellationToken());

        assertThat(progress).containsExactly(0, 10, 25, 30, 50, 55, 70, 75, 90, 95, 100);
        assertThat(steps.get(0)).isEqualTo(AnalysisPipeline.STEP_INITIALIZING);
        assertThat(steps).contains(AnalysisPipeline.STEP_TRAINING, AnalysisPipeline.STEP_CLUSTERING,
                AnalysisPipeline.STEP_CORRELATION);
        assertThat(steps.get(steps.size() - 1)).isEqualTo(AnalysisPipeline.STEP_COMPLETE);
    }

    @Test
    @DisplayName("Should fail when the window is longer than the series")
    void shouldRejectOversizedWindow() {
        AnalysisConfig config = config();
        config.setWindowSize(40_000);

        assertThatThrownBy(() -> new AnalysisPipeline().run(labelled, config))
                .isInstanceOf(InsufficientTrainingDataException.class);
    }

    @Test
    @DisplayName("Should exclude nothing in the correlator at threshold one")
    void shouldDisableCorrelatorAtThresholdOne() {
        AnalysisConfig config = config();
        config.setCorrelationThreshold(1.0);

        RunMetrics metrics = new AnalysisPipeline().run(labelled, config).getMetrics();

        assertThat(metrics.getCorrelatorExcluded()).isZero();
    }

    @Test
    @DisplayName("Should leave recall undefined when no leak was injected")
    void shouldLeaveRecallUndefinedWithoutLeaks() {
        SensorDataset noLeaks = new SyntheticPipelineDataGenerator(SyntheticSettings.builder()
                .pipelines(2).durationHours(6).leakEvents(0).operationalEvents(6).seed(3).build())
                .generate().getDataset();

        RunMetrics metrics = new AnalysisPipeline().run(noLeaks, config()).getMetrics();

        assertThat(metrics.isGroundTruthAvailable()).isTrue();
        assertThat(metrics.getLeakEvents()).isZero();
        assertThat(metrics.getRecall()).isNull();
        assertThat(metrics.getF1Score()).isNull();
    }

    @Test
    @DisplayName("Should report no scores for unlabelled data")
    void shouldRunWithoutGroundTruth() {
        RunMetrics metrics = new AnalysisPipeline().run(unlabelled(labelled), config()).getMetrics();

        assertThat(metrics.isGroundTruthAvailable()).isFalse();
        assertThat(metrics.getPrecision()).isNull();
        assertThat(metrics.getRecall()).isNull();
        assertThat(metrics.getFlaggedWindows()).isPositive();
    }

    @Test
    @DisplayName("Should stop at the first stage boundary once cancelled")
    void shouldHonourCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> new AnalysisPipeline().run(labelled, config(), (s, p) -> {
        }, token)).isInstanceOf(CancellationException.class);
    }

    @Test
    @DisplayName("Should annotate the metrics when the solver hits its iteration limit")
    void shouldWarnOnNonConvergence() {
        AnalysisConfig config = config();
        config.setMaxIterations(1);

        RunMetrics metrics = new AnalysisPipeline().run(labelled, config).getMetrics();

        assertThat(metrics.isSolverConverged()).isFalse();
        assertThat(metrics.getWarnings()).anyMatch(w -> w.contains("did not converge"));
    }

    @Test
    @DisplayName("Should reuse a cached boundary when asked to")
    void shouldReuseCachedModel() {
        ModelCache cache = new ModelCache();
        AnalysisPipeline pipeline = new AnalysisPipeline(cache);
        AnalysisConfig config = config();
        config.setReuseCachedModel(true);

        RunMetrics first = pipeline.run(labelled, config).getMetrics();
        cache.clear();
        RunMetrics retrained = pipeline.run(labelled, config).getMetrics();
        RunMetrics reused = pipeline.run(labelled, config).getMetrics();

        assertThat(retrained).isEqualTo(first);
        assertThat(reused).isEqualTo(first);
    }
}

package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.clustering.ClusterFilter;
import com.leaksentinel.core.clustering.ClusterFilterResult;
import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.correlation.CorrelationFinding;
import com.leaksentinel.core.correlation.MultiSourceCorrelator;
import com.leaksentinel.core.detection.BoundaryClassifier;
import com.leaksentinel.core.detection.BoundaryModel;
import com.leaksentinel.core.detection.InsufficientTrainingDataException;
import com.leaksentinel.core.detection.TrainingSummary;
import com.leaksentinel.core.feature.WindowedFeatureExtractor;
import com.leaksentinel.core.model.Candidate;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.ClusterLabel;
import com.leaksentinel.core.model.PipelineStage;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.Verdict;
import com.leaksentinel.core.model.Window;
import com.leaksentinel.core.model.WindowFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the four stages in order on one dataset.
 *
 * <pre>
 *   raw series
 *     -&gt; windowed feature extraction
 *     -&gt; one-class boundary (flags candidates)
 *     -&gt; cluster filter        (may exclude)
 *     -&gt; multi-source check   (may exclude)
 *     -&gt; metrics
 * </pre>
 *
 * <p>
 * Each refinement stage can only turn a true anomaly into a false one, so the
 * final anomalies are always a subset of the flagged windows. The pipeline has
 * no state of its own apart from the optional {@link ModelCache}; the same
 * input and configuration always give the same result.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisPipeline.class);

    public static final String STEP_INITIALIZING = "Initializing";
    public static final String STEP_FEATURES = "Feature Extraction";
    public static final String STEP_TRAINING = "One-Class SVM Training";
    public static final String STEP_DETECTION = "Anomaly Detection";
    public static final String STEP_CLUSTERING = "Hierarchical Clustering";
    public static final String STEP_CORRELATION = "Multi-source Analysis";
    public static final String STEP_COMPLETE = "Analysis Complete";

    /**
     * Receives the step label and progress percentage at each stage boundary.
     */
    @FunctionalInterface
    public interface StageReporter {
        void report(String step, int progress);
    }

    private final ModelCache modelCache;

    public AnalysisPipeline() {
        this(new ModelCache());
    }

    public AnalysisPipeline(ModelCache modelCache) {
        this.modelCache = Objects.requireNonNull(modelCache, "modelCache must not be null");
    }

    /**
     * Run without progress reporting or cancellation.
     */
    public AnalysisResult run(SensorDataset dataset, AnalysisConfig config) {
        return run(dataset, config, (step, progress) -> {
        }, new CancellationToken());
    }

    /**
     * @param dataset  data to analyse
     * @param config   a validated configuration
     * @param reporter progress sink
     * @param token    checked at every stage boundary
     * @return the completed result
     * @throws com.leaksentinel.core.model.AnalysisDataException if the data
     *                                                           cannot be
     *                                                           analysed
     * @throws java.util.concurrent.CancellationException        if cancelled
     */
    public AnalysisResult run(SensorDataset dataset, AnalysisConfig config, StageReporter reporter,
            CancellationToken token) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(reporter, "reporter must not be null");
        Objects.requireNonNull(token, "token must not be null");

        List<String> warnings = new ArrayList<>();
        boolean useLabels = dataset.isFullyLabelled();

        reporter.report(STEP_INITIALIZING, 0);
        token.throwIfCancelled();
        LOG.info("Starting analysis of {} with {}", dataset, config);

        // 1. Windowed feature extraction
        reporter.report(STEP_FEATURES, 10);
        List<WindowFeatures> windowFeatures = new WindowedFeatureExtractor(config).extractAll(dataset);
        if (windowFeatures.isEmpty()) {
            throw new InsufficientTrainingDataException("Dataset yields no windows; nothing to analyse");
        }
        List<Window> windows = new ArrayList<>(windowFeatures.size());
        for (WindowFeatures wf : windowFeatures) {
            windows.add(wf.getWindow());
        }
        reporter.report(STEP_FEATURES, 25);
        token.throwIfCancelled();

        // 2. Boundary training
        reporter.report(STEP_TRAINING, 30);
        BoundaryClassifier classifier = new BoundaryClassifier(config);
        List<WindowFeatures> reference = classifier.selectReference(windowFeatures, useLabels);
        BoundaryModel model = trainOrReuse(classifier, reference, dataset, config);
        TrainingSummary summary = model.getSummary();
        if (!summary.isConverged()) {
            warnings.add("One-class SVM did not converge within " + config.getMaxIterations()
                    + " iterations (solver used " + summary.getIterations() + "); using the solver's boundary");
        }
        reporter.report(STEP_TRAINING, 50);
        token.throwIfCancelled();

        // 3. Anomaly detection
        reporter.report(STEP_DETECTION, 55);
        List<Candidate> candidates = classifier.flag(model, windowFeatures);
        reporter.report(STEP_DETECTION, 70);
        token.throwIfCancelled();

        // 4. Cluster filter
        reporter.report(STEP_CLUSTERING, 75);
        ClusterFilterResult clusters = new ClusterFilter(config).apply(candidates);
        reporter.report(STEP_CLUSTERING, 90);
        token.throwIfCancelled();

        // 5. Multi-source correlation on what the cluster filter kept
        reporter.report(STEP_CORRELATION, 95);
        Map<String, List<Window>> windowsByPipeline = new LinkedHashMap<>();
        for (Window w : windows) {
            windowsByPipeline.computeIfAbsent(w.getPipelineId(), k -> new ArrayList<>()).add(w);
        }
        MultiSourceCorrelator correlator = new MultiSourceCorrelator(config);
        List<ClassificationResult> results = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            Window window = candidate.getWindow();
            ClassificationResult.Builder result = ClassificationResult.builder()
                    .window(window)
                    .decisionScore(candidate.getScore())
                    .clusterId(clusters.clusterOf(i))
                    .clusterLabel(clusters.labelOf(i));

            if (clusters.labelOf(i) == ClusterLabel.OPERATIONAL) {
                result.verdict(Verdict.FALSE_ANOMALY).decidedBy(PipelineStage.CLUSTER_FILTER);
            } else {
                CorrelationFinding finding = correlator.evaluate(window,
                        windowsByPipeline.get(window.getPipelineId()),
                        dataset.find(window.getPipelineId()).orElse(null));
                result.frequencyVariance(finding.getFrequencyVariance())
                        .correlation(finding.getCorrelation());
                if (finding.isOperational()) {
                    result.verdict(Verdict.FALSE_ANOMALY).decidedBy(PipelineStage.MULTI_SOURCE_CORRELATOR);
                } else {
                    result.verdict(Verdict.TRUE_ANOMALY).decidedBy(PipelineStage.BOUNDARY_CLASSIFIER);
                }
            }
            results.add(result.build());
        }
        verifyRefinement(candidates, results);
        token.throwIfCancelled();

        RunMetrics metrics = MetricsCalculator.compute(dataset, windows, reference.size(), results)
                .solverIterations(summary.getIterations())
                .solverConverged(summary.isConverged())
                .warnings(warnings)
                .build();
        LOG.info("Analysis complete: {}", metrics);
        reporter.report(STEP_COMPLETE, 100);
        return new AnalysisResult(config, metrics, results, clusters.getClusters(), dataset, windows);
    }

    private BoundaryModel trainOrReuse(BoundaryClassifier classifier, List<WindowFeatures> reference,
            SensorDataset dataset, AnalysisConfig config) {
        String key = config.trainingSignature() + "#" + dataset.fingerprint();
        if (config.isReuseCachedModel()) {
            BoundaryModel cached = modelCache.lookup(key).orElse(null);
            if (cached != null) {
                LOG.info("Reusing cached one-class SVM model");
                return cached;
            }
        }
        BoundaryModel model = classifier.train(reference);
        modelCache.store(key, model);
        return model;
    }

    /**
     * Every classification must belong to a flagged window, and each flagged
     * window must be classified exactly once.
     */
    private static void verifyRefinement(List<Candidate> candidates, List<ClassificationResult> results) {
        if (candidates.size() != results.size()) {
            throw new IllegalStateException("Classified " + results.size() + " windows but "
                    + candidates.size() + " were flagged");
        }
        Set<String> flagged = new HashSet<>();
        for (Candidate c : candidates) {
            flagged.add(c.getWindow().getPipelineId() + "#" + c.getWindow().getIndex());
        }
        for (ClassificationResult r : results) {
            if (!flagged.remove(r.getPipelineId() + "#" + r.getWindowIndex())) {
                throw new IllegalStateException("Window " + r.getWindowIndex() + " of pipeline '"
                        + r.getPipelineId() + "' was classified but never flagged");
            }
        }
    }
}

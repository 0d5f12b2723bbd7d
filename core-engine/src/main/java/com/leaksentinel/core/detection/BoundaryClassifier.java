package com.leaksentinel.core.detection;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.feature.FeatureScaler;
import com.leaksentinel.core.model.Candidate;
import com.leaksentinel.core.model.FeatureVector;
import com.leaksentinel.core.model.WindowFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * First stage: learns the normal operating region and flags everything
 * outside it.
 *
 * <h3>Reference windows</h3>
 * <p>
 * The boundary is learned from reference windows only: per pipeline, the
 * windows in the leading {@code reference_fraction} of the series. When
 * ground truth is available, windows containing any non-normal sample are
 * left out. Above {@code max_training_windows} the reference set is thinned
 * by a fixed stride, keeping the result deterministic.
 * </p>
 *
 * @since 1.0.0
 */
public class BoundaryClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryClassifier.class);

    private final AnalysisConfig config;

    /**
     * @param config a validated configuration
     */
    public BoundaryClassifier(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Select the windows the boundary is learned from.
     *
     * @param windows   every extracted window, grouped by pipeline in time
     *                  order
     * @param useLabels exclude windows with non-normal ground truth
     * @return the reference windows
     */
    public List<WindowFeatures> selectReference(List<WindowFeatures> windows, boolean useLabels) {
        Map<String, List<WindowFeatures>> byPipeline = new LinkedHashMap<>();
        for (WindowFeatures wf : windows) {
            byPipeline.computeIfAbsent(wf.getWindow().getPipelineId(), k -> new ArrayList<>()).add(wf);
        }

        List<WindowFeatures> reference = new ArrayList<>();
        for (List<WindowFeatures> pipelineWindows : byPipeline.values()) {
            int leading = (int) Math.ceil(config.getReferenceFraction() * pipelineWindows.size());
            for (int i = 0; i < leading; i++) {
                WindowFeatures wf = pipelineWindows.get(i);
                if (!useLabels || wf.getWindow().isAllNormal()) {
                    reference.add(wf);
                }
            }
        }

        int max = config.getMaxTrainingWindows();
        if (reference.size() > max) {
            double stride = (double) reference.size() / max;
            List<WindowFeatures> thinned = new ArrayList<>(max);
            for (int i = 0; i < max; i++) {
                thinned.add(reference.get((int) (i * stride)));
            }
            LOG.info("Thinned reference set from {} to {} window(s)", reference.size(), max);
            reference = thinned;
        }
        return reference;
    }

    /**
     * Fit the reference scaler and train the boundary.
     *
     * @param reference reference windows
     * @return the trained model
     * @throws InsufficientTrainingDataException if there are fewer than
     *                                           {@code min_training_windows}
     *                                           reference windows or none of
     *                                           their features vary
     */
    public BoundaryModel train(List<WindowFeatures> reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        if (reference.size() < config.getMinTrainingWindows()) {
            throw new InsufficientTrainingDataException(String.format(
                    "Only %d normal reference window(s) available, at least %d required;"
                            + " provide more data or reduce 'window_size'",
                    reference.size(), config.getMinTrainingWindows()));
        }

        List<FeatureVector> raw = new ArrayList<>(reference.size());
        for (WindowFeatures wf : reference) {
            raw.add(wf.getFeatures());
        }
        FeatureScaler scaler = FeatureScaler.fit(raw);
        if (scaler.isDegenerate()) {
            throw new InsufficientTrainingDataException(
                    "Reference windows have zero variance in every feature; cannot learn a boundary");
        }

        double[][] x = new double[raw.size()][];
        for (int i = 0; i < raw.size(); i++) {
            x[i] = config.isNormalize() ? scaler.transform(raw.get(i)).toArray() : raw.get(i).toArray();
        }

        LOG.info("Training one-class SVM: kernel={}, nu={}, gamma={}, {} window(s)",
                config.getKernel(), config.getNu(), config.getGamma(), x.length);
        OneClassSvmModel svm = new OneClassSvmTrainer(config).train(x);
        return new BoundaryModel(scaler, config.isNormalize(), svm);
    }

    /**
     * Score every window and keep those outside the boundary.
     *
     * @param model   the trained model
     * @param windows windows to classify
     * @return candidates with a negative score, in input order
     */
    public List<Candidate> flag(BoundaryModel model, List<WindowFeatures> windows) {
        Objects.requireNonNull(model, "model must not be null");
        List<Candidate> candidates = new ArrayList<>();
        for (WindowFeatures wf : windows) {
            FeatureVector standardized = model.standardize(wf.getFeatures());
            double score = model.score(wf.getFeatures(), standardized);
            if (score < 0) {
                candidates.add(new Candidate(wf.getWindow(), wf.getFeatures(), standardized, score));
            }
        }
        LOG.info("Boundary classifier flagged {} of {} window(s)", candidates.size(), windows.size());
        return candidates;
    }
}

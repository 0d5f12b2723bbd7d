package com.leaksentinel.core.detection;

import com.leaksentinel.core.feature.FeatureScaler;
import com.leaksentinel.core.model.FeatureVector;

import java.util.Objects;

/**
 * Everything needed to score windows: the reference scaler, whether the
 * classifier works on scaled features, and the trained boundary.
 *
 * @since 1.0.0
 */
public final class BoundaryModel {

    private final FeatureScaler referenceScaler;
    private final boolean normalized;
    private final OneClassSvmModel svm;

    BoundaryModel(FeatureScaler referenceScaler, boolean normalized, OneClassSvmModel svm) {
        this.referenceScaler = Objects.requireNonNull(referenceScaler);
        this.normalized = normalized;
        this.svm = Objects.requireNonNull(svm);
    }

    /**
     * @return {@code v} z-scored against the reference windows
     */
    public FeatureVector standardize(FeatureVector v) {
        return referenceScaler.transform(v);
    }

    /**
     * @param raw         raw features
     * @param standardized the same features after {@link #standardize}
     * @return signed decision score
     */
    public double score(FeatureVector raw, FeatureVector standardized) {
        return svm.decisionFunction(normalized ? standardized.toArray() : raw.toArray());
    }

    public TrainingSummary getSummary() {
        return svm.getSummary();
    }

    public OneClassSvmModel getSvm() {
        return svm;
    }
}

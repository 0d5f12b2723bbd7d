package com.leaksentinel.core.detection;

import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.anomaly.Event;
import org.tribuo.impl.ArrayExample;

import java.util.Objects;

/**
 * A trained one-class boundary.
 *
 * <p>
 * Wraps the libsvm model produced by {@link OneClassSvmTrainer}. The score of
 * a point is the libsvm decision value {@code sum(alpha_i * K(sv_i, x)) - rho};
 * points with a negative score lie outside the learned normal region.
 * </p>
 *
 * @since 1.0.0
 */
public final class OneClassSvmModel {

    private final Model<Event> model;
    private final String[] featureNames;
    private final TrainingSummary summary;

    OneClassSvmModel(Model<Event> model, String[] featureNames, TrainingSummary summary) {
        this.model = Objects.requireNonNull(model);
        this.featureNames = featureNames.clone();
        this.summary = Objects.requireNonNull(summary);
    }

    /**
     * @param x point to score, in the space the model was trained in
     * @return signed decision score
     * @throws IllegalArgumentException if {@code x} has the wrong dimension
     */
    public double decisionFunction(double[] x) {
        if (x.length != featureNames.length) {
            throw new IllegalArgumentException(
                    "Expected " + featureNames.length + " features, got: " + x.length);
        }
        // The output of an unlabelled example is a placeholder; only the score is read.
        ArrayExample<Event> example = new ArrayExample<>(new Event(Event.EventType.EXPECTED), featureNames, x);
        Prediction<Event> prediction = model.predict(example);
        return prediction.getOutput().getScore();
    }

    public boolean isOutlier(double[] x) {
        return decisionFunction(x) < 0;
    }

    public int supportVectorCount() {
        return summary.getSupportVectors();
    }

    public double getRho() {
        return summary.getRho();
    }

    public int dimension() {
        return featureNames.length;
    }

    public TrainingSummary getSummary() {
        return summary;
    }
}

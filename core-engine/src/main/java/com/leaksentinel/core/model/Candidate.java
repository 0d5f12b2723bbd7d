package com.leaksentinel.core.model;

import java.util.Objects;

/**
 * A window the boundary classifier placed outside the learned normal region.
 *
 * <p>
 * Holds both the raw features and their reference-standardized form; the
 * latter is the space later stages compare candidates in.
 * </p>
 *
 * @since 1.0.0
 */
public final class Candidate {

    private final Window window;
    private final FeatureVector features;
    private final FeatureVector standardized;
    private final double score;

    /**
     * @param window       the flagged window
     * @param features     raw features of the window
     * @param standardized features z-scored against the reference windows
     * @param score        signed decision score; negative for candidates
     */
    public Candidate(Window window, FeatureVector features, FeatureVector standardized, double score) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.standardized = Objects.requireNonNull(standardized, "standardized must not be null");
        this.score = score;
    }

    public Window getWindow() {
        return window;
    }

    public FeatureVector getFeatures() {
        return features;
    }

    public FeatureVector getStandardized() {
        return standardized;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "pipelineId='" + window.getPipelineId() + '\'' +
                ", window=" + window.getIndex() +
                ", score=" + score +
                '}';
    }
}

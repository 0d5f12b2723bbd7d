package com.leaksentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Builders for hand-made windows and candidates used across tests.
 */
public final class WindowFixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    public static final Duration STEP = Duration.ofSeconds(2);
    public static final int LENGTH = 10;

    private WindowFixtures() {
    }

    /** Window at {@code index} with constant signals, labelled {@code label} throughout. */
    public static Window window(String pipelineId, int index, AnomalyType label) {
        double[] pressure = new double[LENGTH];
        double[] frequency = new double[LENGTH];
        Arrays.fill(pressure, 2.0);
        Arrays.fill(frequency, 25.0);
        return window(pipelineId, index, pressure, frequency, label);
    }

    public static Window window(String pipelineId, int index, double[] pressure, double[] frequency,
            AnomalyType label) {
        AnomalyType[] labels = null;
        if (label != null) {
            labels = new AnomalyType[pressure.length];
            Arrays.fill(labels, label);
        }
        Instant start = T0.plus(STEP.multipliedBy((long) index * pressure.length));
        return new Window(pipelineId, index, start, STEP, pressure, frequency, labels, pressure.length);
    }

    public static WindowFeatures withFeatures(Window window, double... features) {
        return new WindowFeatures(window, new FeatureVector(features));
    }

    public static Candidate candidate(Window window, double score, double... standardized) {
        FeatureVector z = new FeatureVector(standardized);
        return new Candidate(window, z, z, score);
    }
}

package com.leaksentinel.core.model;

import java.util.Objects;

/**
 * A window paired with the features extracted from it.
 *
 * @since 1.0.0
 */
public final class WindowFeatures {

    private final Window window;
    private final FeatureVector features;

    public WindowFeatures(Window window, FeatureVector features) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
    }

    public Window getWindow() {
        return window;
    }

    public FeatureVector getFeatures() {
        return features;
    }

    @Override
    public String toString() {
        return "WindowFeatures{window=" + window + '}';
    }
}

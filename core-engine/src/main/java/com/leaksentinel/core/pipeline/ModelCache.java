package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.detection.BoundaryModel;

import java.util.Optional;

/**
 * Holds the most recently trained boundary together with the key of the data
 * and options it was trained with.
 *
 * @since 1.0.0
 */
public final class ModelCache {

    private String key;
    private BoundaryModel model;

    public synchronized Optional<BoundaryModel> lookup(String key) {
        return key.equals(this.key) ? Optional.of(model) : Optional.empty();
    }

    public synchronized void store(String key, BoundaryModel model) {
        this.key = key;
        this.model = model;
    }

    public synchronized void clear() {
        this.key = null;
        this.model = null;
    }
}

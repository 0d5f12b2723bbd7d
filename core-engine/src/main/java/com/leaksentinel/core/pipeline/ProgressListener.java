package com.leaksentinel.core.pipeline;

/**
 * Receives a snapshot at every stage boundary and state change.
 *
 * <p>
 * Called on the analysis thread; implementations must return quickly.
 * </p>
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(StatusSnapshot snapshot);
}

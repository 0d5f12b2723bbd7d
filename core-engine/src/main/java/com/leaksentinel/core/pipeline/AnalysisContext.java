package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.model.SensorDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Owns one analysis at a time and tracks its lifecycle.
 *
 * <h3>States</h3>
 * <p>
 * {@code IDLE -> RUNNING -> COMPLETED | ERROR}. A run can be started from any
 * state except {@code RUNNING}; starting from a terminal state discards the
 * previous outcome. {@link #reset()} returns a terminal context to
 * {@code IDLE}.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Runs execute on the supplied {@link Executor}. Progress is pushed to
 * registered {@link ProgressListener}s and can also be polled with
 * {@link #getStatus()}. Contexts are independent: several may run at once on
 * different data.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisContext {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisContext.class);

    private final Supplier<SensorDataset> datasetSupplier;
    private final Executor executor;
    private final AnalysisPipeline pipeline;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private StatusSnapshot snapshot = StatusSnapshot.idle();
    private AnalysisResult result;
    private CancellationToken token;

    /**
     * @param datasetSupplier source of the data analysed by each run
     * @param executor        executor the runs are submitted to
     */
    public AnalysisContext(Supplier<SensorDataset> datasetSupplier, Executor executor) {
        this.datasetSupplier = Objects.requireNonNull(datasetSupplier, "datasetSupplier must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.pipeline = new AnalysisPipeline(new ModelCache());
    }

    public void addListener(ProgressListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Validate {@code config} and start a run on the executor.
     *
     * @param config run configuration; copied before use
     * @return future completed with the result, or exceptionally with the
     *         failure
     * @throws com.leaksentinel.core.config.InvalidConfigurationException if the
     *         configuration is invalid; the state is left unchanged
     * @throws AnalysisRejectedException if a run is already in progress
     */
    public CompletableFuture<AnalysisResult> start(AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        AnalysisConfig runConfig = config.copy();
        runConfig.validate();

        CancellationToken runToken = new CancellationToken();
        StatusSnapshot started;
        synchronized (this) {
            if (snapshot.getStatus() == AnalysisStatus.RUNNING) {
                throw new AnalysisRejectedException("Analysis already running");
            }
            token = runToken;
            result = null;
            snapshot = new StatusSnapshot(AnalysisStatus.RUNNING, 0, AnalysisPipeline.STEP_INITIALIZING,
                    null, null);
            started = snapshot;
        }
        LOG.info("Analysis started");
        notifyListeners(started);

        CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> execute(runConfig, runToken, future));
        } catch (RuntimeException e) {
            fail(runToken, e);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Request cooperative cancellation of the current run. The run ends in
     * {@code ERROR} at its next stage boundary.
     *
     * @return {@code true} if a run was in progress
     */
    public synchronized boolean cancel() {
        if (snapshot.getStatus() != AnalysisStatus.RUNNING || token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    /**
     * Return a terminal context to {@code IDLE}. Resetting an idle context is
     * a no-op.
     *
     * @throws AnalysisRejectedException if a run is in progress
     */
    public void reset() {
        StatusSnapshot idle;
        synchronized (this) {
            if (snapshot.getStatus() == AnalysisStatus.RUNNING) {
                throw new AnalysisRejectedException("Cannot reset while an analysis is running");
            }
            if (snapshot.getStatus() == AnalysisStatus.IDLE) {
                return;
            }
            result = null;
            token = null;
            snapshot = StatusSnapshot.idle();
            idle = snapshot;
        }
        LOG.info("Analysis state reset");
        notifyListeners(idle);
    }

    public synchronized StatusSnapshot getStatus() {
        return snapshot;
    }

    /**
     * @return the result, present only once the run has completed
     */
    public synchronized Optional<AnalysisResult> getResult() {
        return snapshot.getStatus() == AnalysisStatus.COMPLETED ? Optional.ofNullable(result) : Optional.empty();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void execute(AnalysisConfig config, CancellationToken runToken,
            CompletableFuture<AnalysisResult> future) {
        try {
            SensorDataset dataset = Objects.requireNonNull(datasetSupplier.get(), "dataset supplier returned null");
            AnalysisResult outcome = pipeline.run(dataset, config,
                    (step, progress) -> advance(runToken, step, progress), runToken);
            StatusSnapshot completed;
            synchronized (this) {
                if (token != runToken) {
                    future.complete(outcome);
                    return;
                }
                result = outcome;
                snapshot = new StatusSnapshot(AnalysisStatus.COMPLETED, 100, AnalysisPipeline.STEP_COMPLETE,
                        outcome.getMetrics(), null);
                completed = snapshot;
            }
            notifyListeners(completed);
            future.complete(outcome);
        } catch (RuntimeException e) {
            fail(runToken, e);
            future.completeExceptionally(e);
        } catch (Error e) {
            fail(runToken, e);
            future.completeExceptionally(e);
            throw e;
        }
    }

    private void advance(CancellationToken runToken, String step, int progress) {
        StatusSnapshot next;
        synchronized (this) {
            if (token != runToken || snapshot.getStatus() != AnalysisStatus.RUNNING) {
                return;
            }
            snapshot = new StatusSnapshot(AnalysisStatus.RUNNING, Math.max(snapshot.getProgress(), progress),
                    step, null, null);
            next = snapshot;
        }
        LOG.info("Analysis progress {}%: {}", next.getProgress(), step);
        notifyListeners(next);
    }

    private void fail(CancellationToken runToken, Throwable e) {
        String message = e instanceof CancellationException
                ? "Analysis cancelled"
                : (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        if (e instanceof CancellationException) {
            LOG.warn("Analysis cancelled");
        } else {
            LOG.error("Analysis failed: {}", message, e);
        }
        StatusSnapshot failed;
        synchronized (this) {
            if (token != runToken) {
                return;
            }
            result = null;
            snapshot = new StatusSnapshot(AnalysisStatus.ERROR, snapshot.getProgress(), snapshot.getCurrentStep(),
                    null, message);
            failed = snapshot;
        }
        notifyListeners(failed);
    }

    private void notifyListeners(StatusSnapshot s) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(s);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener failed: {}", e.getMessage(), e);
            }
        }
    }
}

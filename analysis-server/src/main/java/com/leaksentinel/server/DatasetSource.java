package com.leaksentinel.server;

import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.synthetic.SyntheticDataset;
import com.leaksentinel.core.synthetic.SyntheticPipelineDataGenerator;
import com.leaksentinel.core.synthetic.SyntheticSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The dataset that analysis runs read, replaceable at runtime by generating
 * a new synthetic one.
 *
 * <p>
 * A run reads the dataset when it begins executing. The HTTP front end
 * refuses to regenerate while a run is in progress.
 * </p>
 *
 * @since 1.0.0
 */
public final class DatasetSource implements Supplier<SensorDataset> {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetSource.class);

    private final AtomicReference<SensorDataset> current;
    private volatile SyntheticSettings settings;

    /**
     * @param initial  dataset served until the first regeneration
     * @param settings settings that regeneration requests are applied on top of
     */
    public DatasetSource(SensorDataset initial, SyntheticSettings settings) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public SensorDataset get() {
        return current.get();
    }

    /**
     * @return the settings of the last generation, or the startup settings
     */
    public SyntheticSettings getSettings() {
        return settings;
    }

    /**
     * Generate a synthetic dataset and serve it from now on.
     *
     * @param newSettings generation settings
     * @return the generated dataset with its injected events
     */
    public synchronized SyntheticDataset regenerate(SyntheticSettings newSettings) {
        Objects.requireNonNull(newSettings, "settings must not be null");
        SyntheticDataset generated = new SyntheticPipelineDataGenerator(newSettings).generate();
        current.set(generated.getDataset());
        settings = newSettings;
        LOG.info("Replaced dataset: {} pipeline(s), {} leak(s), {} operational event(s), seed {}",
                generated.getDataset().getSeries().size(), generated.getLeaks().size(),
                generated.getOperationalEvents().size(), newSettings.getSeed());
        return generated;
    }
}

package com.leaksentinel.core.feature;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.TrailingWindowPolicy;
import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.FeatureVector;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Window;
import com.leaksentinel.core.model.WindowFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits series into non-overlapping windows and computes their features.
 *
 * <p>
 * Each series is first resampled onto the nominal grid, then cut into
 * windows of {@link AnalysisConfig#pointsPerWindow()} points. An incomplete
 * last window is padded by repeating its final reading or dropped, depending
 * on the trailing window policy. With outlier removal enabled the window
 * values are clipped to their Tukey fences before features are computed; the
 * window itself keeps the unclipped values.
 * </p>
 *
 * <p>
 * {@link #extract(SensorSeries)} is lazy: nothing is resampled until the
 * returned sequence is iterated, and every new iteration starts over with
 * identical results.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowedFeatureExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(WindowedFeatureExtractor.class);

    private final Resampler resampler;
    private final int pointsPerWindow;
    private final TrailingWindowPolicy trailingPolicy;
    private final boolean removeOutliers;

    /**
     * @param config a validated configuration
     */
    public WindowedFeatureExtractor(AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.resampler = new Resampler(config.getSamplingRate(), config.interpolation(),
                config.getMaxGapFraction() * config.getWindowSize());
        this.pointsPerWindow = config.pointsPerWindow();
        this.trailingPolicy = config.trailingPolicy();
        this.removeOutliers = config.isRemoveOutliers();
    }

    /**
     * @param series the raw series
     * @return restartable, time-ordered sequence of windows with features
     * @throws DataGapException on iteration, if the series has an intolerable
     *                          gap
     */
    public Iterable<WindowFeatures> extract(SensorSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return () -> series.isEmpty()
                ? Collections.emptyIterator()
                : new WindowIterator(resampler.resample(series));
    }

    /**
     * Extract every window of every series, in dataset order.
     *
     * @param dataset the dataset
     * @return all windows with their features
     * @throws DataGapException if any series has an intolerable gap
     */
    public List<WindowFeatures> extractAll(SensorDataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        List<WindowFeatures> all = new ArrayList<>();
        for (SensorSeries series : dataset.getSeries()) {
            int before = all.size();
            extract(series).forEach(all::add);
            LOG.debug("Pipeline '{}': {} window(s)", series.getPipelineId(), all.size() - before);
        }
        LOG.info("Extracted {} window(s) from {} pipeline(s)", all.size(), dataset.getSeries().size());
        return all;
    }

    public int getPointsPerWindow() {
        return pointsPerWindow;
    }

    // ---------------------------------------------------------------
    // Iterator
    // ---------------------------------------------------------------

    private final class WindowIterator implements Iterator<WindowFeatures> {

        private final ResampledSeries grid;
        private final int count;
        private int next;

        WindowIterator(ResampledSeries grid) {
            this.grid = grid;
            int full = grid.size() / pointsPerWindow;
            boolean partial = grid.size() % pointsPerWindow != 0;
            this.count = full + (partial && trailingPolicy == TrailingWindowPolicy.PAD ? 1 : 0);
        }

        @Override
        public boolean hasNext() {
            return next < count;
        }

        @Override
        public WindowFeatures next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int index = next++;
            int from = index * pointsPerWindow;
            int real = Math.min(pointsPerWindow, grid.size() - from);

            double[] pressure = padded(grid.pressure(), from, real);
            double[] frequency = padded(grid.frequency(), from, real);
            AnomalyType[] labels = null;
            if (grid.labels() != null) {
                labels = Arrays.copyOfRange(grid.labels(), from, from + pointsPerWindow);
                Arrays.fill(labels, real, pointsPerWindow, grid.labels()[from + real - 1]);
            }

            Window window = new Window(grid.getPipelineId(), index,
                    grid.getOrigin().plus(grid.getStep().multipliedBy(from)), grid.getStep(),
                    pressure, frequency, labels, real);

            FeatureVector features = removeOutliers
                    ? FeatureCalculator.compute(OutlierClipper.clip(pressure), OutlierClipper.clip(frequency))
                    : FeatureCalculator.compute(pressure, frequency);
            return new WindowFeatures(window, features);
        }

        private double[] padded(double[] source, int from, int real) {
            double[] out = Arrays.copyOfRange(source, from, from + pointsPerWindow);
            Arrays.fill(out, real, pointsPerWindow, source[from + real - 1]);
            return out;
        }
    }
}

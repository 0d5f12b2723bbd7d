/**
 * Windowed feature extraction.
 *
 * <p>
 * {@link com.leaksentinel.core.feature.Resampler} places raw readings on a
 * regular grid, {@link com.leaksentinel.core.feature.WindowedFeatureExtractor}
 * cuts the grid into windows and
 * {@link com.leaksentinel.core.feature.FeatureCalculator} describes each window
 * with 17 statistics. {@link com.leaksentinel.core.feature.FeatureScaler}
 * standardizes vectors against the reference windows.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.feature;

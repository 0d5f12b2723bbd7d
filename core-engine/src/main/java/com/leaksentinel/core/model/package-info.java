/**
 * Domain model of the leak classification pipeline.
 *
 * <p>
 * Raw input is a {@link com.leaksentinel.core.model.SensorDataset} of
 * per-pipeline {@link com.leaksentinel.core.model.SensorSeries}. The
 * extractor turns each series into {@link com.leaksentinel.core.model.Window}s
 * with their {@link com.leaksentinel.core.model.FeatureVector}; flagged
 * windows become {@link com.leaksentinel.core.model.Candidate}s and end up as
 * {@link com.leaksentinel.core.model.ClassificationResult}s summarised by
 * {@link com.leaksentinel.core.model.RunMetrics}.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.model;

/**
 * Run configuration of the leak classification pipeline.
 *
 * <p>
 * {@link com.leaksentinel.core.config.AnalysisConfig} is the single flat
 * option set of a run. Defaults ship as YAML and are loaded by
 * {@link com.leaksentinel.core.config.AnalysisConfigLoader}; request bodies
 * bind onto the same type. Validation collects every violation into one
 * {@link com.leaksentinel.core.config.InvalidConfigurationException} so that
 * a bad configuration is rejected before a run starts.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.config;

/**
 * Orchestration of the classification stages.
 *
 * <p>
 * {@link com.leaksentinel.core.pipeline.AnalysisPipeline} runs the stages
 * synchronously. {@link com.leaksentinel.core.pipeline.AnalysisContext} wraps
 * it in a lifecycle ({@code idle}, {@code running}, {@code completed},
 * {@code error}) with progress reporting, cancellation and a reusable model
 * cache. {@link com.leaksentinel.core.pipeline.ResultExporter} writes the
 * per-reading outcome as CSV.
 * </p>
 *
 * @since 1.0.0
 */
package com.leaksentinel.core.pipeline;

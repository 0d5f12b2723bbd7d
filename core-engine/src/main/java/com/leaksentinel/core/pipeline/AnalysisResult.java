package com.leaksentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.model.AnomalyCluster;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.DatasetStatistics;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.Window;

import java.util.List;
import java.util.Objects;

/**
 * Output of a completed run.
 *
 * <p>
 * The serialized form carries the metrics, per-candidate classifications,
 * cluster summaries and statistics of the analysed dataset. The dataset and windows stay available to in-process
 * callers for exporting.
 * </p>
 *
 * @since 1.0.0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class AnalysisResult {

    private final AnalysisConfig config;
    private final RunMetrics metrics;
    private final List<ClassificationResult> classifications;
    private final List<AnomalyCluster> clusters;
    private final DatasetStatistics dataStats;
    private final SensorDataset dataset;
    private final List<Window> windows;

    AnalysisResult(AnalysisConfig config, RunMetrics metrics, List<ClassificationResult> classifications,
            List<AnomalyCluster> clusters, SensorDataset dataset, List<Window> windows) {
        this.config = Objects.requireNonNull(config);
        this.metrics = Objects.requireNonNull(metrics);
        this.classifications = List.copyOf(classifications);
        this.clusters = List.copyOf(clusters);
        this.dataset = Objects.requireNonNull(dataset);
        this.dataStats = DatasetStatistics.of(dataset);
        this.windows = List.copyOf(windows);
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public RunMetrics getMetrics() {
        return metrics;
    }

    /**
     * @return one entry per flagged window, in extraction order
     */
    public List<ClassificationResult> getClassifications() {
        return classifications;
    }

    public List<AnomalyCluster> getClusters() {
        return clusters;
    }

    /**
     * @return volume and label counts of the analysed dataset
     */
    public DatasetStatistics getDataStats() {
        return dataStats;
    }

    @JsonIgnore
    public SensorDataset getDataset() {
        return dataset;
    }

    @JsonIgnore
    public List<Window> getWindows() {
        return windows;
    }
}

package com.leaksentinel.core.pipeline;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.ClassificationResult;
import com.leaksentinel.core.model.ClusterLabel;
import com.leaksentinel.core.model.PipelineStage;
import com.leaksentinel.core.model.RunMetrics;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.model.Verdict;
import com.leaksentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.leaksentinel.core.model.WindowFixtures.STEP;
import static com.leaksentinel.core.model.WindowFixtures.T0;
import static com.leaksentinel.core.model.WindowFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultExporter}.
 */
class ResultExporterTest {

    private static AnalysisResult result() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            double pressure = i == 3 ? Double.NaN : 2.0;
            samples.add(Sample.of(T0.plus(STEP.multipliedBy(i)), pressure, 25.0));
        }
        SensorDataset dataset = SensorDataset.of(new SensorSeries("p1", samples));
        List<Window> windows = List.of(
                window("p1", 0, AnomalyType.NORMAL),
                window("p1", 1, AnomalyType.NORMAL),
                window("p1", 2, AnomalyType.NORMAL));
        List<ClassificationResult> classifications = List.of(
                ClassificationResult.builder().window(windows.get(1)).decisionScore(-2.0).clusterId(0)
                        .clusterLabel(ClusterLabel.LEAK).verdict(Verdict.TRUE_ANOMALY)
                        .decidedBy(PipelineStage.BOUNDARY_CLASSIFIER).build(),
                ClassificationResult.builder().window(windows.get(2)).decisionScore(-0.5).clusterId(1)
                        .clusterLabel(ClusterLabel.OPERATIONAL).verdict(Verdict.FALSE_ANOMALY)
                        .decidedBy(PipelineStage.CLUSTER_FILTER).build());
        RunMetrics metrics = RunMetrics.builder().flaggedWindows(2).finalAnomalies(1).build();
        return new AnalysisResult(new AnalysisConfig(), metrics, classifications, List.of(), dataset, windows);
    }

    @Test
    @DisplayName("Should write one row per raw reading with a header")
    void shouldWriteRows() {
        String[] lines = ResultExporter.toCsv(result()).split("\n");

        assertThat(lines).hasSize(26);
        assertThat(lines[0]).isEqualTo("pipeline_id,time,pressure,frequency,is_anomaly,anomaly_type");
        assertThat(lines[1]).isEqualTo("p1,2024-01-01T00:00:00Z,2.0,25.0,false,normal");
    }

    @Test
    @DisplayName("Should mark flagged readings with their final type")
    void shouldMarkAnomalies() {
        String[] lines = ResultExporter.toCsv(result()).split("\n");

        assertThat(lines[11]).isEqualTo("p1,2024-01-01T00:00:20Z,2.0,25.0,true,leak");
        assertThat(lines[25]).isEqualTo("p1,2024-01-01T00:00:48Z,2.0,25.0,true,operational");
    }

    @Test
    @DisplayName("Should leave missing values empty")
    void shouldWriteMissingValuesEmpty() {
        String[] lines = ResultExporter.toCsv(result()).split("\n");

        assertThat(lines[4]).isEqualTo("p1,2024-01-01T00:00:06Z,,25.0,false,normal");
    }
}

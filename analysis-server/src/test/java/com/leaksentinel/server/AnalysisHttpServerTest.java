package com.leaksentinel.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.pipeline.AnalysisContext;
import com.leaksentinel.core.synthetic.SyntheticPipelineDataGenerator;
import com.leaksentinel.core.synthetic.SyntheticSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisHttpServer}.
 */
class AnalysisHttpServerTest {

    /** Holds submitted runs until the test executes them. */
    private static final class DeferredExecutor implements Executor {

        private final Deque<Runnable> pending = new ArrayDeque<>();

        @Override
        public synchronized void execute(Runnable command) {
            pending.add(command);
        }

        void runNext() {
            Runnable next;
            synchronized (this) {
                next = pending.removeFirst();
            }
            next.run();
        }
    }

    private static final SyntheticSettings SETTINGS = SyntheticSettings.builder()
            .pipelines(3)
            .durationHours(8)
            .leakEvents(2)
            .operationalEvents(12)
            .seed(7)
            .build();

    private static SensorDataset dataset;

    private final HttpClient client = HttpClient.newHttpClient();
    private DeferredExecutor executor;
    private DatasetSource datasets;
    private AnalysisHttpServer server;

    @BeforeAll
    static void generate() {
        dataset = new SyntheticPipelineDataGenerator(SETTINGS).generate().getDataset();
    }

    @BeforeEach
    void startServer() {
        executor = new DeferredExecutor();
        datasets = new DatasetSource(dataset, SETTINGS);
        server = new AnalysisHttpServer(new AnalysisContext(datasets, executor), new AnalysisConfig(), datasets);
        server.start(0);
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return AnalysisHttpServer.MAPPER.readTree(response.body());
    }

    // ---------------------------------------------------------------
    // Tests
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should answer health checks")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(server.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should report idle status before any run")
    void shouldReportIdleStatus() throws Exception {
        JsonNode status = json(get("/api/analysis-status"));

        assertThat(status.get("status").asText()).isEqualTo("idle");
        assertThat(status.get("progress").asInt()).isZero();
        assertThat(status.has("results")).isFalse();
    }

    @Test
    @DisplayName("Should return 404 for results and export before completion")
    void shouldHideResultsBeforeCompletion() throws Exception {
        assertThat(get("/api/analysis-results").statusCode()).isEqualTo(404);
        assertThat(get("/api/export").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Should serve the default model configuration")
    void shouldServeModelConfig() throws Exception {
        JsonNode config = json(get("/api/model-config"));

        assertThat(config.get("kernel").asText()).isEqualTo("rbf");
        assertThat(config.get("n_clusters").asInt()).isEqualTo(new AnalysisConfig().getNClusters());
        assertThat(config.has("correlation_threshold")).isTrue();
    }

    @Test
    @DisplayName("Should run an analysis through its whole lifecycle")
    void shouldRunLifecycle() throws Exception {
        HttpResponse<String> started = post("/api/start-analysis", "{\"nu\": 0.1}");
        assertThat(started.statusCode()).isEqualTo(202);
        assertThat(json(started).get("success").asBoolean()).isTrue();

        assertThat(json(get("/api/analysis-status")).get("status").asText()).isEqualTo("running");
        assertThat(post("/api/start-analysis", "").statusCode()).isEqualTo(409);
        assertThat(post("/api/reset", "").statusCode()).isEqualTo(409);

        executor.runNext();

        JsonNode status = json(get("/api/analysis-status"));
        assertThat(status.get("status").asText()).isEqualTo("completed");
        assertThat(status.get("progress").asInt()).isEqualTo(100);
        assertThat(status.get("results").get("flagged_windows").asInt()).isPositive();

        HttpResponse<String> results = get("/api/analysis-results");
        assertThat(results.statusCode()).isEqualTo(200);
        JsonNode body = json(results);
        assertThat(body.get("config").get("nu").asDouble()).isEqualTo(0.1);
        assertThat(body.get("classifications").isArray()).isTrue();
        assertThat(body.has("dataset")).isFalse();
        assertThat(body.get("data_stats").get("total_samples").asLong()).isEqualTo(dataset.sampleCount());
        assertThat(body.get("data_stats").get("pipelines").asInt()).isEqualTo(3);

        HttpResponse<String> export = get("/api/export");
        assertThat(export.statusCode()).isEqualTo(200);
        assertThat(export.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/csv"));
        assertThat(export.body().lines().findFirst())
                .hasValue("pipeline_id,time,pressure,frequency,is_anomaly,anomaly_type");
        assertThat(export.body().lines().count()).isEqualTo(dataset.sampleCount() + 1L);

        assertThat(post("/api/reset", "").statusCode()).isEqualTo(200);
        assertThat(json(get("/api/analysis-status")).get("status").asText()).isEqualTo("idle");
        assertThat(get("/api/analysis-results").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Should reject an invalid configuration with every violation")
    void shouldRejectInvalidConfiguration() throws Exception {
        HttpResponse<String> response = post("/api/start-analysis",
                "{\"kernel\": \"cubic\", \"nu\": 2.0}");

        assertThat(response.statusCode()).isEqualTo(400);
        JsonNode body = json(response);
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("errors").size()).isEqualTo(2);
        assertThat(json(get("/api/analysis-status")).get("status").asText()).isEqualTo("idle");
    }

    @Test
    @DisplayName("Should reject a malformed JSON body")
    void shouldRejectMalformedBody() throws Exception {
        HttpResponse<String> response = post("/api/start-analysis", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(json(response).get("error").asText()).startsWith("Malformed JSON body");
    }

    @Test
    @DisplayName("Should reject a wrong HTTP method")
    void shouldRejectWrongMethod() throws Exception {
        HttpResponse<String> response = get("/api/start-analysis");

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("POST");
    }

    @Test
    @DisplayName("Should apply request values on top of the defaults")
    void shouldMergeOverridesWithDefaults() {
        AnalysisConfig defaults = new AnalysisConfig();
        defaults.setCorrelationThreshold(0.9);
        AnalysisHttpServer custom = new AnalysisHttpServer(new AnalysisContext(datasets, executor), defaults, datasets);

        AnalysisConfig resolved = custom.resolve(Map.of("nu", 0.2));

        assertThat(resolved.getNu()).isEqualTo(0.2);
        assertThat(resolved.getCorrelationThreshold()).isEqualTo(0.9);
        assertThat(custom.resolve(Map.of())).isEqualTo(defaults);
    }

    @Test
    @DisplayName("Should save a model configuration used by later runs")
    void shouldSaveModelConfig() throws Exception {
        HttpResponse<String> saved = post("/api/model-config", "{\"nu\": 0.2, \"linkage\": \"average\"}");

        assertThat(saved.statusCode()).isEqualTo(200);
        assertThat(json(saved).get("config").get("nu").asDouble()).isEqualTo(0.2);
        JsonNode config = json(get("/api/model-config"));
        assertThat(config.get("nu").asDouble()).isEqualTo(0.2);
        assertThat(config.get("linkage").asText()).isEqualTo("average");
        assertThat(config.get("kernel").asText()).isEqualTo("rbf");

        assertThat(post("/api/start-analysis", "").statusCode()).isEqualTo(202);
        executor.runNext();
        assertThat(json(get("/api/analysis-results")).get("config").get("nu").asDouble()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should keep the saved configuration when a new one is invalid")
    void shouldRejectInvalidModelConfig() throws Exception {
        HttpResponse<String> response = post("/api/model-config", "{\"n_clusters\": 1}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(json(response).get("errors").get(0).asText()).contains("'n_clusters' must be >= 2");
        assertThat(json(get("/api/model-config")).get("n_clusters").asInt())
                .isEqualTo(new AnalysisConfig().getNClusters());
    }

    @Test
    @DisplayName("Should list both methods of the model configuration endpoint")
    void shouldAllowGetAndPostOnModelConfig() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/api/model-config"))
                .DELETE()
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("GET, POST");
    }

    @Test
    @DisplayName("Should generate a new dataset and analyse it in the next run")
    void shouldGenerateData() throws Exception {
        HttpResponse<String> response = post("/api/generate-data",
                "{\"pipelines\": 2, \"duration_hours\": 8, \"leak_events\": 1, \"operational_events\": 6, \"seed\": 3}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = json(response);
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("settings").get("pipelines").asInt()).isEqualTo(2);
        assertThat(body.get("settings").get("sampling_rate_seconds").asInt())
                .isEqualTo(SETTINGS.getSamplingRateSeconds());
        JsonNode statistics = body.get("statistics");
        assertThat(statistics.get("pipelines").asInt()).isEqualTo(2);
        assertThat(statistics.get("leak_samples").asLong()).isPositive();
        assertThat(statistics.get("total_samples").asLong()).isEqualTo(datasets.get().sampleCount());
        assertThat(body.get("data").size()).isEqualTo(AnalysisHttpServer.SAMPLE_ROWS);
        assertThat(body.get("data").get(0).get("pipeline_id").asText())
                .isEqualTo(datasets.get().getSeries().get(0).getPipelineId());
        assertThat(body.get("data").get(0).has("anomaly_type")).isTrue();

        assertThat(post("/api/start-analysis", "").statusCode()).isEqualTo(202);
        executor.runNext();
        assertThat(json(get("/api/analysis-results")).get("data_stats").get("pipelines").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse to generate data while an analysis is running")
    void shouldRejectGenerationWhileRunning() throws Exception {
        assertThat(post("/api/start-analysis", "").statusCode()).isEqualTo(202);

        HttpResponse<String> response = post("/api/generate-data", "{\"seed\": 99}");

        assertThat(response.statusCode()).isEqualTo(409);
        assertThat(datasets.get()).isSameAs(dataset);
        executor.runNext();
    }

    @Test
    @DisplayName("Should reject invalid generation settings")
    void shouldRejectInvalidGenerationSettings() throws Exception {
        HttpResponse<String> response = post("/api/generate-data", "{\"pipelines\": 0}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(json(response).get("error").asText()).contains("pipelines must be >= 1");
        assertThat(datasets.get()).isSameAs(dataset);
    }

    @Test
    @DisplayName("Should list readings in dataset order up to the limit")
    void shouldListSampleRows() {
        List<Map<String, Object>> rows = AnalysisHttpServer.sampleRows(dataset, 5);

        assertThat(rows).hasSize(5);
        assertThat(rows.get(0)).containsKeys("pipeline_id", "timestamp", "pressure", "frequency", "anomaly_type");
        assertThat(rows.get(0).get("timestamp")).isEqualTo(dataset.getSeries().get(0).getSamples().get(0).getTimestamp());
        assertThat(AnalysisHttpServer.sampleRows(dataset, Integer.MAX_VALUE).size()).isEqualTo(dataset.sampleCount());
    }
}

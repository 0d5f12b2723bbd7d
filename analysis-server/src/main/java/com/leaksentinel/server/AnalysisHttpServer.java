package com.leaksentinel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.AnalysisConfigLoader;
import com.leaksentinel.core.config.InvalidConfigurationException;
import com.leaksentinel.core.model.DatasetStatistics;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import com.leaksentinel.core.pipeline.AnalysisContext;
import com.leaksentinel.core.pipeline.AnalysisRejectedException;
import com.leaksentinel.core.pipeline.AnalysisResult;
import com.leaksentinel.core.pipeline.AnalysisStatus;
import com.leaksentinel.core.pipeline.ResultExporter;
import com.leaksentinel.core.synthetic.SyntheticDataset;
import com.leaksentinel.core.synthetic.SyntheticSettings;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JSON-over-HTTP front end of an {@link AnalysisContext}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /api/health} returns {@code {"status":"UP"}}</li>
 * <li>{@code POST /api/start-analysis} starts a run; the JSON body overrides
 * the default configuration key by key</li>
 * <li>{@code GET /api/analysis-status} returns the current status
 * snapshot</li>
 * <li>{@code GET /api/analysis-results} returns the completed result, or
 * {@code 404}</li>
 * <li>{@code GET /api/export} returns the per-sample CSV, or {@code 404}</li>
 * <li>{@code POST /api/reset} returns the context to idle</li>
 * <li>{@code GET /api/model-config} returns the default configuration</li>
 * <li>{@code POST /api/model-config} applies the JSON body on top of the
 * defaults and keeps the result as the new defaults</li>
 * <li>{@code POST /api/generate-data} replaces the dataset with a new
 * synthetic one and returns its statistics and the first
 * {@value #SAMPLE_ROWS} rows</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}. Handlers never block on a run:
 * analyses execute on the context's own executor. Requests are handled one at
 * a time, so the running check before a data generation cannot race a
 * start.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisHttpServer.class);

    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final String JSON = "application/json";
    private static final String CSV = "text/csv; charset=utf-8";

    static final int SAMPLE_ROWS = 1000;

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final AnalysisContext context;
    private final DatasetSource datasets;
    private volatile AnalysisConfig defaults;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param context  the analysis lifecycle served by this endpoint
     * @param defaults configuration that request bodies are applied on top of
     * @param datasets the dataset the context analyses
     */
    public AnalysisHttpServer(AnalysisContext context, AnalysisConfig defaults, DatasetSource datasets) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null").copy();
        this.datasets = Objects.requireNonNull(datasets, "datasets must not be null");
    }

    /**
     * Start serving on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind analysis server on port " + port, e);
        }
        server.createContext("/api/health", exchange -> handle(exchange, "GET", this::handleHealth));
        server.createContext("/api/start-analysis", exchange -> handle(exchange, "POST", this::handleStart));
        server.createContext("/api/analysis-status", exchange -> handle(exchange, "GET", this::handleStatus));
        server.createContext("/api/analysis-results", exchange -> handle(exchange, "GET", this::handleResults));
        server.createContext("/api/export", exchange -> handle(exchange, "GET", this::handleExport));
        server.createContext("/api/reset", exchange -> handle(exchange, "POST", this::handleReset));
        Map<String, HttpHandler> modelConfig = new TreeMap<>();
        modelConfig.put("GET", this::handleModelConfig);
        modelConfig.put("POST", this::handleSaveModelConfig);
        server.createContext("/api/model-config", exchange -> handle(exchange, modelConfig));
        server.createContext("/api/generate-data", exchange -> handle(exchange, "POST", this::handleGenerateData));

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "analysis-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Analysis server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Analysis server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port; meaningful once started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server has not been started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        send(exchange, 200, JSON, HEALTH_RESPONSE);
    }

    private void handleStart(HttpExchange exchange) throws IOException {
        Map<String, Object> overrides;
        try {
            overrides = readBody(exchange);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage(), List.of());
            return;
        }

        try {
            AnalysisConfig config = resolve(overrides);
            context.start(config);
        } catch (InvalidConfigurationException e) {
            LOG.warn("Rejected analysis configuration: {}", e.getErrors());
            sendError(exchange, 400, e.getMessage(), e.getErrors());
            return;
        } catch (AnalysisRejectedException e) {
            sendError(exchange, 409, e.getMessage(), List.of());
            return;
        }
        sendJson(exchange, 202, Map.of("success", true, "message", "Analysis started"));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, context.getStatus());
    }

    private void handleResults(HttpExchange exchange) throws IOException {
        Optional<AnalysisResult> result = context.getResult();
        if (result.isEmpty()) {
            sendError(exchange, 404, "No completed analysis", List.of());
            return;
        }
        sendJson(exchange, 200, result.get());
    }

    private void handleExport(HttpExchange exchange) throws IOException {
        Optional<AnalysisResult> result = context.getResult();
        if (result.isEmpty()) {
            sendError(exchange, 404, "No completed analysis", List.of());
            return;
        }
        exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"analysis.csv\"");
        send(exchange, 200, CSV, ResultExporter.toCsv(result.get()).getBytes(StandardCharsets.UTF_8));
    }

    private void handleReset(HttpExchange exchange) throws IOException {
        try {
            context.reset();
        } catch (AnalysisRejectedException e) {
            sendError(exchange, 409, e.getMessage(), List.of());
            return;
        }
        sendJson(exchange, 200, Map.of("success", true, "message", "Analysis state reset"));
    }

    private void handleModelConfig(HttpExchange exchange) throws IOException {
        sendJson(exchange, 200, defaults);
    }

    private void handleSaveModelConfig(HttpExchange exchange) throws IOException {
        Map<String, Object> overrides;
        try {
            overrides = readBody(exchange);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage(), List.of());
            return;
        }

        AnalysisConfig saved;
        try {
            saved = resolve(overrides);
        } catch (InvalidConfigurationException e) {
            LOG.warn("Rejected model configuration: {}", e.getErrors());
            sendError(exchange, 400, e.getMessage(), e.getErrors());
            return;
        }
        defaults = saved;
        LOG.info("Saved model configuration: {}", saved);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Configuration saved");
        body.put("config", saved);
        sendJson(exchange, 200, body);
    }

    private void handleGenerateData(HttpExchange exchange) throws IOException {
        SyntheticDataRequest request;
        try {
            byte[] body = readBytes(exchange);
            request = body.length == 0 ? new SyntheticDataRequest()
                    : MAPPER.readValue(body, SyntheticDataRequest.class);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage(), List.of());
            return;
        }
        if (context.getStatus().getStatus() == AnalysisStatus.RUNNING) {
            sendError(exchange, 409, "Cannot generate data while an analysis is running", List.of());
            return;
        }

        SyntheticDataset generated;
        try {
            generated = datasets.regenerate(request.applyTo(datasets.getSettings()));
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage(), List.of());
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Data generated successfully");
        body.put("settings", settingsBody(datasets.getSettings()));
        body.put("statistics", DatasetStatistics.of(generated.getDataset()));
        body.put("data", sampleRows(generated.getDataset(), SAMPLE_ROWS));
        sendJson(exchange, 200, body);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Apply request overrides on top of the defaults.
     */
    AnalysisConfig resolve(Map<String, Object> overrides) {
        AnalysisConfig base = defaults;
        if (overrides.isEmpty()) {
            return base.copy();
        }
        Map<String, Object> merged = new LinkedHashMap<>(MAPPER.convertValue(base, BODY_TYPE));
        merged.putAll(overrides);
        return AnalysisConfigLoader.fromMap(merged);
    }

    private static Map<String, Object> settingsBody(SyntheticSettings settings) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pipelines", settings.getPipelines());
        body.put("duration_hours", settings.getDurationHours());
        body.put("sampling_rate_seconds", settings.getSamplingRateSeconds());
        body.put("leak_events", settings.getLeakEvents());
        body.put("operational_events", settings.getOperationalEvents());
        body.put("seed", settings.getSeed());
        return body;
    }

    /**
     * First {@code limit} readings in dataset order, one map per row.
     */
    static List<Map<String, Object>> sampleRows(SensorDataset dataset, int limit) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (SensorSeries series : dataset.getSeries()) {
            for (Sample sample : series.getSamples()) {
                if (rows.size() >= limit) {
                    return rows;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("pipeline_id", series.getPipelineId());
                row.put("timestamp", sample.getTimestamp());
                row.put("pressure", sample.getPressure());
                row.put("frequency", sample.getFrequency());
                row.put("anomaly_type", sample.getLabel());
                rows.add(row);
            }
        }
        return rows;
    }

    private static Map<String, Object> readBody(HttpExchange exchange) throws IOException {
        byte[] body = readBytes(exchange);
        if (body.length == 0) {
            return Map.of();
        }
        Map<String, Object> values = MAPPER.readValue(body, BODY_TYPE);
        return values == null ? Map.of() : values;
    }

    /** Request body, or an empty array when it is blank. */
    private static byte[] readBytes(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        return new String(body, StandardCharsets.UTF_8).isBlank() ? new byte[0] : body;
    }

    private void handle(HttpExchange exchange, String method, HttpHandler handler) throws IOException {
        handle(exchange, Map.of(method, handler));
    }

    private void handle(HttpExchange exchange, Map<String, HttpHandler> handlers) throws IOException {
        try {
            HttpHandler handler = handlers.get(exchange.getRequestMethod().toUpperCase(Locale.ROOT));
            if (handler == null) {
                exchange.getResponseHeaders().set("Allow", String.join(", ", handlers.keySet()));
                sendError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed", List.of());
                return;
            }
            handler.handle(exchange);
        } catch (RuntimeException e) {
            LOG.error("Request {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                    e.getMessage(), e);
            sendError(exchange, 500, "Internal server error", List.of());
        } finally {
            exchange.close();
        }
    }

    private static void sendError(HttpExchange exchange, int status, String message, List<String> errors)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        if (!errors.isEmpty()) {
            body.put("errors", errors);
        }
        sendJson(exchange, status, body);
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        send(exchange, status, JSON, MAPPER.writeValueAsBytes(body));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}

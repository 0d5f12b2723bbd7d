package com.leaksentinel.server;

import com.leaksentinel.core.config.AnalysisConfig;
import com.leaksentinel.core.config.AnalysisConfigLoader;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.pipeline.AnalysisContext;
import com.leaksentinel.core.synthetic.SyntheticDataset;
import com.leaksentinel.core.synthetic.SyntheticPipelineDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point of the Leak Sentinel analysis server.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>Resolve {@link ServerConfig} from the environment</li>
 * <li>Load the default analysis configuration</li>
 * <li>Load the dataset from CSV, or generate a synthetic one</li>
 * <li>Serve the HTTP API until the JVM shuts down</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class LeakSentinelServer {

    private static final Logger LOG = LoggerFactory.getLogger(LeakSentinelServer.class);

    private LeakSentinelServer() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServerConfig config = ServerConfig.fromEnvironment();
        LOG.info("Starting Leak Sentinel with config: {}", config);

        // 2. Analysis defaults
        AnalysisConfig defaults = loadDefaults(config);

        // 3. Dataset, shared by every run until data is regenerated
        DatasetSource datasets = new DatasetSource(loadDataset(config), config.getSynthetic());

        // 4. Analysis context on a dedicated worker thread
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "analysis-worker");
            t.setDaemon(true);
            return t;
        });
        AnalysisContext context = new AnalysisContext(datasets, worker);

        // 5. HTTP server with shutdown hook
        AnalysisHttpServer server = new AnalysisHttpServer(context, defaults, datasets);
        server.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            context.cancel();
            server.stop();
            worker.shutdownNow();
        }, "server-shutdown"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static AnalysisConfig loadDefaults(ServerConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalysisConfigLoader.fromFile(path);
        }
        return AnalysisConfigLoader.load();
    }

    static SensorDataset loadDataset(ServerConfig config) {
        if (config.hasDatasetPath()) {
            return SensorCsvReader.fromFile(Path.of(config.getDatasetPath()));
        }
        SyntheticDataset synthetic = new SyntheticPipelineDataGenerator(config.getSynthetic()).generate();
        LOG.info("Generated synthetic dataset: {} pipeline(s), {} leak(s), {} operational event(s)",
                synthetic.getDataset().getSeries().size(), synthetic.getLeaks().size(),
                synthetic.getOperationalEvents().size());
        return synthetic.getDataset();
    }
}

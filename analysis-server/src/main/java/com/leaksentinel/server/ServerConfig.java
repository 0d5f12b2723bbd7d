package com.leaksentinel.server;

import com.leaksentinel.core.synthetic.SyntheticSettings;

/**
 * Typed, immutable configuration of the analysis server.
 *
 * <p>
 * Values are resolved from environment variables with defaults matching the
 * reference scenario: a synthetic day of data for 19 pipelines.
 * </p>
 *
 * <h3>Dataset source</h3>
 * <p>
 * When {@code DATASET_PATH} is set the dataset is read from that CSV file and
 * the {@code SYNTHETIC_*} variables are ignored. Otherwise a synthetic dataset
 * is generated once at startup from the synthetic settings.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServerConfig {

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    // ---------------------------------------------------------------
    // Data
    // ---------------------------------------------------------------
    private final String datasetPath;
    private final SyntheticSettings synthetic;

    // ---------------------------------------------------------------
    // Analysis defaults
    // ---------------------------------------------------------------
    private final String analysisConfigPath;

    private ServerConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.datasetPath = b.datasetPath;
        this.synthetic = b.synthetic;
        this.analysisConfigPath = b.analysisConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServerConfig fromEnvironment() {
        try {
            SyntheticSettings synthetic = SyntheticSettings.builder()
                    .seed(Long.parseLong(env("SYNTHETIC_SEED", "42")))
                    .pipelines(parseIntEnv("SYNTHETIC_PIPELINES", "19"))
                    .durationHours(Double.parseDouble(env("SYNTHETIC_HOURS", "24")))
                    .leakEvents(parseIntEnv("SYNTHETIC_LEAK_EVENTS", "12"))
                    .operationalEvents(parseIntEnv("SYNTHETIC_OPERATIONAL_EVENTS", "150"))
                    .build();
            return new Builder()
                    .httpPort(parseIntEnv("HTTP_PORT", "8080"))
                    .datasetPath(env("DATASET_PATH", ""))
                    .synthetic(synthetic)
                    .analysisConfigPath(env("ANALYSIS_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    /**
     * @return CSV dataset path, or an empty string when data is synthetic
     */
    public String getDatasetPath() {
        return datasetPath;
    }

    public boolean hasDatasetPath() {
        return !datasetPath.isBlank();
    }

    public SyntheticSettings getSynthetic() {
        return synthetic;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServerConfig}.
     *
     * <p>
     * The {@link #build()} method checks the port range ([0, 65535], where
     * {@code 0} binds an ephemeral port) and that synthetic settings are
     * present.
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String datasetPath = "";
        private SyntheticSettings synthetic = SyntheticSettings.builder().build();
        private String analysisConfigPath = "";

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder datasetPath(String v) {
            this.datasetPath = v;
            return this;
        }

        public Builder synthetic(SyntheticSettings v) {
            this.synthetic = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServerConfig build() {
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException(
                        "httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (synthetic == null) {
                throw new IllegalArgumentException("synthetic settings must not be null");
            }
            if (datasetPath == null) {
                datasetPath = "";
            }
            if (analysisConfigPath == null) {
                analysisConfigPath = "";
            }
            return new ServerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "httpPort=" + httpPort +
                ", datasetPath='" + datasetPath + '\'' +
                ", synthetic=" + synthetic +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                '}';
    }
}

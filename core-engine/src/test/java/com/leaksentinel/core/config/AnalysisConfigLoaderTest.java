package com.leaksentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.kernelType()).isEqualTo(KernelType.POLY);
        assertThat(config.getNu()).isEqualTo(0.1);
        assertThat(config.getGamma()).isEqualTo("0.25");
        assertThat(config.getWindowSize()).isEqualTo(120);
        assertThat(config.getNClusters()).isEqualTo(4);
        assertThat(config.linkageMethod()).isEqualTo(LinkageMethod.COMPLETE);
        assertThat(config.distanceMetricType()).isEqualTo(DistanceMetricType.MANHATTAN);
        assertThat(config.tieBreakRule()).isEqualTo(TieBreak.OPERATIONAL);
        // untouched keys keep their defaults
        assertThat(config.getCorrelationThreshold()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Should load shipped defaults")
    void shouldLoadDefaults() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE);

        assertThat(config).isEqualTo(new AnalysisConfig());
    }

    @Test
    @DisplayName("Should report every violation of an invalid file")
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOfSatisfying(InvalidConfigurationException.class, e ->
                        assertThat(e.getErrors()).hasSize(3))
                .hasMessageContaining("'kernel'")
                .hasMessageContaining("'nu'")
                .hasMessageContaining("ward requires");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.yml"), "# nothing here\n", StandardCharsets.UTF_8);

        assertThat(AnalysisConfigLoader.fromFile(file.toString())).isEqualTo(new AnalysisConfig());
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("dup.yml"), "nu: 0.1\nnu: 0.2\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Malformed YAML");
    }

    @Test
    @DisplayName("Should reject a document that is not a mapping")
    void shouldRejectNonMapping(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("list.yml"), "- rbf\n- linear\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("must be a mapping");
    }

    @Test
    @DisplayName("Should ignore non-string keys in a YAML document")
    void shouldIgnoreNonStringKeys(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("mixed.yml"), "nu: 0.1\n2024: archived\ntrue: flag\n",
                StandardCharsets.UTF_8);

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getNu()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should bind a mapping with untyped keys")
    void shouldBindUntypedKeys() {
        Map<Object, Object> values = new HashMap<>();
        values.put("linkage", "average");
        values.put("distance_metric", "manhattan");
        values.put(7, "ignored");

        AnalysisConfig config = AnalysisConfigLoader.fromMap(values);

        assertThat(config.getLinkage()).isEqualTo("average");
        assertThat(config.getDistanceMetric()).isEqualTo("manhattan");
    }

    @Test
    @DisplayName("Should bind flat request values and ignore unknown keys")
    void shouldBindFromMap() {
        Map<String, Object> values = new HashMap<>();
        values.put("kernel", "linear");
        values.put("gamma", 0.5);
        values.put("n_clusters", 6);
        values.put("correlation_threshold", 1.0);
        values.put("dashboard_theme", "dark");

        AnalysisConfig config = AnalysisConfigLoader.fromMap(values);

        assertThat(config.kernelType()).isEqualTo(KernelType.LINEAR);
        assertThat(config.getGamma()).isEqualTo("0.5");
        assertThat(config.getNClusters()).isEqualTo(6);
        assertThat(config.getCorrelationThreshold()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject values of the wrong type")
    void shouldRejectMalformedValues() {
        Map<String, Object> values = Map.of("nu", "lots");

        assertThatThrownBy(() -> AnalysisConfigLoader.fromMap(values))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Malformed analysis configuration");
    }
}

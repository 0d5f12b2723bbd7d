package com.leaksentinel.server;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SensorCsvReader}.
 */
class SensorCsvReaderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static SensorDataset read(String csv) {
        return SensorCsvReader.read(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should group rows by pipeline and sort them by time")
    void shouldGroupAndSort() throws IOException {
        SensorDataset dataset;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("sensors.csv")) {
            dataset = SensorCsvReader.read(in);
        }

        assertThat(dataset.getSeries()).extracting(SensorSeries::getPipelineId)
                .containsExactly("pipeline_02", "pipeline_01");

        List<Sample> first = dataset.find("pipeline_01").orElseThrow().getSamples();
        assertThat(first).extracting(Sample::getTimestamp)
                .containsExactly(T0, T0.plusSeconds(2), T0.plusSeconds(4));
        assertThat(first.get(2).getLabel()).isEqualTo(AnomalyType.LEAK);
        assertThat(first.get(2).getPressure()).isEqualTo(1.85);
        assertThat(first.get(2).hasFrequency()).isFalse();
    }

    @Test
    @DisplayName("Should accept space-separated local timestamps as UTC")
    void shouldParseLocalTimestamps() throws IOException {
        SensorDataset dataset;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("sensors.csv")) {
            dataset = SensorCsvReader.read(in);
        }

        Sample sample = dataset.find("pipeline_02").orElseThrow().getSamples().get(0);
        assertThat(sample.getTimestamp()).isEqualTo(T0);
        assertThat(sample.getLabel()).isEqualTo(AnomalyType.OPERATIONAL);
        assertThat(dataset.isFullyLabelled()).isTrue();
    }

    @Test
    @DisplayName("Should leave samples unlabelled without an anomaly_type column")
    void shouldReadUnlabelledData() {
        SensorDataset dataset = read("""
                pipeline_id,timestamp,pressure_mpa,frequency_hz
                p1,2024-01-01T00:00:00,2.0,25.0
                p1,2024-01-01T00:00:02,NaN,25.0
                """);

        List<Sample> samples = dataset.getSeries().get(0).getSamples();
        assertThat(samples).hasSize(2);
        assertThat(samples).allMatch(s -> !s.isLabelled());
        assertThat(samples.get(1).hasPressure()).isFalse();
        assertThat(dataset.isFullyLabelled()).isFalse();
    }

    @Test
    @DisplayName("Should name the line of a malformed reading")
    void shouldRejectMalformedNumber() {
        assertThatThrownBy(() -> read("""
                pipeline_id,timestamp,pressure_mpa,frequency_hz
                p1,2024-01-01T00:00:00Z,2.0,25.0
                p1,2024-01-01T00:00:02Z,abc,25.0
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pressure_mpa")
                .hasMessageContaining("line 3");
    }

    @Test
    @DisplayName("Should reject an invalid timestamp")
    void shouldRejectInvalidTimestamp() {
        assertThatThrownBy(() -> read("""
                pipeline_id,timestamp,pressure_mpa,frequency_hz
                p1,yesterday,2.0,25.0
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid timestamp 'yesterday' at line 2");
    }

    @Test
    @DisplayName("Should reject an unknown anomaly type")
    void shouldRejectUnknownLabel() {
        assertThatThrownBy(() -> read("""
                pipeline_id,timestamp,pressure_mpa,frequency_hz,anomaly_type
                p1,2024-01-01T00:00:00Z,2.0,25.0,burst
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("burst")
                .hasMessageContaining("line 2");
    }

    @Test
    @DisplayName("Should reject a row without pipeline id")
    void shouldRejectMissingPipeline() {
        assertThatThrownBy(() -> read("""
                pipeline_id,timestamp,pressure_mpa,frequency_hz
                ,2024-01-01T00:00:00Z,2.0,25.0
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing pipeline_id");
    }

    @Test
    @DisplayName("Should reject a file without rows")
    void shouldRejectEmptyFile() {
        assertThatThrownBy(() -> read("pipeline_id,timestamp,pressure_mpa,frequency_hz\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile() throws URISyntaxException {
        Path path = Path.of(getClass().getClassLoader().getResource("sensors.csv").toURI());

        assertThat(SensorCsvReader.fromFile(path).sampleCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should wrap a missing file in UncheckedIOException")
    void shouldFailForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> SensorCsvReader.fromFile(dir.resolve("absent.csv")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent.csv");
    }
}

package com.leaksentinel.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a {@link SensorDataset} from CSV.
 *
 * <h3>Format</h3>
 * <p>
 * A header row naming at least {@code pipeline_id}, {@code timestamp},
 * {@code pressure_mpa} and {@code frequency_hz}; an {@code anomaly_type}
 * column ({@code normal}, {@code leak}, {@code operational}) is optional and
 * other columns are ignored. Blank readings become {@link Double#NaN}.
 * Timestamps are ISO-8601 date-times; without an offset
 * ({@code 2024-01-01T00:00:00} or {@code 2024-01-01 00:00:00}) they are taken
 * as UTC.
 * </p>
 *
 * <p>
 * Rows are grouped by pipeline in order of first appearance and sorted by
 * time within each pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(SensorCsvReader.class);

    private static final ObjectReader READER;

    static {
        CsvMapper mapper = new CsvMapper();
        READER = mapper.readerFor(Row.class).with(CsvSchema.emptySchema().withHeader());
    }

    private SensorCsvReader() {
        // utility class, not instantiable
    }

    /**
     * @param path CSV file
     * @return the parsed dataset
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalArgumentException if a row is malformed or the file has
     *                                  no rows
     */
    public static SensorDataset fromFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            SensorDataset dataset = read(in);
            LOG.info("Loaded {} samples for {} pipeline(s) from {}", dataset.sampleCount(),
                    dataset.getSeries().size(), path);
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset file: " + path, e);
        }
    }

    /**
     * @param in CSV content; not closed
     * @return the parsed dataset
     * @throws UncheckedIOException     if the stream cannot be read
     * @throws IllegalArgumentException if a row is malformed or there are no
     *                                  rows
     */
    public static SensorDataset read(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        Map<String, List<Sample>> byPipeline = new LinkedHashMap<>();
        try (MappingIterator<Row> rows = READER.readValues(in)) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                Row row = rows.next();
                Sample sample = toSample(row, line);
                byPipeline.computeIfAbsent(row.pipelineId.trim(), k -> new ArrayList<>()).add(sample);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV dataset", e);
        }
        if (byPipeline.isEmpty()) {
            throw new IllegalArgumentException("CSV dataset contains no rows");
        }

        List<SensorSeries> series = new ArrayList<>(byPipeline.size());
        for (Map.Entry<String, List<Sample>> entry : byPipeline.entrySet()) {
            List<Sample> samples = entry.getValue();
            samples.sort(Comparator.comparing(Sample::getTimestamp));
            series.add(new SensorSeries(entry.getKey(), samples));
        }
        return new SensorDataset(series);
    }

    // ---------------------------------------------------------------
    // Row conversion
    // ---------------------------------------------------------------

    private static Sample toSample(Row row, int line) {
        if (row.pipelineId == null || row.pipelineId.isBlank()) {
            throw new IllegalArgumentException("Missing pipeline_id at line " + line);
        }
        if (row.timestamp == null || row.timestamp.isBlank()) {
            throw new IllegalArgumentException("Missing timestamp at line " + line);
        }
        AnomalyType label = null;
        if (row.anomalyType != null && !row.anomalyType.isBlank()) {
            try {
                label = AnomalyType.fromWire(row.anomalyType);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(e.getMessage() + " at line " + line, e);
            }
        }
        return new Sample(parseTimestamp(row.timestamp.trim(), line),
                parseReading(row.pressure, "pressure_mpa", line),
                parseReading(row.frequency, "frequency_hz", line),
                label);
    }

    static Instant parseTimestamp(String value, int line) {
        String normalized = value.length() > 10 && value.charAt(10) == ' '
                ? value.substring(0, 10) + 'T' + value.substring(11)
                : value;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized,
                    ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp '" + value + "' at line " + line, e);
        }
    }

    private static double parseReading(String value, String column, int line) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid " + column + " value '" + value + "' at line " + line, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Row {

        @JsonProperty("pipeline_id")
        String pipelineId;

        @JsonProperty("timestamp")
        String timestamp;

        @JsonProperty("pressure_mpa")
        String pressure;

        @JsonProperty("frequency_hz")
        String frequency;

        @JsonProperty("anomaly_type")
        String anomalyType;
    }
}

package com.leaksentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorSeries;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Writes the per-reading classification of a completed run as CSV.
 *
 * <pre>
 * pipeline_id,time,pressure,frequency,is_anomaly,anomaly_type
 * P-01,2024-01-01T00:00:00Z,2.01,25.3,false,normal
 * </pre>
 *
 * <p>
 * {@code is_anomaly} marks readings of windows flagged by the boundary
 * classifier; {@code anomaly_type} is {@code leak} for final anomalies,
 * {@code operational} for excluded ones and {@code normal} otherwise. Only
 * raw readings are written, never padding.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultExporter {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final ObjectWriter WRITER = CSV_MAPPER
            .writerFor(Row.class)
            .with(CSV_MAPPER.schemaFor(Row.class).withHeader())
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    private ResultExporter() {
        // utility class, not instantiable
    }

    /**
     * @param result a completed run
     * @param out    destination; not closed
     * @throws UncheckedIOException if writing fails
     */
    public static void writeCsv(AnalysisResult result, Writer out) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(out, "out must not be null");
        SamplePredictions predictions = new SamplePredictions(result.getWindows(), result.getClassifications());
        try (SequenceWriter sequence = WRITER.writeValues(out)) {
            for (SensorSeries series : result.getDataset().getSeries()) {
                for (Sample sample : series.getSamples()) {
                    AnomalyType predicted = predictions.predict(series.getPipelineId(), sample);
                    sequence.write(new Row(series.getPipelineId(), sample, predicted));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export", e);
        }
    }

    public static String toCsv(AnalysisResult result) {
        StringWriter writer = new StringWriter();
        writeCsv(result, writer);
        return writer.toString();
    }

    @JsonPropertyOrder({ "pipeline_id", "time", "pressure", "frequency", "is_anomaly", "anomaly_type" })
    static final class Row {

        @JsonProperty("pipeline_id")
        final String pipelineId;

        @JsonProperty("time")
        final String time;

        @JsonProperty("pressure")
        final Double pressure;

        @JsonProperty("frequency")
        final Double frequency;

        @JsonProperty("is_anomaly")
        final boolean anomaly;

        @JsonProperty("anomaly_type")
        final String anomalyType;

        Row(String pipelineId, Sample sample, AnomalyType predicted) {
            this.pipelineId = pipelineId;
            this.time = sample.getTimestamp().toString();
            this.pressure = sample.hasPressure() ? sample.getPressure() : null;
            this.frequency = sample.hasFrequency() ? sample.getFrequency() : null;
            this.anomaly = predicted != AnomalyType.NORMAL;
            this.anomalyType = predicted.wireName();
        }
    }
}

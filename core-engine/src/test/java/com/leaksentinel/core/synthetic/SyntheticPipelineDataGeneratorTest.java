package com.leaksentinel.core.synthetic;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorSeries;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SyntheticPipelineDataGenerator}.
 */
class SyntheticPipelineDataGeneratorTest {

    private static SyntheticSettings settings;
    private static SyntheticDataset data;

    @BeforeAll
    static void generate() {
        settings = SyntheticSettings.builder()
                .pipelines(4).durationHours(12).leakEvents(3).operationalEvents(30).seed(5).build();
        data = new SyntheticPipelineDataGenerator(settings).generate();
    }

    @Test
    @DisplayName("Should produce the configured shape")
    void shouldProduceConfiguredShape() {
        assertThat(data.getDataset().getSeries()).extracting(SensorSeries::getPipelineId)
                .containsExactly("pipeline_01", "pipeline_02", "pipeline_03", "pipeline_04");
        assertThat(data.getDataset().getSeries()).allMatch(s -> s.size() == 21_600);
        assertThat(data.getDataset().isFullyLabelled()).isTrue();
        assertThat(data.getLeaks()).hasSize(3);
        assertThat(data.getOperationalEvents()).hasSize(30);
        assertThat(data.getDataset().getSeries().get(0).getSamples().get(1).getTimestamp())
                .isEqualTo(SyntheticSettings.DEFAULT_ORIGIN.plusSeconds(2));
    }

    @Test
    @DisplayName("Should be reproducible for a given seed")
    void shouldBeDeterministic() {
        SyntheticDataset again = new SyntheticPipelineDataGenerator(settings).generate();
        SyntheticDataset other = new SyntheticPipelineDataGenerator(SyntheticSettings.builder()
                .pipelines(4).durationHours(12).leakEvents(3).operationalEvents(30).seed(6).build()).generate();

        assertThat(again.getDataset().fingerprint()).isEqualTo(data.getDataset().fingerprint());
        assertThat(again.getEvents()).extracting(InjectedEvent::getStart)
                .containsExactlyElementsOf(data.getEvents().stream().map(InjectedEvent::getStart)
                        .collect(Collectors.toList()));
        assertThat(other.getDataset().fingerprint()).isNotEqualTo(data.getDataset().fingerprint());
    }

    @Test
    @DisplayName("Should place leaks within duration limits and away from the edges")
    void shouldPlaceLeaks() {
        Instant origin = settings.getOrigin();
        Instant end = origin.plusSeconds(12 * 3600);
        for (InjectedEvent leak : data.getLeaks()) {
            Duration length = Duration.between(leak.getStart(), leak.getEnd());
            assertThat(length).isBetween(Duration.ofMinutes(30), Duration.ofMinutes(120));
            assertThat(leak.getStart()).isAfterOrEqualTo(origin.plusSeconds(3600));
            assertThat(leak.getEnd()).isBeforeOrEqualTo(end.minusSeconds(3600));
            assertThat(leak.getType()).isEqualTo(AnomalyType.LEAK);
        }
    }

    @Test
    @DisplayName("Should never overlap events and keep leaks clear of other anomalies")
    void shouldKeepEventsApart() {
        List<InjectedEvent> events = data.getEvents();
        for (int i = 0; i < events.size(); i++) {
            for (int j = i + 1; j < events.size(); j++) {
                InjectedEvent a = events.get(i);
                InjectedEvent b = events.get(j);
                if (!a.getPipelineId().equals(b.getPipelineId())) {
                    continue;
                }
                long margin = a.isLeak() || b.isLeak() ? 600 : 0;
                boolean apart = !a.getEnd().plusSeconds(margin).isAfter(b.getStart())
                        || !b.getEnd().plusSeconds(margin).isAfter(a.getStart());
                assertThat(apart).as("%s vs %s", a, b).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Should label readings inside events with the event type")
    void shouldLabelEventReadings() {
        for (InjectedEvent event : data.getEvents()) {
            SensorSeries series = data.getDataset().find(event.getPipelineId()).orElseThrow();
            List<Sample> inside = series.getSamples().stream()
                    .filter(s -> !s.getTimestamp().isBefore(event.getStart())
                            && s.getTimestamp().isBefore(event.getEnd()))
                    .collect(Collectors.toList());
            assertThat(inside).isNotEmpty().allMatch(s -> s.getLabel() == event.getType());
        }
        long labelledAnomalies = data.getDataset().getSeries().stream()
                .flatMap(s -> s.getSamples().stream())
                .filter(s -> s.getLabel() != AnomalyType.NORMAL)
                .count();
        long eventSamples = data.getEvents().stream()
                .mapToLong(e -> Duration.between(e.getStart(), e.getEnd()).getSeconds() / 2)
                .sum();
        assertThat(labelledAnomalies).isEqualTo(eventSamples);
    }

    @Test
    @DisplayName("Should lower pressure during leaks")
    void shouldDropPressureDuringLeaks() {
        for (InjectedEvent leak : data.getLeaks()) {
            SensorSeries series = data.getDataset().find(leak.getPipelineId()).orElseThrow();
            double inside = series.getSamples().stream()
                    .filter(s -> s.getLabel() == AnomalyType.LEAK
                            && !s.getTimestamp().isBefore(leak.getStart()) && s.getTimestamp().isBefore(leak.getEnd()))
                    .mapToDouble(Sample::getPressure).average().orElseThrow();
            double before = series.getSamples().stream()
                    .filter(s -> s.getTimestamp().isBefore(leak.getStart())
                            && s.getTimestamp().isAfter(leak.getStart().minusSeconds(600)))
                    .mapToDouble(Sample::getPressure).average().orElseThrow();
            assertThat(inside).isLessThan(before - 0.1);
        }
    }

    @Test
    @DisplayName("Should refuse settings that cannot hold the requested leaks")
    void shouldRejectImpossibleSettings() {
        SyntheticSettings tooShort = SyntheticSettings.builder()
                .pipelines(1).durationHours(3).leakEvents(5).operationalEvents(0).build();

        assertThatThrownBy(() -> new SyntheticPipelineDataGenerator(tooShort).generate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Could not place leak");
    }

    @Test
    @DisplayName("Should validate settings")
    void shouldValidateSettings() {
        assertThatThrownBy(() -> SyntheticSettings.builder().pipelines(0).leakEvents(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pipelines")
                .hasMessageContaining("leakEvents");
    }
}

package com.leaksentinel.core.synthetic;

import com.leaksentinel.core.model.SensorDataset;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Labelled dataset together with the events injected into it.
 *
 * @since 1.0.0
 */
public final class SyntheticDataset {

    private final SensorDataset dataset;
    private final List<InjectedEvent> events;

    SyntheticDataset(SensorDataset dataset, List<InjectedEvent> events) {
        this.dataset = Objects.requireNonNull(dataset, "dataset must not be null");
        this.events = Collections.unmodifiableList(events);
    }

    public SensorDataset getDataset() {
        return dataset;
    }

    public List<InjectedEvent> getEvents() {
        return events;
    }

    public List<InjectedEvent> getLeaks() {
        return events.stream().filter(InjectedEvent::isLeak).collect(Collectors.toList());
    }

    public List<InjectedEvent> getOperationalEvents() {
        return events.stream().filter(e -> !e.isLeak()).collect(Collectors.toList());
    }
}

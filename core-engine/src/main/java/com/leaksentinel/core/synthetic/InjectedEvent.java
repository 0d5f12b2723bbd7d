package com.leaksentinel.core.synthetic;

import com.leaksentinel.core.model.AnomalyType;

import java.time.Instant;
import java.util.Objects;

/**
 * One anomaly written into a synthetic series, covering {@code [start, end)}.
 *
 * @since 1.0.0
 */
public final class InjectedEvent {

    /** What happened to the pipeline. */
    public enum Kind {
        LEAK(AnomalyType.LEAK),
        PUMP_SPEED_CHANGE(AnomalyType.OPERATIONAL),
        VALVE_OPERATION(AnomalyType.OPERATIONAL),
        PUMP_STOP(AnomalyType.OPERATIONAL);

        private final AnomalyType type;

        Kind(AnomalyType type) {
            this.type = type;
        }

        public AnomalyType type() {
            return type;
        }
    }

    private final String pipelineId;
    private final Kind kind;
    private final Instant start;
    private final Instant end;

    public InjectedEvent(String pipelineId, Kind kind, Instant start, Instant end) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public Kind getKind() {
        return kind;
    }

    public AnomalyType getType() {
        return kind.type();
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean isLeak() {
        return kind == Kind.LEAK;
    }

    @Override
    public String toString() {
        return "InjectedEvent{" + pipelineId + ", " + kind + ", " + start + " -> " + end + '}';
    }
}

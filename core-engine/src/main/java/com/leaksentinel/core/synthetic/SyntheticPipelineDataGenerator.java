package com.leaksentinel.core.synthetic;

import com.leaksentinel.core.model.AnomalyType;
import com.leaksentinel.core.model.Sample;
import com.leaksentinel.core.model.SensorDataset;
import com.leaksentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Produces labelled pressure and pump-frequency series with injected leaks
 * and operational events.
 *
 * <h3>Signals</h3>
 * <p>
 * Normal pressure oscillates daily and hourly around 2 MPa; pump frequency
 * follows a semi-daily cycle around 25 Hz. Each pipeline gets its own phases.
 * </p>
 *
 * <h3>Events</h3>
 * <ul>
 *   <li>Leaks last 30 to 120 minutes, stay out of the first and last hour and
 *       keep 10 minutes of clearance from any other anomaly. Pressure drops by
 *       0.5 to 0.9 MPa over the first quarter of the event and both signals
 *       become turbulent.</li>
 *   <li>Operational events last 5 to 30 minutes, never overlap another event
 *       and respect the leak clearance: pump speed changes, valve operations
 *       and pump stops.</li>
 * </ul>
 *
 * <p>
 * All randomness comes from one {@link Random} seeded from the settings, so
 * equal settings give equal datasets.
 * </p>
 *
 * @since 1.0.0
 */
public class SyntheticPipelineDataGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticPipelineDataGenerator.class);

    private static final int LEAK_PLACEMENT_ATTEMPTS = 10_000;
    private static final int OPERATIONAL_PLACEMENT_ATTEMPTS = 100_000;
    private static final int LEAK_CLEARANCE_SECONDS = 600;
    private static final int EDGE_MARGIN_SECONDS = 3600;

    private final SyntheticSettings settings;

    public SyntheticPipelineDataGenerator(SyntheticSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * @return the generated dataset and its events
     * @throws IllegalArgumentException if the requested events do not fit
     *                                  into the configured duration
     */
    public SyntheticDataset generate() {
        Random rnd = new Random(settings.getSeed());
        int n = settings.samplesPerPipeline();
        int step = settings.getSamplingRateSeconds();
        int pipelines = settings.getPipelines();

        double[][] pressure = new double[pipelines][n];
        double[][] frequency = new double[pipelines][n];
        AnomalyType[][] labels = new AnomalyType[pipelines][n];
        for (int p = 0; p < pipelines; p++) {
            fillNormal(rnd, pressure[p], frequency[p], labels[p], step);
        }

        List<InjectedEvent> events = new ArrayList<>();
        for (int e = 0; e < settings.getLeakEvents(); e++) {
            events.add(injectLeak(rnd, pressure, frequency, labels, step));
        }
        for (int e = 0; e < settings.getOperationalEvents(); e++) {
            events.add(injectOperational(rnd, pressure, frequency, labels, step));
        }

        List<SensorSeries> series = new ArrayList<>(pipelines);
        for (int p = 0; p < pipelines; p++) {
            List<Sample> samples = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                samples.add(new Sample(timeAt(i), pressure[p][i], frequency[p][i], labels[p][i]));
            }
            series.add(new SensorSeries(pipelineId(p), samples));
        }
        LOG.info("Generated {} pipeline(s) x {} sample(s) with {} leak(s) and {} operational event(s) (seed={})",
                pipelines, n, settings.getLeakEvents(), settings.getOperationalEvents(), settings.getSeed());
        return new SyntheticDataset(new SensorDataset(series), events);
    }

    static String pipelineId(int index) {
        return String.format(Locale.ROOT, "pipeline_%02d", index + 1);
    }

    // ---------------------------------------------------------------
    // Normal operation
    // ---------------------------------------------------------------

    private static void fillNormal(Random rnd, double[] pressure, double[] frequency, AnomalyType[] labels,
            int step) {
        double dailyPhase = rnd.nextDouble() * 2 * Math.PI;
        double hourlyPhase = rnd.nextDouble() * 2 * Math.PI;
        double pumpPhase = rnd.nextDouble() * 2 * Math.PI;
        for (int i = 0; i < pressure.length; i++) {
            double hours = i * step / 3600.0;
            pressure[i] = 2.0
                    + 0.3 * Math.sin(2 * Math.PI * hours / 24 + dailyPhase)
                    + 0.1 * Math.sin(2 * Math.PI * hours + hourlyPhase)
                    + rnd.nextGaussian() * 0.05;
            frequency[i] = 25.0
                    + 3.0 * Math.sin(2 * Math.PI * hours / 12 + pumpPhase)
                    + rnd.nextGaussian() * 0.5;
        }
        Arrays.fill(labels, AnomalyType.NORMAL);
    }

    // ---------------------------------------------------------------
    // Leaks
    // ---------------------------------------------------------------

    private InjectedEvent injectLeak(Random rnd, double[][] pressure, double[][] frequency,
            AnomalyType[][] labels, int step) {
        int n = pressure[0].length;
        int margin = EDGE_MARGIN_SECONDS / step;
        int clearance = LEAK_CLEARANCE_SECONDS / step;
        for (int attempt = 0; attempt < LEAK_PLACEMENT_ATTEMPTS; attempt++) {
            int p = rnd.nextInt(pressure.length);
            int duration = Math.max(1, (1800 + rnd.nextInt(5401)) / step);
            int latest = n - duration - margin;
            if (latest <= margin) {
                continue;
            }
            int start = margin + rnd.nextInt(latest - margin + 1);
            if (!isClear(labels[p], start - clearance, start + duration + clearance)) {
                continue;
            }

            double drop = 0.5 + 0.4 * rnd.nextDouble();
            for (int i = 0; i < duration; i++) {
                int t = start + i;
                double progress = (double) i / duration;
                pressure[p][t] -= drop * Math.min(1.0, progress / 0.25);
                pressure[p][t] += rnd.nextGaussian() * 0.12;
                frequency[p][t] += rnd.nextGaussian() * 0.3;
                labels[p][t] = AnomalyType.LEAK;
            }
            LOG.debug("Injected leak on {} at sample {} for {} sample(s), drop {} MPa",
                    pipelineId(p), start, duration, drop);
            return new InjectedEvent(pipelineId(p), InjectedEvent.Kind.LEAK, timeAt(start),
                    timeAt(start + duration));
        }
        throw new IllegalArgumentException("Could not place leak event within " + LEAK_PLACEMENT_ATTEMPTS
                + " attempts; reduce leakEvents or extend durationHours (" + settings + ")");
    }

    // ---------------------------------------------------------------
    // Operational events
    // ---------------------------------------------------------------

    private InjectedEvent injectOperational(Random rnd, double[][] pressure, double[][] frequency,
            AnomalyType[][] labels, int step) {
        int n = pressure[0].length;
        int clearance = LEAK_CLEARANCE_SECONDS / step;
        for (int attempt = 0; attempt < OPERATIONAL_PLACEMENT_ATTEMPTS; attempt++) {
            int p = rnd.nextInt(pressure.length);
            int duration = Math.max(1, (300 + rnd.nextInt(1501)) / step);
            if (n - duration - 1 < 0) {
                continue;
            }
            int start = rnd.nextInt(n - duration);
            if (!isClear(labels[p], start, start + duration)
                    || containsLeak(labels[p], start - clearance, start + duration + clearance)) {
                continue;
            }

            InjectedEvent.Kind kind;
            double roll = rnd.nextDouble();
            double sign = rnd.nextBoolean() ? 1.0 : -1.0;
            if (roll < 0.45) {
                kind = InjectedEvent.Kind.PUMP_SPEED_CHANGE;
                double df = sign * (4 + 2 * rnd.nextDouble());
                double dp = sign * (0.2 + 0.15 * rnd.nextDouble());
                shift(pressure[p], frequency[p], start, duration, dp, df);
            } else if (roll < 0.75) {
                kind = InjectedEvent.Kind.VALVE_OPERATION;
                double dp = sign * (0.25 + 0.2 * rnd.nextDouble());
                double df = -sign * (1 + rnd.nextDouble());
                shift(pressure[p], frequency[p], start, duration, dp, df);
            } else {
                kind = InjectedEvent.Kind.PUMP_STOP;
                double dp = -(0.3 + 0.2 * rnd.nextDouble());
                for (int t = start; t < start + duration; t++) {
                    pressure[p][t] += dp;
                    frequency[p][t] = rnd.nextGaussian() * 0.05;
                }
            }
            Arrays.fill(labels[p], start, start + duration, AnomalyType.OPERATIONAL);
            return new InjectedEvent(pipelineId(p), kind, timeAt(start), timeAt(start + duration));
        }
        throw new IllegalArgumentException("Could not place operational event within "
                + OPERATIONAL_PLACEMENT_ATTEMPTS + " attempts; reduce operationalEvents or extend durationHours ("
                + settings + ")");
    }

    private static void shift(double[] pressure, double[] frequency, int start, int duration, double dp,
            double df) {
        for (int t = start; t < start + duration; t++) {
            pressure[t] += dp;
            frequency[t] += df;
        }
    }

    /** True when every label in {@code [from, to)}, clamped to the series, is normal. */
    private static boolean isClear(AnomalyType[] labels, int from, int to) {
        int lo = Math.max(0, from);
        int hi = Math.min(labels.length, to);
        for (int t = lo; t < hi; t++) {
            if (labels[t] != AnomalyType.NORMAL) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsLeak(AnomalyType[] labels, int from, int to) {
        int lo = Math.max(0, from);
        int hi = Math.min(labels.length, to);
        for (int t = lo; t < hi; t++) {
            if (labels[t] == AnomalyType.LEAK) {
                return true;
            }
        }
        return false;
    }

    private Instant timeAt(int index) {
        return settings.getOrigin().plusSeconds((long) index * settings.getSamplingRateSeconds());
    }
}

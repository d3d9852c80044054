package biz.kryukov.dev.healthprobe.metrics;

import biz.kryukov.dev.healthprobe.FailureCategory;
import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;
import biz.kryukov.dev.healthprobe.ProbeDefinition;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports probe results to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code app_health_probe_status}: Gauge (enum pattern, one series per status)</li>
 *   <li>{@code app_health_probe_duration_seconds}: Histogram</li>
 *   <li>{@code app_health_probe_timeouts_total}: Counter</li>
 *   <li>{@code app_health_probe_errors_total}: Counter</li>
 * </ul>
 */
public final class ProbeMetrics {

    static final String STATUS_METRIC = "app_health_probe_status";
    static final String DURATION_METRIC = "app_health_probe_duration_seconds";
    static final String TIMEOUTS_METRIC = "app_health_probe_timeouts_total";
    static final String ERRORS_METRIC = "app_health_probe_errors_total";

    private static final double[] DURATION_SLOS = {0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0};

    private final MeterRegistry registry;
    private final Map<String, ProbeMeters> meters = new ConcurrentHashMap<>();

    public ProbeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one settled execution: status gauges, duration and failure counters.
     */
    public void record(ProbeDefinition definition, HealthCheckResult result) {
        ProbeMeters m = meters.computeIfAbsent(definition.name(), k -> register(definition));
        HealthStatus[] statuses = HealthStatus.values();
        for (int i = 0; i < statuses.length; i++) {
            m.status()[i].set(statuses[i] == result.status() ? 1.0 : 0.0);
        }
        m.duration().record(result.duration().toNanos() / 1_000_000_000.0);

        Object failure = result.metadata().get(FailureCategory.METADATA_KEY);
        if (FailureCategory.TIMEOUT.equals(failure)) {
            m.timeouts().increment();
        } else if (failure != null) {
            m.errors().increment();
        }
    }

    /**
     * Removes every series of a probe.
     */
    public void delete(String name) {
        ProbeMeters m = meters.remove(name);
        if (m != null) {
            m.all().forEach(registry::remove);
        }
    }

    Tags buildTags(ProbeDefinition definition) {
        return Tags.of(
                "probe", definition.name(),
                "critical", definition.critical() ? "yes" : "no"
        );
    }

    @SuppressWarnings("unchecked")
    private ProbeMeters register(ProbeDefinition definition) {
        Tags tags = buildTags(definition);
        List<Meter> all = new ArrayList<>();

        HealthStatus[] statuses = HealthStatus.values();
        AtomicReference<Double>[] status = new AtomicReference[statuses.length];
        for (int i = 0; i < statuses.length; i++) {
            status[i] = new AtomicReference<>(0.0);
            all.add(Gauge.builder(STATUS_METRIC, status[i], AtomicReference::get)
                    .description("Status of the last probe result (1 for the current status)")
                    .tags(tags.and("status", statuses[i].label()))
                    .register(registry));
        }
        DistributionSummary duration = DistributionSummary.builder(DURATION_METRIC)
                .description("Duration of health probe executions in seconds")
                .tags(tags)
                .serviceLevelObjectives(DURATION_SLOS)
                .register(registry);
        Counter timeouts = Counter.builder(TIMEOUTS_METRIC)
                .description("Probe executions that hit their timeout")
                .tags(tags)
                .register(registry);
        Counter errors = Counter.builder(ERRORS_METRIC)
                .description("Probe executions that failed with an error")
                .tags(tags)
                .register(registry);
        all.add(duration);
        all.add(timeouts);
        all.add(errors);
        return new ProbeMeters(status, duration, timeouts, errors, List.copyOf(all));
    }

    private record ProbeMeters(AtomicReference<Double>[] status, DistributionSummary duration,
                               Counter timeouts, Counter errors, List<Meter> all) {}
}

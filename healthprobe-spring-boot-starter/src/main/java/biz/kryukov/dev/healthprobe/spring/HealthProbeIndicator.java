package biz.kryukov.dev.healthprobe.spring;

import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthManager;
import biz.kryukov.dev.healthprobe.HealthStatus;
import biz.kryukov.dev.healthprobe.OverallHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot Actuator HealthIndicator: maps the aggregate probe health onto Actuator
 * statuses. Healthy is UP, degraded is {@link #DEGRADED}, unhealthy is DOWN.
 */
public class HealthProbeIndicator implements HealthIndicator {

    /** Actuator status for a degraded system. */
    public static final Status DEGRADED = new Status("DEGRADED");

    private final HealthManager healthManager;

    /**
     * @param healthManager the HealthManager instance to monitor
     */
    public HealthProbeIndicator(HealthManager healthManager) {
        this.healthManager = healthManager;
    }

    @Override
    public Health health() {
        OverallHealth overall = healthManager.getOverallHealth();

        Health.Builder builder = Health.status(toStatus(overall.status()));
        builder.withDetail("summary", Map.of(
                "total", overall.summary().total(),
                "healthy", overall.summary().healthy(),
                "degraded", overall.summary().degraded(),
                "unhealthy", overall.summary().unhealthy()));

        overall.checks().forEach((name, result) -> builder.withDetail(name, describe(result)));

        return builder.build();
    }

    static Status toStatus(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> Status.UP;
            case DEGRADED -> DEGRADED;
            case UNHEALTHY -> Status.DOWN;
        };
    }

    private static Map<String, Object> describe(HealthCheckResult result) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", result.status().label());
        detail.put("durationMs", result.durationMillis());
        detail.put("timestamp", result.timestamp().toString());
        if (result.message() != null) {
            detail.put("message", result.message());
        }
        if (result.classification() != null) {
            detail.put("classification", result.classification());
        }
        return detail;
    }
}

package biz.kryukov.dev.healthprobe;

import java.util.Map;
import java.util.Objects;

/**
 * System-wide health derived from the latest result of every probe. Never stored.
 *
 * @param status  aggregate status
 * @param summary counts by status
 * @param checks  latest result per probe name (unmodifiable, sorted by name)
 */
public record OverallHealth(HealthStatus status, HealthSummary summary,
                            Map<String, HealthCheckResult> checks) {

    public OverallHealth {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(checks, "checks");
    }
}

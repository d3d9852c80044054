package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.BlockingHealthProbe;
import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import java.util.Locale;

/**
 * Heap usage probe: unhealthy above 90%, degraded above 75%.
 */
public final class MemoryProbe implements BlockingHealthProbe {

    static final double UNHEALTHY_PERCENT = 90.0;
    static final double DEGRADED_PERCENT = 75.0;

    private static final long MB = 1024 * 1024;

    private final MemoryMetrics memory;

    public MemoryProbe(MemoryMetrics memory) {
        this.memory = memory;
    }

    @Override
    public HealthCheckResult checkBlocking() {
        long used = memory.usedBytes();
        long total = memory.totalBytes();
        if (total <= 0) {
            return HealthCheckResult.degraded(InfrastructureProbes.MEMORY,
                    "Memory usage unavailable");
        }
        double usagePercent = used * 100.0 / total;

        HealthStatus status;
        if (usagePercent > UNHEALTHY_PERCENT) {
            status = HealthStatus.UNHEALTHY;
        } else if (usagePercent > DEGRADED_PERCENT) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        long usedMB = Math.round((double) used / MB);
        long totalMB = Math.round((double) total / MB);
        return HealthCheckResult.builder(InfrastructureProbes.MEMORY, status)
                .message(String.format(Locale.ROOT, "Memory usage: %dMB / %dMB (%.1f%%)",
                        usedMB, totalMB, usagePercent))
                .metadata("usedMB", usedMB)
                .metadata("totalMB", totalMB)
                .metadata("usagePercent", usagePercent)
                .build();
    }
}

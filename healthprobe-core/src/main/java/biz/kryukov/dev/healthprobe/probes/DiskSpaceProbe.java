package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.BlockingHealthProbe;
import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import java.io.IOException;
import java.util.Locale;

/**
 * Free disk space probe: unhealthy below 10% free, degraded below 20%.
 */
public final class DiskSpaceProbe implements BlockingHealthProbe {

    static final double UNHEALTHY_FREE_PERCENT = 10.0;
    static final double DEGRADED_FREE_PERCENT = 20.0;

    private static final long MB = 1024 * 1024;

    private final DiskMetrics disk;

    public DiskSpaceProbe(DiskMetrics disk) {
        this.disk = disk;
    }

    /**
     * @throws IOException if the file store cannot be read; reported as unhealthy
     */
    @Override
    public HealthCheckResult checkBlocking() throws IOException {
        long usable = disk.usableBytes();
        long total = disk.totalBytes();
        if (total <= 0) {
            return HealthCheckResult.degraded(InfrastructureProbes.DISK_SPACE,
                    "Disk space unavailable");
        }
        double freeSpacePercent = usable * 100.0 / total;

        HealthStatus status;
        if (freeSpacePercent < UNHEALTHY_FREE_PERCENT) {
            status = HealthStatus.UNHEALTHY;
        } else if (freeSpacePercent < DEGRADED_FREE_PERCENT) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        return HealthCheckResult.builder(InfrastructureProbes.DISK_SPACE, status)
                .message(String.format(Locale.ROOT, "Free disk space: %.1f%%", freeSpacePercent))
                .metadata("freeSpacePercent", freeSpacePercent)
                .metadata("freeMB", usable / MB)
                .metadata("totalMB", total / MB)
                .build();
    }
}

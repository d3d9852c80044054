package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DiskSpaceProbeTest {

    private static final long MB = 1024 * 1024;

    private static DiskMetrics fixed(long usableMb, long totalMb) {
        return new DiskMetrics() {
            @Override
            public long usableBytes() {
                return usableMb * MB;
            }

            @Override
            public long totalBytes() {
                return totalMb * MB;
            }
        };
    }

    @Test
    void healthyWithPlentyFree() throws Exception {
        HealthCheckResult result = new DiskSpaceProbe(fixed(500, 1000)).checkBlocking();

        assertEquals(InfrastructureProbes.DISK_SPACE, result.name());
        assertEquals(HealthStatus.HEALTHY, result.status());
        assertEquals("Free disk space: 50.0%", result.message());
        assertEquals(500L, result.metadata().get("freeMB"));
        assertEquals(1000L, result.metadata().get("totalMB"));
    }

    @Test
    void thresholds() throws Exception {
        assertEquals(HealthStatus.DEGRADED, new DiskSpaceProbe(fixed(150, 1000)).checkBlocking().status());
        assertEquals(HealthStatus.HEALTHY, new DiskSpaceProbe(fixed(200, 1000)).checkBlocking().status());
        assertEquals(HealthStatus.UNHEALTHY, new DiskSpaceProbe(fixed(50, 1000)).checkBlocking().status());
        assertEquals(HealthStatus.DEGRADED, new DiskSpaceProbe(fixed(100, 1000)).checkBlocking().status());
    }

    @Test
    void unreadableStorePropagates() {
        DiskMetrics broken = new DiskMetrics() {
            @Override
            public long usableBytes() throws IOException {
                throw new IOException("no such file store");
            }

            @Override
            public long totalBytes() throws IOException {
                throw new IOException("no such file store");
            }
        };

        assertThrows(IOException.class, () -> new DiskSpaceProbe(broken).checkBlocking());
    }

    @Test
    void realFileStore(@TempDir Path dir) throws Exception {
        HealthCheckResult result = new DiskSpaceProbe(DiskMetrics.forPath(dir)).checkBlocking();

        assertNotNull(result.metadata().get("freeSpacePercent"));
    }
}

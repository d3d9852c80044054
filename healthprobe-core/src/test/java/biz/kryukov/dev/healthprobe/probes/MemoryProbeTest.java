package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryProbeTest {

    private static final long MB = 1024 * 1024;

    private static HealthCheckResult check(long usedMb, long totalMb) {
        MemoryMetrics fixed = new MemoryMetrics() {
            @Override
            public long usedBytes() {
                return usedMb * MB;
            }

            @Override
            public long totalBytes() {
                return totalMb * MB;
            }
        };
        return new MemoryProbe(fixed).checkBlocking();
    }

    @Test
    void healthyBelowThreshold() {
        HealthCheckResult result = check(256, 1024);

        assertEquals(InfrastructureProbes.MEMORY, result.name());
        assertEquals(HealthStatus.HEALTHY, result.status());
        assertEquals("Memory usage: 256MB / 1024MB (25.0%)", result.message());
        assertEquals(256L, result.metadata().get("usedMB"));
        assertEquals(1024L, result.metadata().get("totalMB"));
        assertEquals(25.0, (Double) result.metadata().get("usagePercent"), 1e-9);
    }

    @Test
    void degradedAbove75Percent() {
        assertEquals(HealthStatus.DEGRADED, check(800, 1000).status());
        assertEquals(HealthStatus.HEALTHY, check(750, 1000).status());
    }

    @Test
    void unhealthyAbove90Percent() {
        assertEquals(HealthStatus.UNHEALTHY, check(950, 1000).status());
        assertEquals(HealthStatus.DEGRADED, check(900, 1000).status());
    }

    @Test
    void unknownLimit() {
        assertEquals(HealthStatus.DEGRADED, check(10, 0).status());
    }

    @Test
    void jvmMetricsAreSane() {
        MemoryMetrics jvm = MemoryMetrics.jvm();

        assertTrue(jvm.totalBytes() > 0);
        assertTrue(jvm.usedBytes() > 0);
    }
}

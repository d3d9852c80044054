package biz.kryukov.dev.healthprobe.spring;

import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthManager;
import biz.kryukov.dev.healthprobe.HealthStatus;
import biz.kryukov.dev.healthprobe.HealthSummary;
import biz.kryukov.dev.healthprobe.OverallHealth;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthProbeIndicatorTest {

    private static Health health(HealthStatus status, HealthSummary summary,
                                 Map<String, HealthCheckResult> checks) {
        HealthManager manager = mock(HealthManager.class);
        when(manager.getOverallHealth()).thenReturn(new OverallHealth(status, summary, checks));
        return new HealthProbeIndicator(manager).health();
    }

    @Test
    void healthyReturnsUp() {
        Health health = health(HealthStatus.HEALTHY, new HealthSummary(1, 1, 0, 0),
                Map.of("db", HealthCheckResult.healthy("db", "ok")));

        assertEquals(Status.UP, health.getStatus());
        @SuppressWarnings("unchecked")
        Map<String, Object> db = (Map<String, Object>) health.getDetails().get("db");
        assertEquals("healthy", db.get("status"));
        assertEquals("ok", db.get("message"));
    }

    @Test
    void degradedReturnsDegraded() {
        Health health = health(HealthStatus.DEGRADED, new HealthSummary(1, 0, 1, 0),
                Map.of("cache", HealthCheckResult.degraded("cache", "slow")));

        assertEquals(HealthProbeIndicator.DEGRADED, health.getStatus());
        assertEquals(Map.of("total", 1, "healthy", 0, "degraded", 1, "unhealthy", 0),
                health.getDetails().get("summary"));
    }

    @Test
    void unhealthyReturnsDown() {
        Health health = health(HealthStatus.UNHEALTHY, new HealthSummary(1, 0, 0, 1),
                Map.of("db", HealthCheckResult.unhealthy("db", "gone")));

        assertEquals(Status.DOWN, health.getStatus());
    }

    @Test
    void emptyReturnsUp() {
        Health health = health(HealthStatus.HEALTHY, HealthSummary.EMPTY, Map.of());

        assertEquals(Status.UP, health.getStatus());
    }
}

package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    void labels() {
        assertEquals("healthy", HealthStatus.HEALTHY.label());
        assertEquals("degraded", HealthStatus.DEGRADED.label());
        assertEquals("unhealthy", HealthStatus.UNHEALTHY.label());
    }

    @Test
    void fromLabel() {
        assertEquals(HealthStatus.DEGRADED, HealthStatus.fromLabel("DEGRADED"));
        assertThrows(IllegalArgumentException.class, () -> HealthStatus.fromLabel("unknown"));
    }

    @Test
    void severityOrder() {
        assertTrue(HealthStatus.UNHEALTHY.isWorseThan(HealthStatus.DEGRADED));
        assertTrue(HealthStatus.DEGRADED.isWorseThan(HealthStatus.HEALTHY));
        assertFalse(HealthStatus.HEALTHY.isWorseThan(HealthStatus.HEALTHY));
    }
}

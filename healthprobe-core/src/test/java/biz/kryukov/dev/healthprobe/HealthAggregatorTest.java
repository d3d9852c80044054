package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HealthAggregatorTest {

    @Test
    void emptyIsHealthy() {
        OverallHealth overall = HealthAggregator.aggregate(Map.of(), name -> true);

        assertEquals(HealthStatus.HEALTHY, overall.status());
        assertEquals(HealthSummary.EMPTY, overall.summary());
    }

    @Test
    void criticalUnhealthyWins() {
        OverallHealth overall = HealthAggregator.aggregate(Map.of(
                "db", HealthCheckResult.unhealthy("db", null),
                "cache", HealthCheckResult.degraded("cache", null),
                "legacy", HealthCheckResult.healthy("legacy", null)), Set.of("db")::contains);

        assertEquals(HealthStatus.UNHEALTHY, overall.status());
        assertEquals(new HealthSummary(3, 1, 1, 1), overall.summary());
    }

    @Test
    void nonCriticalUnhealthyDegrades() {
        OverallHealth overall = HealthAggregator.aggregate(Map.of(
                "cache", HealthCheckResult.unhealthy("cache", null)), name -> false);

        assertEquals(HealthStatus.DEGRADED, overall.status());
        assertEquals(new HealthSummary(1, 0, 0, 1), overall.summary());
    }

    @Test
    void criticalDegradedOnlyDegrades() {
        OverallHealth overall = HealthAggregator.aggregate(Map.of(
                "db", HealthCheckResult.degraded("db", null),
                "api", HealthCheckResult.healthy("api", null)), name -> true);

        assertEquals(HealthStatus.DEGRADED, overall.status());
    }

    @Test
    void summaryTotalsMatch() {
        OverallHealth overall = HealthAggregator.aggregate(Map.of(
                "a", HealthCheckResult.healthy("a", null),
                "b", HealthCheckResult.healthy("b", null)), name -> false);

        HealthSummary s = overall.summary();
        assertEquals(s.total(), s.healthy() + s.degraded() + s.unhealthy());
        assertEquals(HealthStatus.HEALTHY, overall.status());
        assertEquals(2, overall.checks().size());
    }
}

package biz.kryukov.dev.healthprobe;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Derives one {@link OverallHealth} from the latest per-probe results.
 *
 * <p>Policy:
 * <ol>
 *   <li>an unhealthy result of a critical probe makes the system unhealthy;</li>
 *   <li>otherwise any degraded or unhealthy result makes it degraded;</li>
 *   <li>otherwise it is healthy, including when there are no results at all.</li>
 * </ol>
 * A failing optional probe is surfaced without failing the whole system.
 */
public final class HealthAggregator {

    private HealthAggregator() {}

    /**
     * Aggregates a result snapshot.
     *
     * @param results    latest result per probe name
     * @param isCritical whether the probe registered under a name is critical
     * @return the overall health, never null
     */
    public static OverallHealth aggregate(Map<String, HealthCheckResult> results,
                                          Predicate<String> isCritical) {
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        boolean criticalFailure = false;

        for (Map.Entry<String, HealthCheckResult> entry : results.entrySet()) {
            switch (entry.getValue().status()) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> {
                    unhealthy++;
                    if (isCritical.test(entry.getKey())) {
                        criticalFailure = true;
                    }
                }
            }
        }

        HealthStatus status;
        if (criticalFailure) {
            status = HealthStatus.UNHEALTHY;
        } else if (degraded > 0 || unhealthy > 0) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        HealthSummary summary = new HealthSummary(healthy + degraded + unhealthy,
                healthy, degraded, unhealthy);
        return new OverallHealth(status, summary,
                Collections.unmodifiableMap(new TreeMap<>(results)));
    }
}

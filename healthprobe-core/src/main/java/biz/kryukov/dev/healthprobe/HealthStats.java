package biz.kryukov.dev.healthprobe;

/**
 * Counters and flags describing a {@link HealthManager}.
 *
 * @param totalChecks       registered probes
 * @param activeTimers      probes with a periodic timer
 * @param lastResults       probes with a stored result
 * @param complianceEnabled whether the compliance bundle may be registered
 * @param autoCheckEnabled  manager-wide auto-check default
 */
public record HealthStats(int totalChecks, int activeTimers, int lastResults,
                          boolean complianceEnabled, boolean autoCheckEnabled) {
}

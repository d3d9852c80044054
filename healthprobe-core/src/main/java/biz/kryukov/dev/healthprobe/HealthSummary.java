package biz.kryukov.dev.healthprobe;

/**
 * Result counts by status.
 */
public record HealthSummary(int total, int healthy, int degraded, int unhealthy) {

    /** Summary of an empty result set. */
    public static final HealthSummary EMPTY = new HealthSummary(0, 0, 0, 0);
}

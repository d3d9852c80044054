package biz.kryukov.dev.healthprobe;

/**
 * Health status of a single probe or of the whole system, ordered by severity.
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    /** Returns the lower-case string form, also used as the metrics tag value. */
    public String label() {
        return label;
    }

    /** Returns true if this status is strictly more severe than {@code other}. */
    public boolean isWorseThan(HealthStatus other) {
        return compareTo(other) > 0;
    }

    /** Finds a status by its string representation (case-insensitive). */
    public static HealthStatus fromLabel(String label) {
        for (HealthStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + label);
    }
}

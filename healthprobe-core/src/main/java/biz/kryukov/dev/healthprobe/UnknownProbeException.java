package biz.kryukov.dev.healthprobe;

/**
 * Thrown when a probe is addressed by a name that is not registered.
 */
public class UnknownProbeException extends HealthProbeException {

    private final String probeName;

    public UnknownProbeException(String probeName) {
        super("Health check '" + probeName + "' not found");
        this.probeName = probeName;
    }

    /** Returns the name that was looked up. */
    public String probeName() {
        return probeName;
    }
}

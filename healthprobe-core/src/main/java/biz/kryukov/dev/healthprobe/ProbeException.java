package biz.kryukov.dev.healthprobe;

/**
 * Base probe failure with a failure category.
 *
 * <p>Never propagated to callers of the manager: the executor converts it into an
 * {@link HealthStatus#UNHEALTHY} result and stores {@link #failureCategory()} in the
 * result metadata under {@link FailureCategory#METADATA_KEY}.</p>
 */
public class ProbeException extends Exception {

    private final String failureCategory;

    public ProbeException(String message, String failureCategory) {
        super(message);
        this.failureCategory = failureCategory;
    }

    public ProbeException(String message, Throwable cause, String failureCategory) {
        super(message, cause);
        this.failureCategory = failureCategory;
    }

    /** Returns the failure category for this error. */
    public String failureCategory() {
        return failureCategory;
    }
}

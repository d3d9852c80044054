package biz.kryukov.dev.healthprobe;

/**
 * The probe operation threw, completed exceptionally or returned an unusable result.
 */
public class ProbeExecutionException extends ProbeException {

    public ProbeExecutionException(String message) {
        super(message, FailureCategory.ERROR);
    }

    public ProbeExecutionException(String message, Throwable cause) {
        super(message, cause, FailureCategory.ERROR);
    }
}

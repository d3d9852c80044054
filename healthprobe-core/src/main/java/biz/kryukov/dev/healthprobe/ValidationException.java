package biz.kryukov.dev.healthprobe;

/**
 * Parameter validation error.
 */
public class ValidationException extends HealthProbeException {

    public ValidationException(String message) {
        super(message);
    }
}

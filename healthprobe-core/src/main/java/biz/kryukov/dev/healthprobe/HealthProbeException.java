package biz.kryukov.dev.healthprobe;

/**
 * Base exception for the healthprobe engine.
 */
public class HealthProbeException extends RuntimeException {

    public HealthProbeException(String message) {
        super(message);
    }

    public HealthProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}

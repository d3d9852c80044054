package biz.kryukov.dev.healthprobe;

import java.time.Duration;

/**
 * The timeout timer fired before the probe operation settled.
 */
public class ProbeTimeoutException extends ProbeException {

    private final Duration timeout;

    public ProbeTimeoutException(Duration timeout) {
        super("Health check timeout after " + timeout.toMillis() + "ms", FailureCategory.TIMEOUT);
        this.timeout = timeout;
    }

    /** Returns the timeout that elapsed. */
    public Duration timeout() {
        return timeout;
    }
}

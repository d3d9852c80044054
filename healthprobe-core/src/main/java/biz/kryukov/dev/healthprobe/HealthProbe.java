package biz.kryukov.dev.healthprobe;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous health probe operation.
 *
 * <p>Implementations must be thread-safe: a manual run may overlap a scheduled one.
 * A synchronous throw and an exceptionally completed stage are treated alike.
 *
 * @see BlockingHealthProbe
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Starts the check.
     *
     * @return a stage completing with the probe's result
     * @throws Exception if the check could not be started
     */
    CompletionStage<HealthCheckResult> check() throws Exception;
}

package biz.kryukov.dev.healthprobe;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Health probe doing blocking work (JDBC, file system, blocking clients).
 *
 * <p>The executor runs {@link #checkBlocking()} on its worker pool, never on the
 * caller's thread or a timer thread.
 */
@FunctionalInterface
public interface BlockingHealthProbe extends HealthProbe {

    /**
     * Performs the check, blocking the calling thread.
     *
     * @return the probe's result
     * @throws Exception if the check failed
     */
    HealthCheckResult checkBlocking() throws Exception;

    /** Runs the check inline; the executor only calls this from its worker pool. */
    @Override
    default CompletionStage<HealthCheckResult> check() throws Exception {
        return CompletableFuture.completedFuture(checkBlocking());
    }
}

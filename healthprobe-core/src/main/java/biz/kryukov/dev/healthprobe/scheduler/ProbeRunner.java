package biz.kryukov.dev.healthprobe.scheduler;

import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.ProbeDefinition;

import java.util.concurrent.CompletableFuture;

/**
 * Launches one execution of a probe. Must not block.
 */
@FunctionalInterface
public interface ProbeRunner {

    CompletableFuture<HealthCheckResult> run(ProbeDefinition definition);
}

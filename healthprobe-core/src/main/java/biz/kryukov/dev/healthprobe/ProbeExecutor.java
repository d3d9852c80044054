package biz.kryukov.dev.healthprobe;

import biz.kryukov.dev.healthprobe.metrics.ProbeMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs one probe execution against a timeout timer.
 *
 * <p>The operation is started on the worker pool and races a timer armed for the probe's
 * timeout. The first of the two to settle claims the invocation: only its result is stored
 * and returned. The losing side is ignored, so an operation that resolves after its timeout
 * never overwrites the timeout result. A timeout does not interrupt the operation.
 *
 * <p>The returned future always completes normally; probe failures become
 * {@link HealthStatus#UNHEALTHY} results.
 */
public final class ProbeExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeExecutor.class);

    private final ResultStore results;
    private final Predicate<ProbeDefinition> owner;
    private final ScheduledExecutorService timer;
    private final Executor workers;
    private final Duration defaultTimeout;
    private final ProbeMetrics metrics;
    private final Logger logger;

    /**
     * @param results        store receiving every settled result
     * @param owner          whether a definition is still the registered one; results of
     *                       replaced or unregistered definitions are not stored
     * @param timer          runs timeout timers
     * @param workers        runs probe operations
     * @param defaultTimeout timeout for definitions without their own
     * @param metrics        metrics sink
     */
    public ProbeExecutor(ResultStore results, Predicate<ProbeDefinition> owner,
                         ScheduledExecutorService timer, Executor workers,
                         Duration defaultTimeout, ProbeMetrics metrics) {
        this(results, owner, timer, workers, defaultTimeout, metrics, LOG);
    }

    public ProbeExecutor(ResultStore results, Predicate<ProbeDefinition> owner,
                         ScheduledExecutorService timer, Executor workers,
                         Duration defaultTimeout, ProbeMetrics metrics, Logger logger) {
        this.results = results;
        this.owner = owner;
        this.timer = timer;
        this.workers = workers;
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Executes a probe once.
     *
     * @return a future completing with the stored result; never completes exceptionally
     */
    public CompletableFuture<HealthCheckResult> execute(ProbeDefinition definition) {
        Invocation invocation = new Invocation(definition,
                definition.timeoutOr(defaultTimeout), System.nanoTime());

        ScheduledFuture<?> timeoutTask = timer.schedule(
                () -> invocation.settle(failed(invocation, new ProbeTimeoutException(invocation.timeout))),
                invocation.timeout.toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture
                .supplyAsync(() -> start(definition), workers)
                .thenCompose(Function.identity())
                .whenComplete((result, err) -> {
                    timeoutTask.cancel(false);
                    invocation.settle(err != null
                            ? failed(invocation, FailureClassifier.unwrap(err))
                            : accepted(invocation, result));
                });

        return invocation.outcome;
    }

    private static CompletionStage<HealthCheckResult> start(ProbeDefinition definition) {
        try {
            CompletionStage<HealthCheckResult> stage = definition.probe().check();
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new ProbeExecutionException("probe returned no completion stage"));
            }
            return stage;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private HealthCheckResult accepted(Invocation invocation, HealthCheckResult result) {
        String name = invocation.definition.name();
        if (result == null) {
            return failed(invocation, new ProbeExecutionException("probe returned no result"));
        }
        if (!name.equals(result.name())) {
            return failed(invocation, new ProbeExecutionException(
                    "probe returned a result named '" + result.name() + "'"));
        }
        return result.withDuration(invocation.elapsed());
    }

    private HealthCheckResult failed(Invocation invocation, Throwable err) {
        return HealthCheckResult.builder(invocation.definition.name(), HealthStatus.UNHEALTHY)
                .duration(invocation.elapsed())
                .message(FailureClassifier.describe(err))
                .metadata(FailureCategory.METADATA_KEY, FailureClassifier.classify(err))
                .build();
    }

    private void commit(Invocation invocation, HealthCheckResult result) {
        ProbeDefinition definition = invocation.definition;
        HealthStatus before = results.get(definition.name())
                .map(HealthCheckResult::status)
                .orElse(null);

        boolean stored = results.commit(definition.name(), result, () -> owner.test(definition));
        if (!stored) {
            logger.debug("healthprobe: discarded result of {} (replaced or unregistered)",
                    definition.name());
            return;
        }
        // unregister may have removed the meters since the store accepted the result
        if (owner.test(definition)) {
            metrics.record(definition, result);
        }

        if (result.status() == HealthStatus.UNHEALTHY && before != HealthStatus.UNHEALTHY) {
            logger.warn("healthprobe: {} became unhealthy: {}", definition.name(), result.message());
        } else if (before == HealthStatus.UNHEALTHY && result.status() != HealthStatus.UNHEALTHY) {
            logger.info("healthprobe: {} recovered ({})", definition.name(), result.status().label());
        }
    }

    private final class Invocation {
        private final ProbeDefinition definition;
        private final Duration timeout;
        private final long startNs;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CompletableFuture<HealthCheckResult> outcome = new CompletableFuture<>();

        private Invocation(ProbeDefinition definition, Duration timeout, long startNs) {
            this.definition = definition;
            this.timeout = timeout;
            this.startNs = startNs;
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNs);
        }

        private void settle(HealthCheckResult result) {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                commit(this, result);
            } catch (RuntimeException e) {
                logger.error("healthprobe: failed to record result of {}", definition.name(), e);
            } finally {
                outcome.complete(result);
            }
        }
    }
}

package biz.kryukov.dev.healthprobe;

import biz.kryukov.dev.healthprobe.metrics.ProbeMetrics;
import biz.kryukov.dev.healthprobe.probes.ComplianceProbes;
import biz.kryukov.dev.healthprobe.probes.InfrastructureProbes;
import biz.kryukov.dev.healthprobe.scheduler.DaemonThreadFactory;
import biz.kryukov.dev.healthprobe.scheduler.ProbeScheduler;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the healthprobe engine.
 *
 * <p>Usage:
 * <pre>{@code
 * HealthManager health = HealthManager.builder()
 *     .options(HealthManagerOptions.builder()
 *         .checkInterval(Duration.ofSeconds(15))
 *         .timeout(Duration.ofSeconds(2))
 *         .build())
 *     .meterRegistry(meterRegistry)
 *     .build();
 *
 * health.registerCheck(ProbeDefinition.builder("orders-db")
 *     .blockingProbe(() -> pingDatabase())
 *     .critical(true)
 *     .build());
 *
 * OverallHealth overall = health.getOverallHealth();
 * // ...
 * health.close();
 * }</pre>
 *
 * <p>All operations are thread-safe. Probe failures never surface as exceptions: they are
 * reported as {@link HealthStatus#UNHEALTHY} results.
 */
public final class HealthManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HealthManager.class);

    private final HealthManagerOptions options;
    private final Logger logger;
    private final ResultStore results;
    private final ProbeMetrics metrics;
    private final ScheduledThreadPoolExecutor timeoutTimer;
    private final ExecutorService workers;
    private final ProbeExecutor executor;
    private final ProbeScheduler scheduler;
    private final ProbeRegistry registry;
    private volatile boolean closed;

    private HealthManager(Builder builder) {
        this.options = builder.options;
        this.logger = builder.logger;
        this.results = new ResultStore();
        this.metrics = new ProbeMetrics(builder.meterRegistry);

        this.timeoutTimer = new ScheduledThreadPoolExecutor(1,
                new DaemonThreadFactory("healthprobe-timeout"));
        this.timeoutTimer.setRemoveOnCancelPolicy(true);
        this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("healthprobe-worker"));

        this.executor = new ProbeExecutor(results, this::isRegistered, timeoutTimer, workers,
                options.timeout(), metrics, logger);
        this.scheduler = new ProbeScheduler(this::launch, logger);
        this.registry = new ProbeRegistry(scheduler, results, options, logger);
    }

    /** Creates a manager with default options. */
    public static HealthManager create() {
        return builder().build();
    }

    /** Creates a manager with the given options. */
    public static HealthManager create(HealthManagerOptions options) {
        return builder().options(options).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a probe, replacing any probe with the same name. When auto-check applies,
     * the probe's periodic timer is (re)started.
     */
    public void registerCheck(ProbeDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ensureOpen();
        registry.register(definition)
                .filter(previous -> previous.critical() != definition.critical())
                .ifPresent(previous -> metrics.delete(previous.name()));
    }

    /**
     * Removes a probe together with its timer and stored result.
     *
     * @return whether the probe was registered
     */
    public boolean unregisterCheck(String name) {
        Optional<ProbeDefinition> removed = registry.unregister(name);
        removed.ifPresent(def -> metrics.delete(def.name()));
        return removed.isPresent();
    }

    /**
     * Runs a probe now, independently of its schedule, and stores the result.
     *
     * @return a future completing with the result; never completes exceptionally
     * @throws UnknownProbeException if no probe is registered under {@code name}
     */
    public CompletableFuture<HealthCheckResult> runCheck(String name) {
        ensureOpen();
        ProbeDefinition definition = registry.get(name)
                .orElseThrow(() -> new UnknownProbeException(name));
        return executor.execute(definition);
    }

    /**
     * Runs every registered probe concurrently.
     *
     * @return a future completing with the result of each probe, keyed by name
     */
    public CompletableFuture<Map<String, HealthCheckResult>> runAllChecks() {
        ensureOpen();
        Map<String, CompletableFuture<HealthCheckResult>> running = new TreeMap<>();
        for (ProbeDefinition definition : registry.definitions()) {
            running.put(definition.name(), executor.execute(definition));
        }
        return CompletableFuture
                .allOf(running.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    Map<String, HealthCheckResult> collected = new TreeMap<>();
                    running.forEach((name, future) -> collected.put(name, future.join()));
                    return collected;
                });
    }

    /**
     * Aggregates the latest stored results. Executes nothing.
     */
    public OverallHealth getOverallHealth() {
        return HealthAggregator.aggregate(results.snapshot(), registry::isCritical);
    }

    /** Returns the latest stored result of a probe. */
    public Optional<HealthCheckResult> getResult(String name) {
        return results.get(name);
    }

    /** Returns the names of all registered probes, sorted. */
    public List<String> checkNames() {
        TreeSet<String> names = new TreeSet<>();
        registry.definitions().forEach(def -> names.add(def.name()));
        return List.copyOf(names);
    }

    /** Returns the names of registered probes carrying {@code tag}, sorted. */
    public List<String> checkNamesWithTag(String tag) {
        TreeSet<String> names = new TreeSet<>();
        for (ProbeDefinition def : registry.definitions()) {
            if (def.tags().contains(tag)) {
                names.add(def.name());
            }
        }
        return List.copyOf(names);
    }

    public HealthStats getStats() {
        return new HealthStats(registry.size(), scheduler.activeTimers(), results.size(),
                options.enableCompliance(), options.enableAutoCheck());
    }

    /** Returns the options this manager was built with. */
    public HealthManagerOptions options() {
        return options;
    }

    /**
     * Registers the {@code database}, {@code memory} and {@code disk_space} probes backed by
     * JVM runtime data. {@code database} needs a data source and is therefore skipped here.
     */
    public void registerInfrastructureChecks() {
        registerInfrastructureChecks(InfrastructureProbes.builder().build());
    }

    /** Registers the given infrastructure probes. */
    public void registerInfrastructureChecks(InfrastructureProbes probes) {
        List<ProbeDefinition> definitions = probes.definitions();
        definitions.forEach(this::registerCheck);
        logger.info("healthprobe: registered {} infrastructure checks", definitions.size());
    }

    /**
     * Registers the compliance probes, unless compliance checks are disabled.
     *
     * @return whether the probes were registered
     */
    public boolean registerComplianceChecks(ComplianceProbes probes) {
        if (!options.enableCompliance()) {
            logger.debug("healthprobe: compliance checks disabled, skipping registration");
            return false;
        }
        List<ProbeDefinition> definitions = probes.definitions();
        definitions.forEach(this::registerCheck);
        logger.info("healthprobe: registered {} compliance checks", definitions.size());
        return true;
    }

    /** Cancels every periodic timer. Idempotent; probes stay registered. */
    public void stopAllAutoChecks() {
        scheduler.stopAll();
    }

    /** Same as {@link #stopAllAutoChecks()}. */
    public void cleanup() {
        stopAllAutoChecks();
    }

    /**
     * Cancels every timer and releases the engine's threads. Pending timeouts still fire so
     * in-flight executions complete. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdown();
        timeoutTimer.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("healthprobe: probe workers still running after close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean isRegistered(ProbeDefinition definition) {
        return registry.isCurrent(definition);
    }

    private CompletableFuture<HealthCheckResult> launch(ProbeDefinition definition) {
        return executor.execute(definition);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("HealthManager is closed");
        }
    }

    /** Builder for {@link HealthManager}. */
    public static final class Builder {
        private HealthManagerOptions options = HealthManagerOptions.defaults();
        private MeterRegistry meterRegistry = Metrics.globalRegistry;
        private Logger logger = LOG;

        private Builder() {}

        public Builder options(HealthManagerOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /** Sets the registry receiving probe metrics; defaults to Micrometer's global registry. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        public HealthManager build() {
            return new HealthManager(this);
        }
    }
}

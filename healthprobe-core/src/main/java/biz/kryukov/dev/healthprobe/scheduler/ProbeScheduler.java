package biz.kryukov.dev.healthprobe.scheduler;

import biz.kryukov.dev.healthprobe.ProbeDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Periodic probe timers, at most one per probe name.
 *
 * <p>A timer only launches an execution through the {@link ProbeRunner} and never waits for
 * it, so one slow probe cannot hold back another probe's schedule. Timers can be added and
 * cancelled at any time until {@link #shutdown()}.
 */
public final class ProbeScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeScheduler.class);
    private static final int CORE_POOL_SIZE = 1;

    private final ProbeRunner runner;
    private final Logger logger;
    private final ScheduledThreadPoolExecutor executor;
    private final Map<String, ScheduledProbe> timers = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public ProbeScheduler(ProbeRunner runner) {
        this(runner, LOG);
    }

    public ProbeScheduler(ProbeRunner runner, Logger logger) {
        this.runner = runner;
        this.logger = logger;
        this.executor = new ScheduledThreadPoolExecutor(CORE_POOL_SIZE,
                new DaemonThreadFactory("healthprobe-scheduler"));
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Starts a fixed-rate timer for a probe, replacing the probe's current timer if any.
     * The first run happens one interval from now.
     */
    public void schedule(ProbeDefinition definition, Duration interval) {
        if (shutdown) {
            throw new IllegalStateException("Scheduler already shut down");
        }
        long periodMs = Math.max(1, interval.toMillis());
        timers.compute(definition.name(), (name, previous) -> {
            if (previous != null) {
                previous.future().cancel(false);
            }
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                    () -> fire(definition), periodMs, periodMs, TimeUnit.MILLISECONDS);
            return new ScheduledProbe(definition, interval, future);
        });
        logger.debug("healthprobe: auto check for {} every {}ms", definition.name(), periodMs);
    }

    /**
     * Cancels the timer of a probe only if it was started for {@code owner}.
     *
     * @return whether a timer was cancelled
     */
    public boolean cancel(String name, ProbeDefinition owner) {
        boolean[] cancelled = new boolean[1];
        timers.computeIfPresent(name, (key, timer) -> {
            if (timer.definition() != owner) {
                return timer;
            }
            timer.future().cancel(false);
            cancelled[0] = true;
            return null;
        });
        return cancelled[0];
    }

    /**
     * Cancels the timer of a probe.
     *
     * @return whether a timer was cancelled
     */
    public boolean cancel(String name) {
        ScheduledProbe timer = timers.remove(name);
        if (timer == null) {
            return false;
        }
        timer.future().cancel(false);
        return true;
    }

    /** Returns whether the named probe has an active timer. */
    public boolean isScheduled(String name) {
        return timers.containsKey(name);
    }

    /** Returns the number of active timers. */
    public int activeTimers() {
        return timers.size();
    }

    /**
     * Cancels every timer. Idempotent; new timers may be scheduled afterwards.
     */
    public void stopAll() {
        int stopped = 0;
        for (String name : timers.keySet()) {
            if (cancel(name)) {
                stopped++;
            }
        }
        if (stopped > 0) {
            logger.info("healthprobe: stopped {} auto checks", stopped);
        }
    }

    /**
     * Cancels every timer and releases the timer thread. Idempotent.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        stopAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("healthprobe: scheduler stopped");
    }

    private void fire(ProbeDefinition definition) {
        try {
            runner.run(definition).whenComplete((result, err) -> {
                if (err != null) {
                    logger.error("healthprobe: auto check for {} failed", definition.name(), err);
                }
            });
        } catch (RuntimeException e) {
            // an exception escaping here would suppress every later run of this timer
            logger.error("healthprobe: auto check for {} failed", definition.name(), e);
        }
    }

    private record ScheduledProbe(ProbeDefinition definition, Duration interval,
                                  ScheduledFuture<?> future) {}
}

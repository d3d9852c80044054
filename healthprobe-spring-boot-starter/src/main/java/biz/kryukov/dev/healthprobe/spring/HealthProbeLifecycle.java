package biz.kryukov.dev.healthprobe.spring;

import biz.kryukov.dev.healthprobe.HealthManager;
import org.springframework.context.SmartLifecycle;

/**
 * Runs every registered probe once when the context starts, so the first health read does
 * not wait for a full check interval, and stops the periodic checks when it stops.
 */
public class HealthProbeLifecycle implements SmartLifecycle {

    private final HealthManager healthManager;
    private volatile boolean running;

    public HealthProbeLifecycle(HealthManager healthManager) {
        this.healthManager = healthManager;
    }

    @Override
    public void start() {
        healthManager.runAllChecks();
        running = true;
    }

    @Override
    public void stop() {
        healthManager.stopAllAutoChecks();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Last phase: every {@code ProbeDefinition} bean is registered by then. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}

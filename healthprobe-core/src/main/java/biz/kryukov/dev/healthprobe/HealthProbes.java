package biz.kryukov.dev.healthprobe;

import java.util.concurrent.CompletableFuture;

/**
 * Process-wide default {@link HealthManager} and shortcuts delegating to it.
 *
 * <p>Prefer constructing a {@link HealthManager} explicitly; the default instance uses
 * {@link HealthManagerOptions#defaults()} and lives until the JVM exits.
 */
public final class HealthProbes {

    private HealthProbes() {}

    /** Returns the default manager, creating it on first use. */
    public static HealthManager defaultManager() {
        return Holder.INSTANCE;
    }

    /** Creates an independent manager. */
    public static HealthManager createManager(HealthManagerOptions options) {
        return HealthManager.create(options);
    }

    public static void registerHealthCheck(ProbeDefinition definition) {
        defaultManager().registerCheck(definition);
    }

    public static CompletableFuture<HealthCheckResult> runHealthCheck(String name) {
        return defaultManager().runCheck(name);
    }

    public static OverallHealth getOverallHealth() {
        return defaultManager().getOverallHealth();
    }

    private static final class Holder {
        private static final HealthManager INSTANCE = HealthManager.create();
    }
}

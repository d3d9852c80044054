package biz.kryukov.dev.healthprobe;

import biz.kryukov.dev.healthprobe.scheduler.ProbeScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probe name to {@link ProbeDefinition} map that keeps the scheduler's timers in step
 * with every registration change.
 */
public final class ProbeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeRegistry.class);

    private final Map<String, ProbeDefinition> definitions = new ConcurrentHashMap<>();
    private final ProbeScheduler scheduler;
    private final ResultStore results;
    private final HealthManagerOptions options;
    private final Logger logger;

    public ProbeRegistry(ProbeScheduler scheduler, ResultStore results, HealthManagerOptions options) {
        this(scheduler, results, options, LOG);
    }

    public ProbeRegistry(ProbeScheduler scheduler, ResultStore results, HealthManagerOptions options,
                         Logger logger) {
        this.scheduler = scheduler;
        this.results = results;
        this.options = options;
        this.logger = logger;
    }

    /**
     * Stores a definition, replacing any definition with the same name, and (re)starts its
     * periodic timer when auto-check applies. The previous timer is cancelled first.
     *
     * @return the replaced definition, if any
     */
    public Optional<ProbeDefinition> register(ProbeDefinition definition) {
        ProbeDefinition[] previous = new ProbeDefinition[1];
        definitions.compute(definition.name(), (name, old) -> {
            if (old != null) {
                scheduler.cancel(name, old);
            }
            if (definition.autoCheckOr(options.enableAutoCheck())) {
                scheduler.schedule(definition, definition.intervalOr(options.checkInterval()));
            }
            previous[0] = old;
            return definition;
        });
        logger.debug("healthprobe: {} {} (critical={}, tags={})",
                previous[0] == null ? "registered" : "re-registered",
                definition.name(), definition.critical(), definition.tags());
        return Optional.ofNullable(previous[0]);
    }

    /**
     * Removes a definition, cancels its timer and drops its stored result.
     *
     * @return the removed definition, empty if the name was not registered
     */
    public Optional<ProbeDefinition> unregister(String name) {
        ProbeDefinition removed = definitions.remove(name);
        if (removed == null) {
            return Optional.empty();
        }
        scheduler.cancel(name, removed);
        results.remove(name);
        logger.debug("healthprobe: unregistered {}", name);
        return Optional.of(removed);
    }

    /** Returns the definition registered under a name. */
    public Optional<ProbeDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /** Returns whether this exact definition is the one currently registered under its name. */
    public boolean isCurrent(ProbeDefinition definition) {
        return definitions.get(definition.name()) == definition;
    }

    /** Returns whether the named probe is registered and critical. */
    public boolean isCritical(String name) {
        ProbeDefinition def = definitions.get(name);
        return def != null && def.critical();
    }

    /** Returns a snapshot of all registered definitions. */
    public List<ProbeDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    /** Returns the number of registered definitions. */
    public int size() {
        return definitions.size();
    }
}

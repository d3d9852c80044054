package biz.kryukov.dev.healthprobe;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Latest {@link HealthCheckResult} per probe name.
 *
 * <p>Each write replaces one immutable value atomically and is serialised per name, so the
 * stored result is the one of the most recently completed execution. A write whose owner
 * check fails is dropped.
 */
public final class ResultStore {

    private final Map<String, HealthCheckResult> entries = new ConcurrentHashMap<>();

    /**
     * Stores a result, replacing the previous one for the same name.
     *
     * @param name   probe name
     * @param result result to store
     * @param owner  evaluated under the per-name lock; the write is dropped if false
     * @return whether the result was stored
     */
    public boolean commit(String name, HealthCheckResult result, BooleanSupplier owner) {
        boolean[] written = new boolean[1];
        entries.compute(name, (key, current) -> {
            if (!owner.getAsBoolean()) {
                return current;
            }
            written[0] = true;
            return result;
        });
        return written[0];
    }

    /** Returns the latest result for a probe. */
    public Optional<HealthCheckResult> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /** Drops the stored result of a probe. */
    public boolean remove(String name) {
        return entries.remove(name) != null;
    }

    /** Returns the latest result of every probe (unmodifiable, sorted by name). */
    public Map<String, HealthCheckResult> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    /** Returns the number of stored results. */
    public int size() {
        return entries.size();
    }
}

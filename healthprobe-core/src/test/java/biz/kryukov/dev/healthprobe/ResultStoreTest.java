package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {

    private final ResultStore store = new ResultStore();

    @Test
    void lastCommitWins() {
        HealthCheckResult healthy = HealthCheckResult.healthy("db", "fast");
        HealthCheckResult timedOut = HealthCheckResult.builder("db", HealthStatus.UNHEALTHY)
                .message("Health check timeout after 300ms")
                .metadata(FailureCategory.METADATA_KEY, FailureCategory.TIMEOUT)
                .build();

        assertTrue(store.commit("db", healthy, () -> true));
        assertTrue(store.commit("db", timedOut, () -> true));

        assertSame(timedOut, store.get("db").orElseThrow());
    }

    @Test
    void ownerCheckGuardsWrite() {
        HealthCheckResult kept = HealthCheckResult.healthy("db", null);
        store.commit("db", kept, () -> true);

        assertFalse(store.commit("db", HealthCheckResult.unhealthy("db", null), () -> false));
        assertFalse(store.commit("cache", HealthCheckResult.healthy("cache", null), () -> false));

        assertSame(kept, store.get("db").orElseThrow());
        assertTrue(store.get("cache").isEmpty());
        assertEquals(1, store.size());
    }

    @Test
    void snapshotIsSortedAndDetached() {
        store.commit("b", HealthCheckResult.healthy("b", null), () -> true);
        store.commit("a", HealthCheckResult.healthy("a", null), () -> true);

        var snapshot = store.snapshot();
        store.remove("a");

        assertEquals(List.of("a", "b"), List.copyOf(snapshot.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("a"));
        assertEquals(1, store.size());
    }

    @Test
    void removeReportsPresence() {
        store.commit("a", HealthCheckResult.healthy("a", null), () -> true);

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
    }
}

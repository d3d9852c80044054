package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProbeDefinitionTest {

    private static final BlockingHealthProbe OK = () -> HealthCheckResult.healthy("x", null);

    @Test
    void defaults() {
        ProbeDefinition def = ProbeDefinition.builder("db").blockingProbe(OK).build();

        assertEquals("db", def.name());
        assertNull(def.timeout());
        assertNull(def.interval());
        assertNull(def.autoCheck());
        assertFalse(def.critical());
        assertTrue(def.tags().isEmpty());
        assertEquals(Duration.ofSeconds(3), def.timeoutOr(Duration.ofSeconds(3)));
        assertEquals(Duration.ofSeconds(7), def.intervalOr(Duration.ofSeconds(7)));
        assertTrue(def.autoCheckOr(true));
    }

    @Test
    void overridesWinOverFallbacks() {
        ProbeDefinition def = ProbeDefinition.builder("db")
                .blockingProbe(OK)
                .timeout(Duration.ofMillis(200))
                .interval(Duration.ofSeconds(5))
                .autoCheck(false)
                .critical(true)
                .tags("storage", "sql")
                .build();

        assertEquals(Duration.ofMillis(200), def.timeoutOr(Duration.ofSeconds(10)));
        assertEquals(Duration.ofSeconds(5), def.intervalOr(Duration.ofSeconds(30)));
        assertFalse(def.autoCheckOr(true));
        assertTrue(def.critical());
        assertEquals(Set.of("storage", "sql"), def.tags());
    }

    @Test
    void tagsAreImmutable() {
        ProbeDefinition def = ProbeDefinition.builder("db").blockingProbe(OK).tag("a").build();

        assertThrows(UnsupportedOperationException.class, () -> def.tags().add("b"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"db", "orders-db", "cache.redis", "a_1", "0day"})
    void validNames(String name) {
        assertDoesNotThrow(() -> ProbeDefinition.validateName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-db", ".db", "has space", "db/1", "ø"})
    void invalidNames(String name) {
        assertThrows(ValidationException.class, () -> ProbeDefinition.validateName(name));
    }

    @Test
    void nameLengthLimit() {
        assertDoesNotThrow(() -> ProbeDefinition.validateName("a".repeat(128)));
        assertThrows(ValidationException.class, () -> ProbeDefinition.validateName("a".repeat(129)));
        assertThrows(ValidationException.class, () -> ProbeDefinition.validateName(null));
    }

    @Test
    void missingOperation() {
        assertThrows(ValidationException.class, () -> ProbeDefinition.builder("db").build());
    }

    @Test
    void nonPositiveTimings() {
        assertThrows(ValidationException.class, () -> ProbeDefinition.builder("db")
                .blockingProbe(OK).timeout(Duration.ZERO).build());
        assertThrows(ValidationException.class, () -> ProbeDefinition.builder("db")
                .blockingProbe(OK).interval(Duration.ofSeconds(-1)).build());
    }

    @Test
    void blankTag() {
        assertThrows(ValidationException.class, () -> ProbeDefinition.builder("db")
                .blockingProbe(OK).tag(" ").build());
    }
}

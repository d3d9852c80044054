package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HealthManagerOptionsTest {

    @Test
    void defaults() {
        HealthManagerOptions options = HealthManagerOptions.defaults();

        assertTrue(options.enableCompliance());
        assertTrue(options.enableAutoCheck());
        assertEquals(Duration.ofSeconds(30), options.checkInterval());
        assertEquals(Duration.ofSeconds(10), options.timeout());
    }

    @Test
    void customValues() {
        HealthManagerOptions options = HealthManagerOptions.builder()
                .enableCompliance(false)
                .enableAutoCheck(false)
                .checkInterval(Duration.ofSeconds(15))
                .timeout(Duration.ofSeconds(2))
                .build();

        assertFalse(options.enableCompliance());
        assertFalse(options.enableAutoCheck());
        assertEquals(Duration.ofSeconds(15), options.checkInterval());
        assertEquals(Duration.ofSeconds(2), options.timeout());
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThrows(ValidationException.class,
                () -> HealthManagerOptions.builder().checkInterval(Duration.ZERO).build());
        assertThrows(ValidationException.class,
                () -> HealthManagerOptions.builder().timeout(Duration.ofMillis(-5)).build());
        assertThrows(ValidationException.class,
                () -> HealthManagerOptions.builder().timeout(null).build());
    }
}

package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.ProbeDefinition;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class InfrastructureProbesTest {

    @Test
    void withoutDataSourceSkipsDatabase() {
        List<ProbeDefinition> defs = InfrastructureProbes.builder().build().definitions();

        assertEquals(List.of(InfrastructureProbes.MEMORY, InfrastructureProbes.DISK_SPACE),
                defs.stream().map(ProbeDefinition::name).toList());
    }

    @Test
    void withDataSource() {
        List<ProbeDefinition> defs = InfrastructureProbes.builder()
                .dataSource(mock(DataSource.class))
                .build()
                .definitions();

        assertEquals(3, defs.size());
        ProbeDefinition db = defs.get(0);
        assertEquals(InfrastructureProbes.DATABASE, db.name());
        assertTrue(db.critical());
        assertEquals(Duration.ofSeconds(30), db.interval());

        ProbeDefinition memory = defs.get(1);
        assertFalse(memory.critical());
        assertEquals(Duration.ofSeconds(60), memory.interval());

        ProbeDefinition disk = defs.get(2);
        assertTrue(disk.critical());
        assertEquals(Duration.ofMinutes(5), disk.interval());
        assertTrue(disk.tags().contains(InfrastructureProbes.TAG));
    }
}

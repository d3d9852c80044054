package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.ProbeDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Built-in infrastructure probes.
 *
 * <table>
 *   <caption>Probes</caption>
 *   <tr><th>Name</th><th>Critical</th><th>Interval</th></tr>
 *   <tr><td>{@code database}</td><td>yes</td><td>30s</td></tr>
 *   <tr><td>{@code memory}</td><td>no</td><td>60s</td></tr>
 *   <tr><td>{@code disk_space}</td><td>yes</td><td>5m</td></tr>
 * </table>
 *
 * <p>{@code database} is only included when a {@link DataSource} is supplied.
 */
public final class InfrastructureProbes {

    private static final Logger LOG = LoggerFactory.getLogger(InfrastructureProbes.class);

    public static final String DATABASE = "database";
    public static final String MEMORY = "memory";
    public static final String DISK_SPACE = "disk_space";
    public static final String TAG = "infrastructure";

    static final Duration DATABASE_INTERVAL = Duration.ofSeconds(30);
    static final Duration MEMORY_INTERVAL = Duration.ofSeconds(60);
    static final Duration DISK_SPACE_INTERVAL = Duration.ofMinutes(5);

    private final DataSource dataSource;
    private final MemoryMetrics memoryMetrics;
    private final DiskMetrics diskMetrics;

    private InfrastructureProbes(Builder builder) {
        this.dataSource = builder.dataSource;
        this.memoryMetrics = builder.memoryMetrics;
        this.diskMetrics = builder.diskMetrics;
    }

    /** Returns the probe definitions of this bundle. */
    public List<ProbeDefinition> definitions() {
        List<ProbeDefinition> definitions = new ArrayList<>(3);
        if (dataSource != null) {
            definitions.add(ProbeDefinition.builder(DATABASE)
                    .blockingProbe(DatabaseProbe.builder(dataSource).build())
                    .interval(DATABASE_INTERVAL)
                    .critical(true)
                    .tags(TAG, "database")
                    .build());
        } else {
            LOG.warn("healthprobe: no DataSource configured, skipping '{}' check", DATABASE);
        }
        definitions.add(ProbeDefinition.builder(MEMORY)
                .blockingProbe(new MemoryProbe(memoryMetrics))
                .interval(MEMORY_INTERVAL)
                .critical(false)
                .tags(TAG, "memory")
                .build());
        definitions.add(ProbeDefinition.builder(DISK_SPACE)
                .blockingProbe(new DiskSpaceProbe(diskMetrics))
                .interval(DISK_SPACE_INTERVAL)
                .critical(true)
                .tags(TAG, "disk")
                .build());
        return definitions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link InfrastructureProbes}. */
    public static final class Builder {
        private DataSource dataSource;
        private MemoryMetrics memoryMetrics = MemoryMetrics.jvm();
        private DiskMetrics diskMetrics = DiskMetrics.forPath(Path.of("."));

        private Builder() {}

        /** Sets the data source checked by the {@code database} probe. */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder memoryMetrics(MemoryMetrics memoryMetrics) {
            this.memoryMetrics = Objects.requireNonNull(memoryMetrics, "memoryMetrics");
            return this;
        }

        public Builder diskMetrics(DiskMetrics diskMetrics) {
            this.diskMetrics = Objects.requireNonNull(diskMetrics, "diskMetrics");
            return this;
        }

        /** Measures the file store holding {@code path}. */
        public Builder diskPath(Path path) {
            return diskMetrics(DiskMetrics.forPath(Objects.requireNonNull(path, "path")));
        }

        public InfrastructureProbes build() {
            return new InfrastructureProbes(this);
        }
    }
}

package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.BlockingHealthProbe;
import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;

/**
 * Database probe: runs a validation query through a pooled {@link DataSource}.
 */
public final class DatabaseProbe implements BlockingHealthProbe {

    private static final String DEFAULT_QUERY = "SELECT 1";

    private final String name;
    private final DataSource dataSource;
    private final String query;
    private final Duration queryTimeout;

    private DatabaseProbe(Builder builder) {
        this.name = builder.name;
        this.dataSource = builder.dataSource;
        this.query = builder.query;
        this.queryTimeout = builder.queryTimeout;
    }

    @Override
    public HealthCheckResult checkBlocking() {
        int timeoutSec = Math.max(1, (int) queryTimeout.getSeconds());
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(timeoutSec);
            stmt.execute(query);
            return HealthCheckResult.healthy(name, "Database connection successful");
        } catch (SQLException e) {
            return HealthCheckResult.builder(name, HealthStatus.UNHEALTHY)
                    .message("Database connection failed: " + e.getMessage())
                    .metadata("sqlState", e.getSQLState())
                    .build();
        }
    }

    public static Builder builder(DataSource dataSource) {
        return new Builder(dataSource);
    }

    public static final class Builder {
        private final DataSource dataSource;
        private String name = InfrastructureProbes.DATABASE;
        private String query = DEFAULT_QUERY;
        private Duration queryTimeout = Duration.ofSeconds(5);

        private Builder(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder query(String query) {
            this.query = Objects.requireNonNull(query, "query");
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout");
            return this;
        }

        public DatabaseProbe build() {
            return new DatabaseProbe(this);
        }
    }
}

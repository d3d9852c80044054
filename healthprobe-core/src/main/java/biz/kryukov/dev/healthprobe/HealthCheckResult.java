package biz.kryukov.dev.healthprobe;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one probe execution. Immutable.
 *
 * <p>{@code classification} is an opaque sensitivity label carried through unmodified;
 * the engine never interprets it.
 */
public final class HealthCheckResult {

    private final String name;
    private final HealthStatus status;
    private final Instant timestamp;
    private final Duration duration;
    private final String message;
    private final Map<String, Object> metadata;
    private final String classification;

    private HealthCheckResult(Builder builder) {
        this.name = builder.name;
        this.status = builder.status;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.duration = builder.duration;
        this.message = builder.message;
        this.metadata = builder.metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.classification = builder.classification;
    }

    /** Probe name. */
    public String name() {
        return name;
    }

    /** Probe status. */
    public HealthStatus status() {
        return status;
    }

    /** Wall-clock time the result was recorded. */
    public Instant timestamp() {
        return timestamp;
    }

    /** Measured execution time. */
    public Duration duration() {
        return duration;
    }

    /** Execution time in milliseconds. */
    public long durationMillis() {
        return duration.toMillis();
    }

    /** Human-readable explanation, or {@code null}. */
    public String message() {
        return message;
    }

    /** Probe-specific diagnostic payload (unmodifiable, never null). */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Opaque classification label, or {@code null}. */
    public String classification() {
        return classification;
    }

    /** Returns a copy of this result with the given duration. */
    public HealthCheckResult withDuration(Duration measured) {
        return toBuilder().duration(measured).build();
    }

    /** Returns a builder pre-filled with this result's values. */
    public Builder toBuilder() {
        return new Builder(name, status)
                .timestamp(timestamp)
                .duration(duration)
                .message(message)
                .metadata(metadata)
                .classification(classification);
    }

    public static Builder builder(String name, HealthStatus status) {
        return new Builder(name, status);
    }

    public static HealthCheckResult healthy(String name, String message) {
        return builder(name, HealthStatus.HEALTHY).message(message).build();
    }

    public static HealthCheckResult degraded(String name, String message) {
        return builder(name, HealthStatus.DEGRADED).message(message).build();
    }

    public static HealthCheckResult unhealthy(String name, String message) {
        return builder(name, HealthStatus.UNHEALTHY).message(message).build();
    }

    @Override
    public String toString() {
        return "HealthCheckResult{name=" + name + ", status=" + status.label()
                + ", duration=" + duration.toMillis() + "ms"
                + (message != null ? ", message=" + message : "") + "}";
    }

    /** Builder for {@link HealthCheckResult}. */
    public static final class Builder {
        private final String name;
        private final HealthStatus status;
        private Instant timestamp;
        private Duration duration = Duration.ZERO;
        private String message;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String classification;

        private Builder(String name, HealthStatus status) {
            this.name = Objects.requireNonNull(name, "name");
            this.status = Objects.requireNonNull(status, "status");
        }

        /** Sets the record time; defaults to the build time. */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = Objects.requireNonNull(duration, "duration");
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /** Adds a single metadata entry. */
        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        /** Adds all given metadata entries. */
        public Builder metadata(Map<String, ?> entries) {
            if (entries != null) {
                entries.forEach(this::metadata);
            }
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public HealthCheckResult build() {
            return new HealthCheckResult(this);
        }
    }
}

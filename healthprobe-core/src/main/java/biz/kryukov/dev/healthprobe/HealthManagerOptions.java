package biz.kryukov.dev.healthprobe;

import java.time.Duration;

/**
 * Construction-time options of a {@link HealthManager}. Immutable, created via Builder.
 */
public final class HealthManagerOptions {

    /** Default check interval: 30 seconds. */
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
    /** Default check timeout: 10 seconds. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final boolean enableCompliance;
    private final boolean enableAutoCheck;
    private final Duration checkInterval;
    private final Duration timeout;

    private HealthManagerOptions(Builder builder) {
        this.enableCompliance = builder.enableCompliance;
        this.enableAutoCheck = builder.enableAutoCheck;
        this.checkInterval = builder.checkInterval;
        this.timeout = builder.timeout;
    }

    /** Returns whether the compliance probe bundle may be registered. */
    public boolean enableCompliance() {
        return enableCompliance;
    }

    /** Returns whether newly registered probes get a periodic timer by default. */
    public boolean enableAutoCheck() {
        return enableAutoCheck;
    }

    /** Returns the default probe interval. */
    public Duration checkInterval() {
        return checkInterval;
    }

    /** Returns the default probe timeout. */
    public Duration timeout() {
        return timeout;
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns options with all default values. */
    public static HealthManagerOptions defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return "HealthManagerOptions{enableCompliance=" + enableCompliance
                + ", enableAutoCheck=" + enableAutoCheck
                + ", checkInterval=" + checkInterval
                + ", timeout=" + timeout + "}";
    }

    /** Builder for {@link HealthManagerOptions}. */
    public static final class Builder {
        private boolean enableCompliance = true;
        private boolean enableAutoCheck = true;
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private Duration timeout = DEFAULT_TIMEOUT;

        private Builder() {}

        public Builder enableCompliance(boolean enableCompliance) {
            this.enableCompliance = enableCompliance;
            return this;
        }

        public Builder enableAutoCheck(boolean enableAutoCheck) {
            this.enableAutoCheck = enableAutoCheck;
            return this;
        }

        /** Sets the default interval for probes without their own. */
        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        /** Sets the default timeout for probes without their own. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /** Builds and validates the options. */
        public HealthManagerOptions build() {
            validate();
            return new HealthManagerOptions(this);
        }

        private void validate() {
            if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
                throw new ValidationException("checkInterval must be positive, got " + checkInterval);
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new ValidationException("timeout must be positive, got " + timeout);
            }
        }
    }
}

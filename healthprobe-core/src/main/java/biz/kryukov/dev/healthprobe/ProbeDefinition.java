package biz.kryukov.dev.healthprobe;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Probe descriptor: name, operation, timing overrides, criticality and tags. Immutable.
 *
 * <p>Timing fields left unset fall back to the manager's {@link HealthManagerOptions}.
 */
public final class ProbeDefinition {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
    private static final int MAX_NAME_LENGTH = 128;

    private final String name;
    private final HealthProbe probe;
    private final Duration timeout;
    private final Duration interval;
    private final Boolean autoCheck;
    private final boolean critical;
    private final Set<String> tags;

    private ProbeDefinition(Builder builder) {
        this.name = builder.name;
        this.probe = builder.probe;
        this.timeout = builder.timeout;
        this.interval = builder.interval;
        this.autoCheck = builder.autoCheck;
        this.critical = builder.critical;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
    }

    /** Returns the probe name. */
    public String name() {
        return name;
    }

    /** Returns the probe operation. */
    public HealthProbe probe() {
        return probe;
    }

    /** Returns the timeout override, or {@code null} to use the manager default. */
    public Duration timeout() {
        return timeout;
    }

    /** Returns the interval override, or {@code null} to use the manager default. */
    public Duration interval() {
        return interval;
    }

    /** Returns the auto-check override, or {@code null} to use the manager default. */
    public Boolean autoCheck() {
        return autoCheck;
    }

    /** Returns whether an unhealthy result of this probe fails the whole system. */
    public boolean critical() {
        return critical;
    }

    /** Returns the tags (unmodifiable, in insertion order). */
    public Set<String> tags() {
        return tags;
    }

    /** Returns the effective timeout. */
    public Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    /** Returns the effective interval. */
    public Duration intervalOr(Duration fallback) {
        return interval != null ? interval : fallback;
    }

    /** Returns whether a periodic timer applies to this probe. */
    public boolean autoCheckOr(boolean fallback) {
        return autoCheck != null ? autoCheck : fallback;
    }

    @Override
    public String toString() {
        return "ProbeDefinition{name=" + name + ", critical=" + critical + ", tags=" + tags + "}";
    }

    /**
     * Validates that the probe name matches the naming rules.
     *
     * @param name probe name
     * @throws ValidationException if the name is invalid
     */
    public static void validateName(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    "probe name must be 1-" + MAX_NAME_LENGTH + " characters, got '" + name + "'");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException(
                    "probe name must match " + NAME_PATTERN.pattern() + ", got '" + name + "'");
        }
    }

    /**
     * Creates a new builder for a probe.
     *
     * @param name probe name
     * @return a new builder instance
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Builder for {@link ProbeDefinition}. */
    public static final class Builder {
        private final String name;
        private HealthProbe probe;
        private Duration timeout;
        private Duration interval;
        private Boolean autoCheck;
        private boolean critical;
        private final Set<String> tags = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Sets an asynchronous operation. */
        public Builder probe(HealthProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        /** Sets a blocking operation, run on the engine's worker pool. */
        public Builder blockingProbe(BlockingHealthProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /** Overrides the manager-wide auto-check default for this probe. */
        public Builder autoCheck(boolean autoCheck) {
            this.autoCheck = autoCheck;
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag"));
            return this;
        }

        public Builder tags(String... tags) {
            for (String tag : tags) {
                tag(tag);
            }
            return this;
        }

        /** Builds and validates the definition. */
        public ProbeDefinition build() {
            validate();
            return new ProbeDefinition(this);
        }

        private void validate() {
            validateName(name);
            if (probe == null) {
                throw new ValidationException("probe '" + name + "' must have an operation");
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new ValidationException(
                        "probe '" + name + "' timeout must be positive, got " + timeout);
            }
            if (interval != null && (interval.isZero() || interval.isNegative())) {
                throw new ValidationException(
                        "probe '" + name + "' interval must be positive, got " + interval);
            }
            for (String tag : tags) {
                if (tag.isBlank()) {
                    throw new ValidationException("probe '" + name + "' has a blank tag");
                }
            }
        }
    }
}

package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.ProbeDefinition;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in compliance probes. Each evaluates a fixed checklist of conditions supplied by
 * the host application; conditions that are not supplied count as failed.
 *
 * <ul>
 *   <li>{@code nsm_compliance}: critical, every 60s, unhealthy on any failure,
 *       classification {@code BEGRENSET}</li>
 *   <li>{@code gdpr_compliance}: critical, every 5m, degraded on any failure,
 *       unhealthy when all fail</li>
 *   <li>{@code digdir_interoperability}: advisory, every 10m, degraded on any failure</li>
 * </ul>
 */
public final class ComplianceProbes {

    public static final String NSM = "nsm_compliance";
    public static final String GDPR = "gdpr_compliance";
    public static final String DIGDIR = "digdir_interoperability";
    public static final String TAG = "compliance";

    public static final List<String> NSM_CONDITIONS = List.of(
            "encryption_enabled",
            "audit_logging_active",
            "access_controls_configured",
            "security_patches_current"
    );
    public static final List<String> GDPR_CONDITIONS = List.of(
            "data_retention_policies",
            "consent_management",
            "data_processing_records",
            "privacy_by_design"
    );
    public static final List<String> DIGDIR_CONDITIONS = List.of(
            "interoperability_standards",
            "api_catalogue_published"
    );

    /** Classification label attached to {@code nsm_compliance} results. */
    public static final String NSM_CLASSIFICATION = "BEGRENSET";

    static final Duration NSM_INTERVAL = Duration.ofMinutes(1);
    static final Duration GDPR_INTERVAL = Duration.ofMinutes(5);
    static final Duration DIGDIR_INTERVAL = Duration.ofMinutes(10);

    private final Map<String, ComplianceCondition> conditions;

    private ComplianceProbes(Builder builder) {
        this.conditions = Map.copyOf(builder.conditions);
    }

    /** Returns the probe definitions of this bundle. */
    public List<ProbeDefinition> definitions() {
        return List.of(
                ProbeDefinition.builder(NSM)
                        .blockingProbe(new ComplianceChecklist(NSM, "NSM", NSM_CONDITIONS,
                                conditions, 1, NSM_CLASSIFICATION,
                                "All NSM compliance checks passed"))
                        .interval(NSM_INTERVAL)
                        .critical(true)
                        .tags(TAG, "nsm")
                        .build(),
                ProbeDefinition.builder(GDPR)
                        .blockingProbe(new ComplianceChecklist(GDPR, "GDPR", GDPR_CONDITIONS,
                                conditions, GDPR_CONDITIONS.size(), null,
                                "GDPR compliance verified"))
                        .interval(GDPR_INTERVAL)
                        .critical(true)
                        .tags(TAG, "gdpr")
                        .build(),
                ProbeDefinition.builder(DIGDIR)
                        .blockingProbe(new ComplianceChecklist(DIGDIR, "DigDir", DIGDIR_CONDITIONS,
                                conditions, ComplianceChecklist.NEVER_UNHEALTHY, null,
                                "DigDir interoperability standards met"))
                        .interval(DIGDIR_INTERVAL)
                        .critical(false)
                        .tags(TAG, "digdir")
                        .build()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ComplianceProbes}. */
    public static final class Builder {
        private final Map<String, ComplianceCondition> conditions = new HashMap<>();

        private Builder() {}

        /**
         * Supplies the check for one named condition of any of the three checklists.
         *
         * @throws IllegalArgumentException if no checklist contains {@code name}
         */
        public Builder condition(String name, ComplianceCondition condition) {
            if (!NSM_CONDITIONS.contains(name) && !GDPR_CONDITIONS.contains(name)
                    && !DIGDIR_CONDITIONS.contains(name)) {
                throw new IllegalArgumentException("Unknown compliance condition: " + name);
            }
            conditions.put(name, Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public ComplianceProbes build() {
            return new ComplianceProbes(this);
        }
    }
}

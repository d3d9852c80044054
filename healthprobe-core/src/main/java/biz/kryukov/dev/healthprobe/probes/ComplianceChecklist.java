package biz.kryukov.dev.healthprobe.probes;

import biz.kryukov.dev.healthprobe.BlockingHealthProbe;
import biz.kryukov.dev.healthprobe.FailureClassifier;
import biz.kryukov.dev.healthprobe.HealthCheckResult;
import biz.kryukov.dev.healthprobe.HealthStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probe evaluating a fixed list of named {@link ComplianceCondition}s.
 *
 * <p>No failures is healthy; at least {@code unhealthyThreshold} failures is unhealthy;
 * anything in between is degraded. A condition that is missing or throws counts as failed.
 */
final class ComplianceChecklist implements BlockingHealthProbe {

    /** Threshold meaning the checklist never reports unhealthy. */
    static final int NEVER_UNHEALTHY = Integer.MAX_VALUE;

    private final String probeName;
    private final String regime;
    private final List<String> conditionNames;
    private final Map<String, ComplianceCondition> conditions;
    private final int unhealthyThreshold;
    private final String classification;
    private final String passedMessage;

    ComplianceChecklist(String probeName, String regime, List<String> conditionNames,
                        Map<String, ComplianceCondition> conditions, int unhealthyThreshold,
                        String classification, String passedMessage) {
        this.probeName = probeName;
        this.regime = regime;
        this.conditionNames = List.copyOf(conditionNames);
        this.conditions = new LinkedHashMap<>(conditions);
        this.unhealthyThreshold = unhealthyThreshold;
        this.classification = classification;
        this.passedMessage = passedMessage;
    }

    @Override
    public HealthCheckResult checkBlocking() {
        List<String> failedChecks = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (String conditionName : conditionNames) {
            ComplianceCondition condition = conditions.get(conditionName);
            if (condition == null) {
                failedChecks.add(conditionName);
                errors.put(conditionName, "not configured");
                continue;
            }
            try {
                if (!condition.isSatisfied()) {
                    failedChecks.add(conditionName);
                }
            } catch (Exception e) {
                failedChecks.add(conditionName);
                errors.put(conditionName, FailureClassifier.describe(e));
            }
        }

        HealthStatus status;
        if (failedChecks.isEmpty()) {
            status = HealthStatus.HEALTHY;
        } else if (failedChecks.size() >= unhealthyThreshold) {
            status = HealthStatus.UNHEALTHY;
        } else {
            status = HealthStatus.DEGRADED;
        }

        HealthCheckResult.Builder result = HealthCheckResult.builder(probeName, status)
                .message(failedChecks.isEmpty()
                        ? passedMessage
                        : regime + " compliance issues: " + String.join(", ", failedChecks))
                .metadata("failedChecks", List.copyOf(failedChecks))
                .classification(classification);
        if (!errors.isEmpty()) {
            result.metadata("errors", Map.copyOf(errors));
        }
        return result.build();
    }
}

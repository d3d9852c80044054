package biz.kryukov.dev.healthprobe.probes;

/**
 * One verifiable compliance requirement, e.g. "audit logging is active".
 */
@FunctionalInterface
public interface ComplianceCondition {

    /**
     * @return whether the requirement is currently met
     * @throws Exception if it could not be verified; counted as not met
     */
    boolean isSatisfied() throws Exception;
}

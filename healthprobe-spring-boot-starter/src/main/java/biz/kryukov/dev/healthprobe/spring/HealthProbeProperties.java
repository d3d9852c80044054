package biz.kryukov.dev.healthprobe.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for healthprobe via application.yml / application.properties.
 *
 * <pre>
 * healthprobe:
 *   enable-compliance: true
 *   enable-auto-check: true
 *   check-interval: 30s
 *   timeout: 10s
 *   infrastructure:
 *     enabled: true
 *     disk-path: /var/lib/app
 *   compliance:
 *     enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "healthprobe")
public class HealthProbeProperties {

    private boolean enableCompliance = true;
    private boolean enableAutoCheck = true;
    private Duration checkInterval;
    private Duration timeout;
    private Infrastructure infrastructure = new Infrastructure();
    private Compliance compliance = new Compliance();

    public boolean isEnableCompliance() {
        return enableCompliance;
    }

    public void setEnableCompliance(boolean enableCompliance) {
        this.enableCompliance = enableCompliance;
    }

    public boolean isEnableAutoCheck() {
        return enableAutoCheck;
    }

    public void setEnableAutoCheck(boolean enableAutoCheck) {
        this.enableAutoCheck = enableAutoCheck;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Infrastructure getInfrastructure() {
        return infrastructure;
    }

    public void setInfrastructure(Infrastructure infrastructure) {
        this.infrastructure = infrastructure;
    }

    public Compliance getCompliance() {
        return compliance;
    }

    public void setCompliance(Compliance compliance) {
        this.compliance = compliance;
    }

    /** Built-in infrastructure probes. */
    public static class Infrastructure {
        private boolean enabled;
        private String diskPath;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDiskPath() {
            return diskPath;
        }

        public void setDiskPath(String diskPath) {
            this.diskPath = diskPath;
        }
    }

    /** Built-in compliance probes; conditions come from a {@code ComplianceProbes} bean. */
    public static class Compliance {
        private boolean enabled;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}

package biz.kryukov.dev.healthprobe.spring;

import biz.kryukov.dev.healthprobe.HealthManager;
import biz.kryukov.dev.healthprobe.HealthManagerOptions;
import biz.kryukov.dev.healthprobe.ProbeDefinition;
import biz.kryukov.dev.healthprobe.probes.ComplianceProbes;
import biz.kryukov.dev.healthprobe.probes.InfrastructureProbes;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for healthprobe: creates a HealthManager bean from application.yml
 * properties and registers every {@link ProbeDefinition} bean with it.
 */
@AutoConfiguration
@ConditionalOnClass(HealthManager.class)
@EnableConfigurationProperties(HealthProbeProperties.class)
public class HealthProbeAutoConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(HealthProbeAutoConfiguration.class);

    /**
     * Creates a {@link HealthManager} bean configured from application properties.
     *
     * @param properties    healthprobe configuration properties
     * @param meterRegistry Micrometer meter registry, if present
     * @param definitions   probe definitions declared as beans
     * @param dataSource    data source for the {@code database} probe, if present
     * @param compliance    compliance conditions, if supplied
     * @return configured HealthManager instance
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HealthManager healthManager(HealthProbeProperties properties,
                                       ObjectProvider<MeterRegistry> meterRegistry,
                                       ObjectProvider<ProbeDefinition> definitions,
                                       ObjectProvider<DataSource> dataSource,
                                       ObjectProvider<ComplianceProbes> compliance) {
        HealthManagerOptions.Builder options = HealthManagerOptions.builder()
                .enableCompliance(properties.isEnableCompliance())
                .enableAutoCheck(properties.isEnableAutoCheck());
        if (properties.getCheckInterval() != null) {
            options.checkInterval(properties.getCheckInterval());
        }
        if (properties.getTimeout() != null) {
            options.timeout(properties.getTimeout());
        }

        HealthManager.Builder builder = HealthManager.builder().options(options.build());
        meterRegistry.ifAvailable(builder::meterRegistry);
        HealthManager manager = builder.build();

        if (properties.getInfrastructure().isEnabled()) {
            InfrastructureProbes.Builder infrastructure = InfrastructureProbes.builder()
                    .dataSource(dataSource.getIfUnique());
            if (properties.getInfrastructure().getDiskPath() != null) {
                infrastructure.diskPath(Path.of(properties.getInfrastructure().getDiskPath()));
            }
            manager.registerInfrastructureChecks(infrastructure.build());
        }
        if (properties.getCompliance().isEnabled()) {
            ComplianceProbes probes = compliance.getIfAvailable();
            if (probes != null) {
                manager.registerComplianceChecks(probes);
            } else {
                LOG.warn("healthprobe: no ComplianceProbes bean configured, skipping compliance checks");
            }
        }
        definitions.orderedStream().forEach(manager::registerCheck);

        return manager;
    }

    /** Creates a lifecycle bean stopping the periodic checks on shutdown. */
    @Bean
    @ConditionalOnMissingBean
    public HealthProbeLifecycle healthProbeLifecycle(HealthManager healthManager) {
        return new HealthProbeLifecycle(healthManager);
    }

    /** Creates a Spring Boot Actuator HealthIndicator for the aggregate probe health. */
    @Bean
    @ConditionalOnMissingBean
    public HealthProbeIndicator healthProbeIndicator(HealthManager healthManager) {
        return new HealthProbeIndicator(healthManager);
    }
}

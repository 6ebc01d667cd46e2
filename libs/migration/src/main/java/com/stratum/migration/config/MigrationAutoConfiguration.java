package com.stratum.migration.config;

import com.stratum.migration.MigrationService;
import com.stratum.migration.telemetry.MigrationMetrics;
import com.stratum.migration.telemetry.MigrationTracing;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

/**
 * Spring Boot wiring for the migration engine.
 *
 * <p>WHY: the engine gets its own connection source built from {@link MigrationProperties},
 * separate from any pool the host application uses for request traffic. It is not registered as
 * a {@link DataSource} bean, so the host's primary datasource stays untouched.
 * Metrics and tracing attach to the host's {@link MeterRegistry} and {@link OpenTelemetry} when
 * present and fall back to no-ops otherwise.
 *
 * <p>Applications that have no datasource of their own (such as the operator CLI) should exclude
 * {@link DataSourceAutoConfiguration}:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
 * }</pre>
 */
@AutoConfiguration
@EnableConfigurationProperties(MigrationProperties.class)
@ConditionalOnProperty(prefix = MigrationProperties.PREFIX, name = "enabled", havingValue = "true")
public class MigrationAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MigrationAutoConfiguration.class);

    /** Bean name of the actuator health contributor ({@code migrationIntegrity}). */
    public static final String HEALTH_INDICATOR_BEAN = "migrationIntegrityHealthIndicator";

    @Bean
    @ConditionalOnMissingBean
    public MigrationMetrics migrationMetrics(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        return meterRegistry != null
                ? new MigrationMetrics(meterRegistry)
                : MigrationMetrics.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationTracing migrationTracing(ObjectProvider<OpenTelemetry> openTelemetry) {
        OpenTelemetry otel = openTelemetry.getIfAvailable();
        return otel != null
                ? new MigrationTracing(otel.getTracer(MigrationTracing.INSTRUMENTATION_NAME))
                : MigrationTracing.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationService migrationService(
            MigrationProperties properties, MigrationMetrics metrics, MigrationTracing tracing) {
        return new MigrationService(
                createDataSource(properties),
                properties.toSettings(),
                metrics,
                tracing,
                Clock.systemUTC());
    }

    @Bean
    @ConditionalOnProperty(
            prefix = MigrationProperties.PREFIX,
            name = "run-on-startup",
            havingValue = "true")
    public MigrationStartupInitializer migrationStartupInitializer(
            MigrationService migrationService) {
        return new MigrationStartupInitializer(migrationService);
    }

    /** Only active when Spring Boot Actuator is on the classpath. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean(name = HEALTH_INDICATOR_BEAN)
        @ConditionalOnMissingBean(name = HEALTH_INDICATOR_BEAN)
        public IntegrityHealthIndicator migrationIntegrityHealthIndicator(
                MigrationService migrationService) {
            return new IntegrityHealthIndicator(migrationService);
        }
    }

    // ── Private Helpers ──

    /**
     * Each migration command borrows exactly one connection and closes it, so a plain
     * driver-backed source is enough and leaves no pool to shut down.
     */
    private DataSource createDataSource(MigrationProperties properties) {
        log.info("Migration datasource configured for {}", properties.url());
        return DataSourceBuilder.create()
                .type(SimpleDriverDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }
}

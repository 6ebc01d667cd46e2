package com.stratum.migration.config;

import static com.stratum.migration.MigrationFixtures.writeScript;
import static org.assertj.core.api.Assertions.assertThat;

import com.stratum.migration.MigrationExecutionException;
import com.stratum.migration.MigrationFixtures;
import com.stratum.migration.MigrationService;
import com.stratum.migration.telemetry.MigrationMetrics;
import com.stratum.migration.telemetry.MigrationTracing;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("MigrationAutoConfiguration")
class MigrationAutoConfigurationTest {

    @TempDir Path directory;

    private ApplicationContextRunner runner;

    @BeforeEach
    void setUp() {
        runner =
                new ApplicationContextRunner()
                        .withConfiguration(
                                AutoConfigurations.of(MigrationAutoConfiguration.class));
    }

    private String[] enabled() {
        return new String[] {
            "stratum.migration.enabled=true",
            "stratum.migration.url=" + MigrationFixtures.uniqueH2Url(),
            "stratum.migration.username=sa",
            "stratum.migration.directory=" + directory
        };
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("creates nothing unless enabled")
        void disabledByDefault() {
            runner.run(context -> assertThat(context).doesNotHaveBean(MigrationService.class));
        }

        @Test
        @DisplayName("creates the service, telemetry and health beans when enabled")
        void enabledBeans() {
            runner.withPropertyValues(enabled())
                    .run(
                            context -> {
                                assertThat(context).hasSingleBean(MigrationService.class);
                                assertThat(context).hasSingleBean(MigrationMetrics.class);
                                assertThat(context).hasSingleBean(MigrationTracing.class);
                                assertThat(context)
                                        .hasBean(MigrationAutoConfiguration.HEALTH_INDICATOR_BEAN);
                                assertThat(context)
                                        .doesNotHaveBean(MigrationStartupInitializer.class);
                            });
        }

        @Test
        @DisplayName("does not register a DataSource bean of its own")
        void noDataSourceBean() {
            runner.withPropertyValues(enabled())
                    .run(context -> assertThat(context).doesNotHaveBean(DataSource.class));
        }

        @Test
        @DisplayName("binds the configured directory and ledger table")
        void bindsSettings() {
            runner.withPropertyValues(enabled())
                    .withPropertyValues("stratum.migration.ledger-table=app_ledger")
                    .run(
                            context -> {
                                var settings = context.getBean(MigrationService.class).settings();
                                assertThat(settings.directory()).isEqualTo(directory);
                                assertThat(settings.ledgerTable()).isEqualTo("app_ledger");
                            });
        }

        @Test
        @DisplayName("uses the application's MeterRegistry when one exists")
        void usesHostRegistry() {
            runner.withPropertyValues(enabled())
                    .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                    .run(
                            context ->
                                    assertThat(context.getBean(MigrationMetrics.class).registry())
                                            .isSameAs(context.getBean(MeterRegistry.class)));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("fails startup without a JDBC url")
        void missingUrl() {
            runner.withPropertyValues("stratum.migration.enabled=true")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("fails startup for a ledger table that is not a plain identifier")
        void unsafeLedgerTable() {
            runner.withPropertyValues(enabled())
                    .withPropertyValues("stratum.migration.ledger-table=bad-name")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Nested
    @DisplayName("Startup hook")
    class StartupHook {

        @Test
        @DisplayName("applies pending migrations while the context starts")
        void appliesOnStartup() {
            writeScript(directory, "001_init.sql", "CREATE TABLE startup_check (id INT);");

            runner.withPropertyValues(enabled())
                    .withPropertyValues("stratum.migration.run-on-startup=true")
                    .run(
                            context -> {
                                assertThat(context).hasSingleBean(MigrationStartupInitializer.class);
                                assertThat(
                                                context.getBean(MigrationService.class)
                                                        .status()
                                                        .appliedCount())
                                        .isEqualTo(1);
                            });
        }

        @Test
        @DisplayName("a failing migration aborts startup")
        void failureAbortsStartup() {
            writeScript(directory, "001_bad.sql", "INSERT INTO no_such_table VALUES (1);");

            runner.withPropertyValues(enabled())
                    .withPropertyValues("stratum.migration.run-on-startup=true")
                    .run(
                            context ->
                                    assertThat(context)
                                            .getFailure()
                                            .hasRootCauseInstanceOf(SQLException.class)
                                            .hasStackTraceContaining(
                                                    MigrationExecutionException.class.getName()));
        }
    }
}

package com.stratum.migration.config;

import com.stratum.migration.ApplyResult;
import com.stratum.migration.MigrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;

/**
 * Applies pending migrations while the application context is refreshed.
 *
 * <p>Runs as a bean initialization step, so any failure (drift, a failing script, a held lock)
 * aborts startup before the host serves traffic.
 */
public class MigrationStartupInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(MigrationStartupInitializer.class);

    private final MigrationService migrationService;

    public MigrationStartupInitializer(MigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @Override
    public void afterPropertiesSet() {
        log.info(
                "Applying pending migrations from {} before startup completes",
                migrationService.settings().directory());
        ApplyResult result = migrationService.migrate();
        if (result.upToDateAlready()) {
            log.info("Schema is up to date");
        } else {
            log.info("Applied {} migration(s) on startup", result.appliedCount());
        }
    }
}

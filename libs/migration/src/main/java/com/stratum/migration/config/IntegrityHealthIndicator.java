package com.stratum.migration.config;

import com.stratum.migration.IntegrityViolation;
import com.stratum.migration.MigrationService;
import com.stratum.migration.ValidationReport;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/**
 * Reports {@code DOWN} when an applied migration script was modified or deleted after it was
 * applied.
 */
public class IntegrityHealthIndicator extends AbstractHealthIndicator {

    private final MigrationService migrationService;

    public IntegrityHealthIndicator(MigrationService migrationService) {
        super("Migration integrity check failed");
        this.migrationService = migrationService;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        ValidationReport report = migrationService.validate();
        builder.withDetail("checked", report.checked());
        if (report.valid()) {
            builder.up();
            return;
        }
        builder.down()
                .withDetail(
                        "violations",
                        report.violations().stream().map(IntegrityViolation::describe).toList());
    }
}

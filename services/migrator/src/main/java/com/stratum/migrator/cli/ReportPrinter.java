package com.stratum.migrator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stratum.migration.ApplyResult;
import com.stratum.migration.IntegrityViolation;
import com.stratum.migration.LedgerEntry;
import com.stratum.migration.MigrationDescriptor;
import com.stratum.migration.MigrationException;
import com.stratum.migration.MigrationStatus;
import com.stratum.migration.ResetResult;
import com.stratum.migration.ScaffoldResult;
import com.stratum.migration.ValidationReport;
import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-facing output of the migrator. Results go to stdout, failures to stderr.
 *
 * <p>WHY Jackson for {@code --json}: Spring Boot's default JSON library; {@code JavaTimeModule}
 * renders {@code appliedAt} as an ISO 8601 string.
 */
public class ReportPrinter {

    private static final DateTimeFormatter APPLIED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper;

    public ReportPrinter() {
        this(System.out, System.err);
    }

    public ReportPrinter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.mapper =
                new ObjectMapper()
                        .registerModule(new JavaTimeModule())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void applied(ApplyResult result) {
        if (result.upToDateAlready()) {
            out.println("✓ All migrations are up to date");
            return;
        }
        for (LedgerEntry entry : result.applied()) {
            out.printf(
                    "✓ Migration %s applied successfully (%dms)%n",
                    entry.name(), entry.executionTimeMs());
        }
        out.printf("%n✓ %d migration(s) completed successfully%n", result.appliedCount());
    }

    public void rolledBack(Optional<LedgerEntry> entry) {
        entry.ifPresentOrElse(
                e -> out.printf("✓ Rolled back migration: %s (v%d)%n", e.name(), e.version()),
                () -> out.println("No migrations to rollback"));
    }

    public void reset(ResetResult result) {
        out.printf("Rolled back %d migration(s)%n", result.rolledBack().size());
        for (LedgerEntry entry : result.rolledBack()) {
            out.printf("  ✓ %s (v%d)%n", entry.name(), entry.version());
        }
        out.println();
        out.println("Re-applying all migrations...");
        applied(result.reapplied());
    }

    public void status(MigrationStatus status, boolean json) {
        if (json) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("currentVersion", status.currentVersion());
            document.put("applied", status.applied());
            document.put(
                    "pending",
                    status.pending().stream()
                            .map(d -> Map.of("version", d.version(), "name", d.scriptName()))
                            .toList());
            json(document);
            return;
        }

        out.println();
        out.println("=== Migration Status ===");
        out.println();
        if (status.applied().isEmpty()) {
            out.println("No migrations applied yet");
        } else {
            out.println("Applied migrations:");
            for (LedgerEntry entry : status.applied()) {
                out.printf(
                        "  ✓ %s (v%d) - %s [%dms]%n",
                        entry.name(),
                        entry.version(),
                        APPLIED_AT.format(entry.appliedAt()),
                        entry.executionTimeMs());
            }
        }
        out.println();
        if (status.pending().isEmpty()) {
            out.println("No pending migrations");
        } else {
            out.println("Pending migrations:");
            for (MigrationDescriptor descriptor : status.pending()) {
                out.printf("  ○ %s (v%d)%n", descriptor.scriptName(), descriptor.version());
            }
        }
        out.println();
    }

    public void validation(ValidationReport report, boolean json) {
        if (json) {
            json(report);
            return;
        }
        List<IntegrityViolation> violations = report.violations();
        for (IntegrityViolation violation : violations) {
            err.println("✗ " + violation.describe());
        }
        if (report.valid()) {
            out.printf("✓ All %d applied migration(s) are valid%n", report.checked());
        } else {
            err.printf(
                    "%n✗ Validation failed: %d of %d applied migration(s) have problems%n",
                    violations.size(), report.checked());
        }
    }

    public void created(ScaffoldResult result) {
        out.println("✓ Created migration files:");
        out.println("  Migration: " + result.scriptPath());
        out.println("  Rollback:  " + result.rollbackPath());
    }

    public void usage() {
        usage(out);
    }

    public void usageError() {
        usage(err);
    }

    public void error(String message) {
        err.println("✗ " + message);
    }

    private void usage(PrintStream stream) {
        stream.println();
        stream.println("Usage: stratum-migrator [command] [options]");
        stream.println();
        stream.println("Commands:");
        for (MigratorCommand command : MigratorCommand.values()) {
            stream.printf("  %-10s %s%n", command.keyword(), command.description());
        }
        stream.println();
        stream.println("Options:");
        stream.println("  --version <n>  Specific version for rollback");
        stream.println("  --name <name>  Name for new migration");
        stream.println("  --json         Machine-readable output for status and validate");
        stream.println();
        stream.println("Examples:");
        stream.println("  stratum-migrator                 # Run pending migrations");
        stream.println("  stratum-migrator down            # Rollback last migration");
        stream.println("  stratum-migrator down --version 3");
        stream.println("  stratum-migrator status --json");
        stream.println("  stratum-migrator create --name add_user_fields");
    }

    private void json(Object document) {
        try {
            out.println(mapper.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new MigrationException("Unable to render report as JSON", e);
        }
    }
}

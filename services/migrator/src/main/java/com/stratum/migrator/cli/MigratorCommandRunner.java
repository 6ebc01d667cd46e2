package com.stratum.migrator.cli;

import com.stratum.migration.MigrationService;
import com.stratum.migration.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Dispatches the command given on the command line to {@link MigrationService}.
 *
 * <p>Exit codes: {@code 0} on success; {@code 1} for an unknown command, invalid options, any
 * engine failure, or a {@code validate} run that found violations.
 */
@Component
public class MigratorCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigratorCommandRunner.class);

    public static final int EXIT_SUCCESS = 0;

    private final MigrationService migrationService;
    private final ReportPrinter printer;
    private final CommandFailureHandler failureHandler;

    private int exitCode = EXIT_SUCCESS;

    @Autowired
    public MigratorCommandRunner(MigrationService migrationService) {
        this(migrationService, new ReportPrinter());
    }

    public MigratorCommandRunner(MigrationService migrationService, ReportPrinter printer) {
        this.migrationService = migrationService;
        this.printer = printer;
        this.failureHandler = new CommandFailureHandler(printer);
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Runs one command and returns its exit code. Never throws for command failures. */
    public int execute(String... args) {
        CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (IllegalArgumentException e) {
            printer.error(e.getMessage());
            printer.usageError();
            return CommandFailureHandler.EXIT_FAILURE;
        }

        log.debug("Running migrator command {}", arguments.command());
        try {
            return switch (arguments.command()) {
                case UP -> {
                    printer.applied(migrationService.migrate());
                    yield EXIT_SUCCESS;
                }
                case DOWN -> {
                    printer.rolledBack(migrationService.rollback(arguments.version()));
                    yield EXIT_SUCCESS;
                }
                case STATUS -> {
                    printer.status(migrationService.status(), arguments.json());
                    yield EXIT_SUCCESS;
                }
                case VALIDATE -> {
                    ValidationReport report = migrationService.validate();
                    printer.validation(report, arguments.json());
                    yield report.valid() ? EXIT_SUCCESS : CommandFailureHandler.EXIT_FAILURE;
                }
                case CREATE -> create(arguments);
                case RESET -> {
                    printer.reset(migrationService.reset());
                    yield EXIT_SUCCESS;
                }
                case HELP -> {
                    printer.usage();
                    yield EXIT_SUCCESS;
                }
            };
        } catch (RuntimeException e) {
            return failureHandler.handle(e);
        }
    }

    private int create(CommandLineArguments arguments) {
        if (arguments.name() == null || arguments.name().isBlank()) {
            printer.error("--name is required for create");
            return CommandFailureHandler.EXIT_FAILURE;
        }
        printer.created(migrationService.create(arguments.name()));
        return EXIT_SUCCESS;
    }
}

package com.stratum.migrator.cli;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed migrator arguments.
 *
 * <p>The first positional argument is the command ({@code up} when absent). Options accept both
 * {@code --opt value} and {@code --opt=value}. Options the migrator does not know, such as Spring
 * Boot's own {@code --stratum.migration.url=...}, are ignored here.
 *
 * @param command command to run
 * @param version {@code --version} value, or null
 * @param name {@code --name} value, or null
 * @param json whether {@code --json} was given
 */
public record CommandLineArguments(MigratorCommand command, Long version, String name, boolean json) {

    private static final Logger log = LoggerFactory.getLogger(CommandLineArguments.class);

    public CommandLineArguments {
        if (command == null) {
            command = MigratorCommand.UP;
        }
    }

    public Optional<Long> targetVersion() {
        return Optional.ofNullable(version);
    }

    /**
     * @throws IllegalArgumentException for an unknown command, a missing option value or a
     *     non-numeric {@code --version}
     */
    public static CommandLineArguments parse(String... args) {
        MigratorCommand command = null;
        Long version = null;
        String name = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--help") || arg.equals("-h")) {
                command = MigratorCommand.HELP;
                continue;
            }
            if (arg.startsWith("--")) {
                String option = arg.substring(2);
                String inlineValue = null;
                int equals = option.indexOf('=');
                if (equals >= 0) {
                    inlineValue = option.substring(equals + 1);
                    option = option.substring(0, equals);
                }
                switch (option) {
                    case "json" -> json = true;
                    case "version" -> {
                        String value = inlineValue != null ? inlineValue : valueAt(args, ++i, arg);
                        version = parseVersion(value);
                    }
                    case "name" -> name = inlineValue != null ? inlineValue : valueAt(args, ++i, arg);
                    default -> log.debug("Ignoring option {}", arg);
                }
                continue;
            }
            if (command == null) {
                command =
                        MigratorCommand.fromKeyword(arg)
                                .orElseThrow(
                                        () -> new IllegalArgumentException("Unknown command: " + arg));
            } else {
                log.debug("Ignoring extra argument {}", arg);
            }
        }
        return new CommandLineArguments(command, version, name, json);
    }

    private static String valueAt(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static long parseVersion(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--version must be a number: " + value);
        }
    }
}

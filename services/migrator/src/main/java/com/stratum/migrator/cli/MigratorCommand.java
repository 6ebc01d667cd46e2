package com.stratum.migrator.cli;

import java.util.Locale;
import java.util.Optional;

/** Commands understood by the migrator, with their usage descriptions. */
public enum MigratorCommand {
    UP("up", "Run all pending migrations"),
    DOWN("down", "Rollback the last migration (or --version <n>)"),
    STATUS("status", "Show applied and pending migrations"),
    VALIDATE("validate", "Check applied migrations against the files on disk"),
    CREATE("create", "Create a new migration file and rollback stub (--name <name>)"),
    RESET("reset", "Rollback all migrations and re-run them"),
    HELP("help", "Show this message");

    private final String keyword;
    private final String description;

    MigratorCommand(String keyword, String description) {
        this.keyword = keyword;
        this.description = description;
    }

    public String keyword() {
        return keyword;
    }

    public String description() {
        return description;
    }

    /** Resolves a command word; {@code --help} and {@code -h} are aliases of {@link #HELP}. */
    public static Optional<MigratorCommand> fromKeyword(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String normalized = word.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("--help") || normalized.equals("-h")) {
            return Optional.of(HELP);
        }
        for (MigratorCommand command : values()) {
            if (command.keyword.equals(normalized)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}

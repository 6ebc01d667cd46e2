package com.stratum.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an empty forward script for the next free version together with its rollback stub.
 *
 * <p>Versions are zero-padded to three digits ({@code 007_add_index.sql}). Existing files are never
 * overwritten.
 */
public class MigrationScaffolder {

    private static final Logger log = LoggerFactory.getLogger(MigrationScaffolder.class);

    private static final Pattern UNSAFE = Pattern.compile("[^a-z0-9_]+");

    private static final String LINE = System.lineSeparator();

    private final MigrationCatalog catalog;
    private final Clock clock;
    private final String author;

    public MigrationScaffolder(MigrationCatalog catalog) {
        this(catalog, Clock.systemDefaultZone(), System.getProperty("user.name", "Unknown"));
    }

    public MigrationScaffolder(MigrationCatalog catalog, Clock clock, String author) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        this.catalog = catalog;
        this.clock = clock;
        this.author = author == null || author.isBlank() ? "Unknown" : author;
    }

    /**
     * @param name free-form name; lower-cased with every run of other characters replaced by
     *     {@code _}
     * @throws IllegalArgumentException if nothing usable remains of {@code name}
     * @throws MigrationException if a file cannot be written or already exists
     */
    public ScaffoldResult create(String name) {
        String safeName = sanitize(name);
        long version = catalog.nextVersion();
        String fileName = String.format("%03d_%s%s", version, safeName, MigrationCatalog.SCRIPT_SUFFIX);
        Path script = catalog.directory().resolve(fileName);
        Path rollback = catalog.rollbackPathFor(fileName);
        String description = name.trim().replace('_', ' ');

        String forward =
                "-- Migration: " + fileName + LINE
                        + "-- Description: " + description + LINE
                        + "-- Author: " + author + LINE
                        + "-- Date: " + LocalDate.now(clock) + LINE
                        + LINE
                        + "-- Your migration SQL here" + LINE;
        String reverse =
                "-- Rollback for: " + fileName + LINE
                        + "-- Description: Rollback " + description + LINE
                        + LINE
                        + "-- Your rollback SQL here" + LINE;

        try {
            Files.createDirectories(catalog.rollbackDirectory());
            write(script, forward);
            try {
                write(rollback, reverse);
            } catch (IOException e) {
                deleteQuietly(script, e);
                throw e;
            }
        } catch (FileAlreadyExistsException e) {
            throw new MigrationException("Refusing to overwrite existing file " + e.getFile(), e);
        } catch (IOException e) {
            throw new MigrationException("Unable to create migration " + fileName, e);
        }
        log.info("Created migration {} and rollback {}", script, rollback);
        return new ScaffoldResult(version, script, rollback);
    }

    /** {@code "Add User-Index"} becomes {@code add_user_index}. */
    static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Migration name is required");
        }
        String safe = UNSAFE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        if (safe.replace("_", "").isEmpty()) {
            throw new IllegalArgumentException("Migration name has no usable characters: " + name);
        }
        return safe;
    }

    /** Removes a half-written pair; a failure to delete is attached to {@code cause}. */
    private static void deleteQuietly(Path path, IOException cause) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static void write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    }
}

package com.stratum.migration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers forward migration scripts and their paired rollback scripts in a directory.
 *
 * <p>Forward scripts are named {@code <version>_<name>.sql}; the version prefix may be zero-padded
 * or not. Rollback scripts live in the {@code rollback} subdirectory under the same name with the
 * {@code .sql} suffix replaced by {@code .rollback.sql}.
 *
 * <p>Descriptors are ordered by numeric version, so {@code 9_x.sql} always sorts before {@code
 * 10_y.sql} whatever the padding or the order the filesystem lists them in.
 */
public class MigrationCatalog {

    private static final Logger log = LoggerFactory.getLogger(MigrationCatalog.class);

    public static final String SCRIPT_SUFFIX = ".sql";

    public static final String ROLLBACK_SUFFIX = ".rollback.sql";

    public static final String ROLLBACK_DIRECTORY = "rollback";

    private static final String ROLLBACK_MARKER = ".rollback.";

    private static final Pattern LEADING_VERSION = Pattern.compile("^(\\d+)");

    private static final Pattern SCRIPT_NAME = Pattern.compile("^(\\d+)_(.+)\\.sql$");

    private final Path directory;

    public MigrationCatalog(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path rollbackDirectory() {
        return directory.resolve(ROLLBACK_DIRECTORY);
    }

    /**
     * Lists every forward migration in ascending version order.
     *
     * <p>A missing directory is created and reported as empty.
     *
     * @throws MalformedVersionException if a {@code .sql} file does not follow the naming convention
     * @throws DuplicateVersionException if two scripts share a version
     */
    public List<MigrationDescriptor> listAll() {
        if (Files.notExists(directory)) {
            createDirectory();
            return List.of();
        }
        if (!Files.isDirectory(directory)) {
            throw new MigrationException("Migrations path is not a directory: " + directory);
        }

        List<Path> scripts;
        try (Stream<Path> files = Files.list(directory)) {
            scripts =
                    files.filter(Files::isRegularFile)
                            .filter(MigrationCatalog::isForwardScript)
                            .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                            .toList();
        } catch (IOException e) {
            throw new MigrationException("Unable to list migrations in " + directory, e);
        }

        Map<Long, MigrationDescriptor> byVersion = new TreeMap<>();
        for (Path script : scripts) {
            MigrationDescriptor descriptor = describe(script);
            MigrationDescriptor existing = byVersion.putIfAbsent(descriptor.version(), descriptor);
            if (existing != null) {
                throw new DuplicateVersionException(
                        descriptor.version(),
                        List.of(existing.scriptName(), descriptor.scriptName()));
            }
        }
        return List.copyOf(byVersion.values());
    }

    /**
     * Parses the leading integer of a script identifier.
     *
     * @throws MalformedVersionException if there is no leading integer or it does not fit a long
     */
    public static long parseVersion(String identifier) {
        Matcher matcher = LEADING_VERSION.matcher(identifier);
        if (!matcher.find()) {
            throw new MalformedVersionException(identifier, "no leading version number");
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new MalformedVersionException(identifier, "version number is out of range");
        }
    }

    /** Resolves a ledger name back to its forward script, if the file is still present. */
    public Optional<Path> findScript(String scriptName) {
        if (!isPlainFileName(scriptName)) {
            return Optional.empty();
        }
        Path script = directory.resolve(scriptName);
        return Files.isRegularFile(script) ? Optional.of(script) : Optional.empty();
    }

    /** Resolves the rollback script paired with a forward script name, if present. */
    public Optional<Path> findRollbackScript(String scriptName) {
        if (!isPlainFileName(scriptName)) {
            return Optional.empty();
        }
        Path rollback = rollbackPathFor(scriptName);
        return Files.isRegularFile(rollback) ? Optional.of(rollback) : Optional.empty();
    }

    /** Where the rollback script for {@code scriptName} is expected to live. */
    public Path rollbackPathFor(String scriptName) {
        return rollbackDirectory().resolve(rollbackNameFor(scriptName));
    }

    /** {@code 002_add_col.sql} becomes {@code 002_add_col.rollback.sql}. */
    public static String rollbackNameFor(String scriptName) {
        String base =
                scriptName.endsWith(SCRIPT_SUFFIX)
                        ? scriptName.substring(0, scriptName.length() - SCRIPT_SUFFIX.length())
                        : scriptName;
        return base + ROLLBACK_SUFFIX;
    }

    /** One past the highest version on disk, or 1 for an empty catalog. */
    public long nextVersion() {
        List<MigrationDescriptor> all = listAll();
        return all.isEmpty() ? 1 : all.get(all.size() - 1).version() + 1;
    }

    /** Reads the exact bytes of a script; checksums are computed over these bytes. */
    public byte[] read(Path script) {
        try {
            return Files.readAllBytes(script);
        } catch (IOException e) {
            throw new MigrationException("Unable to read migration script " + script, e);
        }
    }

    private MigrationDescriptor describe(Path script) {
        String fileName = script.getFileName().toString();
        Matcher matcher = SCRIPT_NAME.matcher(fileName);
        long version = parseVersion(fileName);
        if (!matcher.matches()) {
            throw new MalformedVersionException(fileName, "expected <version>_<name>.sql");
        }
        Path rollback = findRollbackScript(fileName).orElse(null);
        return new MigrationDescriptor(version, matcher.group(2), script, rollback);
    }

    private void createDirectory() {
        try {
            Files.createDirectories(directory);
            log.info("Created migrations directory {}", directory);
        } catch (IOException e) {
            throw new MigrationException("Unable to create migrations directory " + directory, e);
        }
    }

    private static boolean isForwardScript(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(SCRIPT_SUFFIX) && !name.contains(ROLLBACK_MARKER);
    }

    private static boolean isPlainFileName(String name) {
        return name != null
                && !name.isBlank()
                && !name.contains("/")
                && !name.contains("\\")
                && !name.equals("..")
                && !name.equals(".");
    }

    /** Script names in catalog order; used for log and report output. */
    static List<String> names(List<MigrationDescriptor> descriptors) {
        List<String> names = new ArrayList<>(descriptors.size());
        descriptors.forEach(d -> names.add(d.scriptName()));
        return names;
    }
}

package com.stratum.migrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Stratum Migrator: operator command line for the migration engine.
 *
 * <p>WHY: operators need to apply, inspect and roll back migrations without starting the
 * application that owns the schema. This is a non-web Spring Boot application: the migration
 * auto-configuration builds the {@code MigrationService} from {@code stratum.migration.*}, a
 * {@link org.springframework.boot.CommandLineRunner} dispatches the command, and the process exits
 * with the command's exit code.
 *
 * <pre>
 * java -jar stratum-migrator.jar up
 * java -jar stratum-migrator.jar down --version 3
 * java -jar stratum-migrator.jar status --json
 * </pre>
 *
 * <p>{@link DataSourceAutoConfiguration} is excluded: the migration engine builds its own
 * connection source and the CLI has no other use for one.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class MigratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MigratorApplication.class, args)));
    }
}

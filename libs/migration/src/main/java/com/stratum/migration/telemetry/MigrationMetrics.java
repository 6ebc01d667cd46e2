package com.stratum.migration.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.time.Duration;

/**
 * Micrometer meters for migration steps.
 *
 * <p>Every meter carries an {@code operation} tag ({@value #OPERATION_APPLY} or {@value
 * #OPERATION_ROLLBACK}). Versions are not used as tags: they are unbounded.
 */
public final class MigrationMetrics {

    public static final String APPLIED = "stratum.migrations.applied";

    public static final String ROLLED_BACK = "stratum.migrations.rolled_back";

    public static final String FAILED = "stratum.migrations.failed";

    public static final String DURATION = "stratum.migration.duration";

    public static final String TAG_OPERATION = "operation";

    public static final String OPERATION_APPLY = "apply";

    public static final String OPERATION_ROLLBACK = "rollback";

    private final MeterRegistry registry;

    /**
     * @param registry the registry meters are registered with (e.g. the application's Prometheus
     *     registry)
     */
    public MigrationMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Metrics backed by an empty composite registry, which records nothing. */
    public static MigrationMetrics noop() {
        return new MigrationMetrics(new CompositeMeterRegistry());
    }

    public void recordApplied(Duration elapsed) {
        counter(APPLIED, "Migrations applied", OPERATION_APPLY).increment();
        timer(OPERATION_APPLY).record(elapsed);
    }

    public void recordRolledBack(Duration elapsed) {
        counter(ROLLED_BACK, "Migrations rolled back", OPERATION_ROLLBACK).increment();
        timer(OPERATION_ROLLBACK).record(elapsed);
    }

    public void recordFailure(String operation) {
        counter(FAILED, "Migration steps that failed and were rolled back", operation)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description, String operation) {
        return Counter.builder(name)
                .description(description)
                .tag(TAG_OPERATION, operation)
                .register(registry);
    }

    private Timer timer(String operation) {
        return Timer.builder(DURATION)
                .description("Time spent executing a migration step, including commit")
                .tag(TAG_OPERATION, operation)
                .register(registry);
    }
}

package com.stratum.migration.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Supplier;

/**
 * Wraps each migration step in an OpenTelemetry span carrying the migration version and script
 * name.
 *
 * <p>Only the API is used here. The host application configures the SDK (exporter, sampler); with
 * no SDK installed the spans are no-ops.
 */
public final class MigrationTracing {

    public static final String INSTRUMENTATION_NAME = "com.stratum.migration";

    public static final String ATTR_VERSION = "migration.version";

    public static final String ATTR_SCRIPT = "migration.script";

    private final Tracer tracer;

    public MigrationTracing(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public static MigrationTracing noop() {
        return new MigrationTracing(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs {@code work} inside a new span. A failure is recorded on the span and rethrown.
     *
     * @param spanName span name (e.g. {@code migration.apply})
     * @param version migration version
     * @param scriptName script file name
     * @param work the step to run
     * @return whatever {@code work} returns
     */
    public <T> T inSpan(String spanName, long version, String scriptName, Supplier<T> work) {
        Span span =
                tracer.spanBuilder(spanName)
                        .setSpanKind(SpanKind.INTERNAL)
                        .setAttribute(ATTR_VERSION, version)
                        .setAttribute(ATTR_SCRIPT, scriptName)
                        .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}

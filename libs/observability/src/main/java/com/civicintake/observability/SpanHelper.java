package com.civicintake.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs work inside a span and copies the
 * current {@link CorrelationContext} onto it.
 * <p>
 * Only the API is used here. Whether spans are exported depends on the SDK the application
 * installs; without one every span is a no-op.
 */
public final class SpanHelper {

    /** Span attribute holding the correlation id. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Span attribute holding the authenticated user id. */
    public static final String ATTR_USER_ID = "user.id";

    private static final String INSTRUMENTATION_NAME = "com.civicintake";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * A helper whose spans go nowhere.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs {@code work} inside a new internal span. The span is marked as failed, with the
     * exception recorded, when {@code work} throws; the exception is rethrown unchanged.
     *
     * @param attributes extra span attributes
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Sets an attribute on whichever span is current, if any.
     */
    public static void annotate(String key, String value) {
        if (value != null) {
            Span.current().setAttribute(key, value);
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}

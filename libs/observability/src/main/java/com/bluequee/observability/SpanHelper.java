package com.bluequee.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags each span with the bound
 * {@link CorrelationContext}.
 *
 * <p>Does NOT configure the SDK. Without an SDK the API hands out no-op tracers and this class
 * costs nothing.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_ORGANIZATION_ID = "organization.id";
    public static final String ATTR_USER_ID = "user.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside an INTERNAL span. Runtime exceptions are recorded on the span and
     * rethrown unchanged.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Runs {@code work} inside an INTERNAL span carrying the given extra attributes.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> tagWithCorrelation(span, ctx));

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, Supplier)}. */
    public void runInSpan(String spanName, Runnable work) {
        inSpan(
                spanName,
                () -> {
                    work.run();
                    return null;
                });
    }

    private static void tagWithCorrelation(Span span, CorrelationContext ctx) {
        span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
        if (ctx.organizationId() != null) {
            span.setAttribute(ATTR_ORGANIZATION_ID, ctx.organizationId().longValue());
        }
        if (ctx.userId() != null) {
            span.setAttribute(ATTR_USER_ID, ctx.userId().longValue());
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}

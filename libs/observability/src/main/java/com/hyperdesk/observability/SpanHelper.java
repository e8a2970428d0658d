package com.hyperdesk.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags spans with the current
 * {@link CorrelationContext}.
 * <p>
 * SDK setup (exporter, sampler) is left to the runtime; with no SDK installed the tracer is a
 * no-op and this class costs next to nothing.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_TENANT_ID = "tenant.id";
    public static final String ATTR_USER_ID = "user.id";
    public static final String ATTR_REQUEST_ID = "vm_request.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Runs {@code work} inside an internal span. */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span of the given kind. Unchecked exceptions mark the span as
     * failed and are rethrown unchanged.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        return inSpan(spanName, kind, attributes, work, result -> false);
    }

    /**
     * Runs {@code work} inside a span and marks the span as failed when {@code isFailure}
     * accepts the returned value, for work that reports errors as values instead of throwing.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work,
                        Predicate<? super T> isFailure) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
            if (ctx.requestId() != null) {
                span.setAttribute(ATTR_REQUEST_ID, ctx.requestId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            if (isFailure.test(result)) {
                span.setStatus(StatusCode.ERROR, String.valueOf(result));
            } else {
                span.setStatus(StatusCode.OK);
            }
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
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

package com.bluequee.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into SLF4J MDC.
 *
 * <p>Servlet threads are pooled, so every {@link #set} must be paired with {@link #clear} (or use
 * {@link #open}, which restores whatever was bound before).
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Binds the context to the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_ORGANIZATION_ID, context.organizationId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
    }

    /** Returns the current thread's context, if any. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ORGANIZATION_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Attaches the caller's identity to the current context. No-op when no context is bound.
     */
    public static void attachIdentity(Long organizationId, Long userId) {
        get().ifPresent(ctx -> set(ctx.withIdentity(organizationId, userId)));
    }

    /**
     * Binds the context until the returned scope is closed, then restores the previous binding.
     *
     * <pre>{@code
     * try (var ignored = CorrelationContextHolder.open(ctx)) {
     *     ...
     * }
     * }</pre>
     */
    public static Scope open(CorrelationContext context) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        return () -> {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        };
    }

    private static void putOrRemove(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        } else {
            MDC.remove(key);
        }
    }

    /** A binding that restores the previous context when closed. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}

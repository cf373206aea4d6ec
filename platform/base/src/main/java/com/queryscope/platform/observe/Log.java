package com.queryscope.platform.observe;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Unified logging API for queryscope.
 *
 * NO third-party types in this interface.
 * SLF4J and OpenTelemetry details are hidden in {@link LogImpl}.
 *
 * Usage:
 *   import static com.queryscope.platform.observe.Log.*;
 *
 *   info("Slow query reported: {}", operationId);
 *   warn("Plan capture unavailable for {}", operationId);
 *   error("Sink failed", exception);
 *
 *   // Debug + span, only when investigation mode is active
 *   traced("analyze-slow-query", () -> pipeline.process(item));
 *
 * The logger is resolved from the calling class, so log lines carry the
 * caller's category. Hot paths that log per command should hold their own
 * SLF4J logger instead of paying the caller lookup.
 */
public final class Log {

    private static final LogImpl impl = new LogImpl();

    private Log() {}

    // ========================================================================
    // Always-On Logging
    // ========================================================================

    public static void debug(String format, Object... args) {
        impl.debug(format, args);
    }

    public static void info(String message) {
        impl.info(message);
    }

    public static void info(String format, Object... args) {
        impl.info(format, args);
    }

    public static void warn(String message) {
        impl.warn(message);
    }

    public static void warn(String format, Object... args) {
        impl.warn(format, args);
    }

    public static void error(String message) {
        impl.error(message);
    }

    public static void error(String message, Throwable t) {
        impl.error(message, t);
    }

    public static void error(String format, Object... args) {
        impl.error(format, args);
    }

    // ========================================================================
    // Investigation Mode (Debug + Tracing)
    // ========================================================================

    /**
     * Execute work with debug logging and a tracing span.
     * Only active when investigation mode is enabled for the current thread.
     *
     * When active:
     *   [DEBUG] → operation-name
     *   [DEBUG] ← operation-name (45ms)
     *   + span exported through the global OpenTelemetry instance
     *
     * When inactive: just executes work.
     */
    public static <T> T traced(String operation, Supplier<T> work) {
        return impl.traced(operation, work);
    }

    public static void traced(String operation, Runnable work) {
        impl.traced(operation, () -> { work.run(); return Optional.empty(); });
    }

    public static void enableInvestigation() {
        InvestigationContext.enable();
    }

    // ========================================================================
    // Span attributes and log correlation
    // ========================================================================

    /** Attach an attribute to the current span (no-op without one). */
    public static void attr(String key, String value) {
        impl.attr(key, value);
    }

    public static void attr(String key, long value) {
        impl.attr(key, value);
    }

    public static void mdc(String key, String value) {
        impl.mdc(key, value);
    }

    public static void clearMdc(String key) {
        impl.clearMdc(key);
    }
}

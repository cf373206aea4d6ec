package com.queryscope.platform.observe;

/**
 * Thread-local switch for investigation/debug mode.
 *
 * When enabled on a thread, {@link Log#traced} emits debug lines and spans
 * for the work it wraps. The analysis worker turns it on for its own thread
 * when {@code queryscope.queue.trace-analysis} is set.
 */
final class InvestigationContext {

    private static final ThreadLocal<Boolean> ACTIVE = ThreadLocal.withInitial(() -> false);

    private InvestigationContext() {}

    static void enable() {
        ACTIVE.set(true);
    }

    static void disable() {
        ACTIVE.remove();
    }

    static boolean isActive() {
        return ACTIVE.get();
    }
}

package com.queryscope.platform.base;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or the error that prevented it.
 *
 * Used wherever a step may fail but must not throw across a boundary
 * (tracking hooks, plan capture, sinks).
 *
 * <pre>{@code
 * boolean open = Result.of(() -> !connection.isClosed())
 *       .onFailure(e -> warn("Cannot inspect connection: {}", e.getMessage()))
 *       .getOrElse(false);
 * }</pre>
 *
 * Every combinator is derived from {@link #fold}.
 *
 * @param <A> The success value type
 */
public sealed interface Result<A> permits Result.Success, Result.Failure {

    <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess);

    // ========================================================================
    // Inspection
    // ========================================================================

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * The value, or the error rethrown (checked errors wrapped in a RuntimeException).
     */
    default A getOrThrow() {
        return fold(Result::rethrow, value -> value);
    }

    default A getOrElse(A fallback) {
        return fold(e -> fallback, value -> value);
    }

    default Optional<Throwable> error() {
        return fold(Optional::of, value -> Optional.empty());
    }

    default Optional<A> toOptional() {
        return fold(e -> Optional.empty(), Optional::of);
    }

    // ========================================================================
    // Combinators
    // ========================================================================

    default <B> Result<B> map(Function<A, B> f) {
        return flatMap(value -> success(f.apply(value)));
    }

    default <B> Result<B> flatMap(Function<A, Result<B>> f) {
        return fold(Result::failure, value -> {
            try {
                return f.apply(value);
            } catch (Throwable t) {
                return failure(t);
            }
        });
    }

    default Result<A> recover(Function<Throwable, A> f) {
        return fold(e -> Result.of(() -> f.apply(e)), value -> this);
    }

    default Result<A> onFailure(Consumer<Throwable> action) {
        error().ifPresent(action);
        return this;
    }

    // ========================================================================
    // Factory methods
    // ========================================================================

    static <A> Result<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Result<A> failure(Throwable error) {
        return new Failure<>(error);
    }

    static <A> Result<A> failure(String message) {
        return new Failure<>(new RuntimeException(message));
    }

    /**
     * Wrap a throwing supplier. A null value is reported as a failure.
     */
    static <A> Result<A> of(ThrowingSupplier<A> supplier) {
        try {
            return success(supplier.get());
        } catch (Throwable t) {
            return failure(t);
        }
    }

    /**
     * Run a throwing action for its side effect.
     * Useful for cleanup steps whose failure is logged, not propagated.
     */
    static Result<Boolean> run(ThrowingRunnable action) {
        return of(() -> {
            action.run();
            return true;
        });
    }

    /**
     * Wait for a thread to die. Restores the interrupt flag when interrupted.
     */
    static Result<Boolean> join(Thread thread, long millis) {
        try {
            thread.join(millis);
            return success(!thread.isAlive());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(e);
        }
    }

    private static <T> T rethrow(Throwable t) {
        if (t instanceof RuntimeException re) {
            throw re;
        }
        if (t instanceof Error err) {
            throw err;
        }
        throw new RuntimeException(t);
    }

    // ========================================================================
    // Implementations
    // ========================================================================

    record Success<A>(A value) implements Result<A> {
        public Success {
            Objects.requireNonNull(value, "Success value cannot be null");
        }

        @Override
        public <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<A>(Throwable cause) implements Result<A> {
        public Failure {
            Objects.requireNonNull(cause, "Failure cause cannot be null");
        }

        @Override
        public <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess) {
            return onFailure.apply(cause);
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<A> {
        A get() throws Throwable;
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Throwable;
    }
}

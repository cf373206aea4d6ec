package com.queryscope.analyzer.tracking;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Frozen snapshot of a finished command; the item that travels through the
 * analysis queue.
 *
 * {@code parameters} is an unmodifiable copy (values may be null).
 * {@code stackTrace} is null when no trace was captured.
 * {@code connection} and {@code dataContext} are the host's handles, kept only
 * so plan capture can find a connection; they are never mutated here.
 */
public record CompletedOperation(
    String operationId,
    CorrelationKey key,
    String commandText,
    Map<String, Object> parameters,
    Instant startedAt,
    Instant endedAt,
    Duration elapsed,
    List<String> stackTrace,
    String contextTag,
    Connection connection,
    Object dataContext
) {

    public CompletedOperation {
        parameters = Parameters.frozen(parameters);
        stackTrace = stackTrace == null ? null : List.copyOf(stackTrace);
    }

    /** Elapsed time in fractional milliseconds. */
    public double elapsedMillis() {
        return elapsed.toNanos() / 1_000_000.0;
    }
}

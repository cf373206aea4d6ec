package com.queryscope.analyzer.tracking;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One in-flight command, owned by {@link OperationTracker} until it completes.
 *
 * Everything is fixed at start except the elapsed time, which is set
 * exactly once by {@link #complete}. The end timestamp is taken only when a
 * snapshot is needed.
 */
public final class TrackedOperation {

    private final String operationId;
    private final CorrelationKey key;
    private final String commandText;
    private final Map<String, Object> parameters;
    private final Instant startedAt;
    private final long startNanos;
    private final List<String> stackTrace;
    private final String contextTag;
    private final Connection connection;
    private final Object dataContext;

    private long elapsedNanos = -1L;

    TrackedOperation(String operationId, CorrelationKey key, String commandText, Map<String, Object> parameters,
                     Instant startedAt, long startNanos, List<String> stackTrace, String contextTag,
                     Connection connection, Object dataContext) {
        this.operationId = operationId;
        this.key = key;
        this.commandText = commandText == null ? "" : commandText;
        this.parameters = parameters;
        this.startedAt = startedAt;
        this.startNanos = startNanos;
        this.stackTrace = stackTrace;
        this.contextTag = contextTag == null || contextTag.isBlank() ? "Unknown" : contextTag;
        this.connection = connection;
        this.dataContext = dataContext;
    }

    /**
     * Stamp the elapsed time. Only the first call counts.
     *
     * @return elapsed nanoseconds, never negative
     * @throws IllegalStateException if the operation was already completed
     */
    synchronized long complete(long endNanos) {
        if (elapsedNanos >= 0) {
            throw new IllegalStateException("Operation " + operationId + " already completed");
        }
        elapsedNanos = Math.max(0L, endNanos - startNanos);
        return elapsedNanos;
    }

    /**
     * Frozen copy for the analysis queue. Parameters and stack lines are shared,
     * both are already immutable.
     */
    synchronized CompletedOperation snapshot(Instant endedAt) {
        if (elapsedNanos < 0) {
            throw new IllegalStateException("Operation " + operationId + " not completed");
        }
        return new CompletedOperation(
            operationId, key, commandText, parameters, startedAt, endedAt, Duration.ofNanos(elapsedNanos),
            stackTrace, contextTag, connection, dataContext);
    }

    public String operationId()            { return operationId; }
    public CorrelationKey key()            { return key; }
    public String commandText()            { return commandText; }
    public Map<String, Object> parameters() { return parameters; }
    public Instant startedAt()             { return startedAt; }
    public List<String> stackTrace()       { return stackTrace; }
    public String contextTag()             { return contextTag; }

    public synchronized boolean isCompleted() {
        return elapsedNanos >= 0;
    }

    /** Elapsed time, or null while the command is still running. */
    public synchronized Duration elapsed() {
        return elapsedNanos < 0 ? null : Duration.ofNanos(elapsedNanos);
    }
}

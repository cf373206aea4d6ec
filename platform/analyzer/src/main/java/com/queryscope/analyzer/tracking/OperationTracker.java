package com.queryscope.analyzer.tracking;

import com.queryscope.analyzer.stack.StackTraceFilter;
import com.queryscope.platform.id.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongPredicate;
import java.util.function.LongSupplier;

/**
 * Correlates command start/end events into tracked operations.
 *
 * The map is keyed by {@link CorrelationKey}; {@link #start} inserts and
 * {@link #complete} removes, and nothing else mutates it. Both calls run on
 * the command's own thread, so neither performs I/O nor throws.
 */
public final class OperationTracker {

    private static final Logger log = LoggerFactory.getLogger(OperationTracker.class);

    private final ConcurrentMap<CorrelationKey, TrackedOperation> active = new ConcurrentHashMap<>();
    private final StackTraceFilter stackTraceFilter;
    private final int maxStackLines;
    private final Clock clock;
    private final LongSupplier nanoTime;

    public OperationTracker(StackTraceFilter stackTraceFilter, int maxStackLines) {
        this(stackTraceFilter, maxStackLines, Clock.systemUTC(), System::nanoTime);
    }

    public OperationTracker(StackTraceFilter stackTraceFilter, int maxStackLines, Clock clock, LongSupplier nanoTime) {
        this.stackTraceFilter = stackTraceFilter;
        this.maxStackLines = maxStackLines;
        this.clock = clock;
        this.nanoTime = nanoTime;
    }

    /**
     * Begin tracking a command.
     *
     * @return the generated operation id, or empty if no record could be created
     */
    public Optional<String> start(CorrelationKey key, String commandText, Map<String, ?> parameters,
                                  String contextTag, Connection connection, Object dataContext,
                                  boolean captureStack) {
        try {
            TrackedOperation operation = new TrackedOperation(
                IdGenerator.getInstance().generateOperationId(),
                key,
                commandText,
                snapshotParameters(parameters, key),
                clock.instant(),
                nanoTime.getAsLong(),
                captureStack ? captureStack() : null,
                contextTag,
                connection,
                dataContext);

            TrackedOperation previous = active.put(key, operation);
            if (previous != null) {
                log.debug("Replaced stale tracked operation {} for {}", previous.operationId(), key);
            }
            log.trace("Query tracking started: {} - {}", operation.operationId(), key);
            return Optional.of(operation.operationId());
        } catch (RuntimeException e) {
            log.error("Error starting query tracking for {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Finish tracking a command: remove it and stamp its elapsed time.
     *
     * @return the completed snapshot, or empty when no operation matches the key
     */
    public Optional<CompletedOperation> complete(CorrelationKey key) {
        return complete(key, elapsedNanos -> true);
    }

    /**
     * Finish tracking a command, building the snapshot only when {@code keep}
     * accepts the elapsed nanoseconds. A rejected operation costs no allocation
     * beyond the map removal.
     */
    public Optional<CompletedOperation> complete(CorrelationKey key, LongPredicate keep) {
        try {
            TrackedOperation operation = active.remove(key);
            if (operation == null) {
                log.trace("No matching tracked operation for {}", key);
                return Optional.empty();
            }
            long elapsedNanos = operation.complete(nanoTime.getAsLong());
            if (log.isTraceEnabled()) {
                log.trace("Query tracking completed: {}, duration: {}ms", operation.operationId(), elapsedNanos / 1_000_000.0);
            }
            if (!keep.test(elapsedNanos)) {
                return Optional.empty();
            }
            return Optional.of(operation.snapshot(clock.instant()));
        } catch (RuntimeException e) {
            log.error("Error completing query tracking for {}", key, e);
            return Optional.empty();
        }
    }

    public int activeCount() {
        return active.size();
    }

    private List<String> captureStack() {
        List<String> lines = stackTraceFilter.capture(maxStackLines);
        return lines.isEmpty() ? null : lines;
    }

    private static Map<String, Object> snapshotParameters(Map<String, ?> parameters, CorrelationKey key) {
        try {
            return Parameters.snapshot(parameters);
        } catch (RuntimeException e) {
            log.warn("Error extracting parameters for {}; tracking without them", key, e);
            return Map.of();
        }
    }
}

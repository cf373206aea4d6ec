package com.queryscope.analyzer;

import com.queryscope.analyzer.config.AnalyzerConfig;
import com.queryscope.analyzer.queue.AnalysisQueue;
import com.queryscope.analyzer.queue.AnalysisWorker;
import com.queryscope.analyzer.tracking.CompletedOperation;
import com.queryscope.analyzer.tracking.CorrelationKey;
import com.queryscope.analyzer.tracking.OperationTracker;
import com.queryscope.analyzer.tracking.ThresholdEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongPredicate;

/**
 * Entry point for the host's data-access layer.
 *
 * The host calls {@link #onCommandStarting} before executing a database
 * command and {@link #onCommandCompleted} after it returns. Both calls are
 * quick, perform no I/O and never throw. Commands that took at least the
 * configured threshold are analyzed and reported on a background thread.
 *
 * Usage:
 * <pre>
 *   QueryAnalyzer analyzer = QueryAnalyzer.builder()
 *       .config(AnalyzerConfig.load())
 *       .sink(new InMemoryReportSink())
 *       .build();
 *   analyzer.start();
 *   ...
 *   analyzer.close();
 * </pre>
 */
public final class QueryAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

    private final AnalyzerConfig config;
    private final OperationTracker tracker;
    private final ThresholdEvaluator evaluator;
    private final AnalysisQueue queue;
    private final AnalysisWorker worker;
    private final LongPredicate slow;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    QueryAnalyzer(AnalyzerConfig config, OperationTracker tracker, ThresholdEvaluator evaluator,
                  AnalysisQueue queue, AnalysisWorker worker) {
        this.config = config;
        this.tracker = tracker;
        this.evaluator = evaluator;
        this.queue = queue;
        this.worker = worker;
        this.slow = evaluator::isSlowNanos;
    }

    public static QueryAnalyzerBuilder builder() {
        return new QueryAnalyzerBuilder();
    }

    /**
     * Command is about to execute.
     *
     * @param connectionId opaque id of the host connection
     * @param commandId    opaque id of the command, unique among commands active on that connection
     * @param parameters   parameter name to value, in declaration order; may be null
     * @param contextTag   name of the host data context type, for grouping reports
     * @param connection   the open JDBC connection, if the host has one
     * @param dataContext  the host data context, may implement {@code ConnectionStringSource}
     */
    public void onCommandStarting(Object connectionId, Object commandId, String commandText,
                                  Map<String, ?> parameters, String contextTag,
                                  Connection connection, Object dataContext) {
        if (!config.enabled() || connectionId == null || commandId == null) {
            return;
        }
        try {
            tracker.start(new CorrelationKey(connectionId, commandId), commandText, parameters, contextTag,
                connection, dataContext, config.stackTrace().enabled());
        } catch (RuntimeException e) {
            log.error("Error in command start hook", e);
        }
    }

    /**
     * Command has finished, successfully or not.
     */
    public void onCommandCompleted(Object connectionId, Object commandId) {
        if (!config.enabled() || connectionId == null || commandId == null) {
            return;
        }
        try {
            tracker.complete(new CorrelationKey(connectionId, commandId), slow)
                .ifPresent(this::submit);
        } catch (RuntimeException e) {
            log.error("Error in command completion hook", e);
        }
    }

    private void submit(CompletedOperation operation) {
        if (closed.get()) {
            rejectAfterClose(operation);
            return;
        }
        // close() may have finished its final drain between the check and the enqueue
        if (evaluator.offer(operation) && closed.get() && !worker.isRunning() && queue.remove(operation)) {
            rejectAfterClose(operation);
        }
    }

    private static void rejectAfterClose(CompletedOperation operation) {
        log.warn("Query analyzer closed; slow operation {} ({}ms) will not be analyzed",
            operation.operationId(), operation.elapsedMillis());
    }

    /** Start the background analysis worker. Does nothing when disabled. */
    public void start() {
        if (!config.enabled()) {
            log.info("Query analysis disabled; not starting worker");
            return;
        }
        worker.start();
    }

    /**
     * Stop the worker after it has analyzed everything already queued.
     * Slow commands completing afterwards are logged and not analyzed.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            worker.close();
        }
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public AnalyzerConfig config() {
        return config;
    }

    public int activeOperations() {
        return tracker.activeCount();
    }

    public int queuedOperations() {
        return queue.size();
    }

    public long droppedOperations() {
        return queue.droppedCount();
    }

    public long processedOperations() {
        return worker.processedCount();
    }

    AnalysisWorker worker() {
        return worker;
    }
}

package com.queryscope.analyzer.queue;

import com.queryscope.analyzer.plan.ExecutionPlan;
import com.queryscope.analyzer.plan.ExecutionPlanCapture;
import com.queryscope.analyzer.report.ReportEnvironment;
import com.queryscope.analyzer.report.ReportSink;
import com.queryscope.analyzer.report.SlowQueryReport;
import com.queryscope.analyzer.tracking.CompletedOperation;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.queryscope.platform.observe.Log.*;

/**
 * Analysis of one slow operation: optional plan capture, report assembly,
 * dispatch to the sink.
 *
 * Plan capture never fails the item. Sink failures are thrown to the caller
 * (the worker), which logs them and moves on.
 */
public final class AnalysisPipeline {

    private static final int LOG_QUERY_LENGTH = 200;

    private final Optional<ExecutionPlanCapture> planCapture;
    private final ReportSink sink;
    private final ReportEnvironment environment;
    private final Duration threshold;
    private final Duration dispatchTimeout;

    public AnalysisPipeline(Optional<ExecutionPlanCapture> planCapture, ReportSink sink,
                            ReportEnvironment environment, Duration threshold, Duration dispatchTimeout) {
        this.planCapture = Objects.requireNonNull(planCapture, "planCapture");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.dispatchTimeout = Objects.requireNonNull(dispatchTimeout, "dispatchTimeout");
    }

    public void process(CompletedOperation operation) {
        mdc("operationId", operation.operationId());
        try {
            traced("queryscope.analyze", () -> analyze(operation));
        } finally {
            clearMdc("operationId");
        }
    }

    private void analyze(CompletedOperation operation) {
        attr("queryscope.operation_id", operation.operationId());
        attr("queryscope.elapsed_ms", (long) operation.elapsedMillis());

        warn("Slow query detected: {}ms (threshold: {}ms) - Query: {}",
            operation.elapsedMillis(), threshold.toMillis(), truncateForLog(operation.commandText()));

        ExecutionPlan plan = planCapture
            .flatMap(capture -> capture.capture(operation))
            .orElse(null);

        dispatch(SlowQueryReport.of(operation, environment, plan));
    }

    private void dispatch(SlowQueryReport report) {
        try {
            sink.report(report).get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reporting " + report.operationId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Reporting failed for " + report.operationId(), e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Reporting timed out after " + dispatchTimeout + " for " + report.operationId(), e);
        }
    }

    private static String truncateForLog(String text) {
        return text.length() <= LOG_QUERY_LENGTH ? text : text.substring(0, LOG_QUERY_LENGTH) + "...";
    }
}

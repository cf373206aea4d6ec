package com.queryscope.analyzer.report;

import com.queryscope.analyzer.plan.ExecutionPlan;
import com.queryscope.analyzer.tracking.CompletedOperation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A slow operation, ready for delivery.
 *
 * @param stackTrace  filtered call-stack lines, or null when none were captured
 * @param executionPlan captured plan, or null
 */
public record SlowQueryReport(
    String operationId,
    String commandText,
    Map<String, Object> parameters,
    double elapsedMillis,
    List<String> stackTrace,
    Instant timestamp,
    String contextTag,
    String environment,
    String applicationName,
    String applicationVersion,
    ExecutionPlan executionPlan
) {

    public SlowQueryReport {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(commandText, "commandText");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(environment, "environment");
        // Map.copyOf rejects null values; parameters may carry SQL NULLs
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        stackTrace = stackTrace == null ? null : List.copyOf(stackTrace);
    }

    public static SlowQueryReport of(CompletedOperation operation, ReportEnvironment environment, ExecutionPlan plan) {
        return new SlowQueryReport(
            operation.operationId(),
            operation.commandText(),
            operation.parameters(),
            operation.elapsedMillis(),
            operation.stackTrace(),
            operation.startedAt(),
            operation.contextTag(),
            environment.environment(),
            environment.applicationName().orElse(null),
            environment.applicationVersion().orElse(null),
            plan
        );
    }

    public Optional<ExecutionPlan> plan() {
        return Optional.ofNullable(executionPlan);
    }
}

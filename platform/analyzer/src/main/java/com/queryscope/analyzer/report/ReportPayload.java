package com.queryscope.analyzer.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.queryscope.analyzer.plan.ExecutionPlan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON body posted by {@link HttpReportSink}. Field names are the wire contract.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ReportPayload(
    @JsonProperty("queryId") String queryId,
    @JsonProperty("rawQuery") String rawQuery,
    @JsonProperty("parameters") Map<String, Object> parameters,
    @JsonProperty("executionTimeMs") double executionTimeMs,
    @JsonProperty("stackTrace") List<String> stackTrace,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("contextType") String contextType,
    @JsonProperty("environment") String environment,
    @JsonProperty("applicationName") String applicationName,
    @JsonProperty("version") String version,
    @JsonProperty("executionPlan") Plan executionPlan
) {

    public record Plan(
        @JsonProperty("databaseProvider") String databaseProvider,
        @JsonProperty("planFormat") Format planFormat,
        @JsonProperty("content") String content
    ) {
        static Plan of(ExecutionPlan plan) {
            return new Plan(
                plan.provider().providerName(),
                new Format(plan.format().contentType(), plan.format().fileExtension(), plan.format().description()),
                plan.content());
        }
    }

    public record Format(
        @JsonProperty("contentType") String contentType,
        @JsonProperty("fileExtension") String fileExtension,
        @JsonProperty("description") String description
    ) {}

    static final String TRUNCATION_MARKER = "\n-- [TRUNCATED]";

    public static ReportPayload from(SlowQueryReport report, int maxQueryLength) {
        return new ReportPayload(
            report.operationId(),
            truncate(report.commandText(), maxQueryLength),
            wireParameters(report.parameters()),
            report.elapsedMillis(),
            report.stackTrace(),
            report.timestamp().toString(),
            report.contextTag(),
            report.environment(),
            report.applicationName(),
            report.applicationVersion(),
            report.plan().map(Plan::of).orElse(null));
    }

    static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + TRUNCATION_MARKER : text;
    }

    // JSON-native values pass through; anything else is sent as its string form
    private static Map<String, Object> wireParameters(Map<String, Object> parameters) {
        Map<String, Object> wire = new LinkedHashMap<>();
        parameters.forEach((name, value) -> wire.put(name, isJsonNative(value) ? value : String.valueOf(value)));
        return wire;
    }

    private static boolean isJsonNative(Object value) {
        return value == null
            || value instanceof String
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof byte[];
    }
}

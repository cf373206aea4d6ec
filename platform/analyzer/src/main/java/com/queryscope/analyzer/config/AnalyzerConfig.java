package com.queryscope.analyzer.config;

import com.queryscope.analyzer.plan.DatabaseProvider;
import com.queryscope.analyzer.queue.OverflowPolicy;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.queryscope.platform.config.ConfigAccessor.*;

/**
 * Type-safe access to the {@code queryscope} configuration block.
 *
 * All nested configs are records with static from(Config) factories.
 * Defaults live in reference.conf; the records only validate.
 *
 * Example:
 * <pre>
 *   var config = AnalyzerConfig.load();
 *   Duration threshold = config.threshold();
 *   int batch = config.queue().batchSize();
 * </pre>
 */
public record AnalyzerConfig(
    boolean enabled,
    Duration threshold,
    StackTraceConfig stackTrace,
    PlanCaptureConfig planCapture,
    QueueConfig queue,
    ReportingConfig reporting
) {

    public static final String ROOT = "queryscope";

    public AnalyzerConfig {
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("queryscope.threshold must not be negative: " + threshold);
        }
    }

    /** Load from application.conf / reference.conf / system properties. */
    public static AnalyzerConfig load() {
        return from(ConfigFactory.load());
    }

    /** Build from a full config tree; missing keys fall back to reference.conf. */
    public static AnalyzerConfig from(Config root) {
        Config c = root.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(ROOT);
        return new AnalyzerConfig(
            bool(c, "enabled", true),
            duration(c, "threshold", Duration.ofSeconds(1)),
            StackTraceConfig.from(c.getConfig("stack-trace")),
            PlanCaptureConfig.from(c.getConfig("plan-capture")),
            QueueConfig.from(c.getConfig("queue")),
            ReportingConfig.from(c.getConfig("reporting"))
        );
    }

    /** Reference defaults only. */
    public static AnalyzerConfig defaults() {
        return from(ConfigFactory.empty());
    }

    // =========================================================================
    // Record: StackTraceConfig
    // =========================================================================

    public record StackTraceConfig(
        boolean enabled,
        int maxLines,
        Optional<String> projectRoot,
        List<String> applicationPackages,
        List<String> excludedPackages
    ) {
        public StackTraceConfig {
            if (maxLines < 0) {
                throw new IllegalArgumentException("stack-trace.max-lines must not be negative: " + maxLines);
            }
            applicationPackages = List.copyOf(applicationPackages);
            excludedPackages = List.copyOf(excludedPackages);
        }

        public static StackTraceConfig from(Config c) {
            return new StackTraceConfig(
                bool(c, "enabled", true),
                intVal(c, "max-lines", 20),
                nonBlank(c, "project-root"),
                stringList(c, "application-packages", List.of()),
                stringList(c, "excluded-packages", List.of())
            );
        }
    }

    // =========================================================================
    // Record: PlanCaptureConfig
    // =========================================================================

    public record PlanCaptureConfig(
        boolean enabled,
        Duration timeout,
        Optional<String> connectionString,
        Optional<String> username,
        Optional<String> password,
        DatabaseProvider databaseProvider
    ) {
        public static PlanCaptureConfig from(Config c) {
            return new PlanCaptureConfig(
                bool(c, "enabled", false),
                duration(c, "timeout", Duration.ofSeconds(30)),
                nonBlank(c, "connection-string"),
                nonBlank(c, "username"),
                nonBlank(c, "password"),
                enumVal(c, DatabaseProvider.class, "database-provider", DatabaseProvider.AUTO)
            );
        }

        /** JDBC query timeout, at least one second. */
        public int timeoutSeconds() {
            return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toSeconds()));
        }
    }

    // =========================================================================
    // Record: QueueConfig
    // =========================================================================

    public record QueueConfig(
        int batchSize,
        Duration pollInterval,
        Duration errorBackoff,
        Duration shutdownTimeout,
        Duration dispatchTimeout,
        int maxSize,
        OverflowPolicy overflowPolicy,
        boolean traceAnalysis
    ) {
        public QueueConfig {
            if (batchSize < 1) {
                throw new IllegalArgumentException("queue.batch-size must be at least 1: " + batchSize);
            }
            if (maxSize < 0) {
                throw new IllegalArgumentException("queue.max-size must not be negative: " + maxSize);
            }
        }

        public static QueueConfig from(Config c) {
            return new QueueConfig(
                intVal(c, "batch-size", 10),
                duration(c, "poll-interval", Duration.ofMillis(100)),
                duration(c, "error-backoff", Duration.ofSeconds(1)),
                duration(c, "shutdown-timeout", Duration.ofSeconds(30)),
                duration(c, "dispatch-timeout", Duration.ofSeconds(60)),
                intVal(c, "max-size", 0),
                enumVal(c, OverflowPolicy.class, "overflow-policy", OverflowPolicy.DROP_NEWEST),
                bool(c, "trace-analysis", false)
            );
        }

        public boolean bounded() {
            return maxSize > 0;
        }
    }

    // =========================================================================
    // Record: ReportingConfig
    // =========================================================================

    public record ReportingConfig(
        Optional<String> endpoint,
        Optional<String> apiKey,
        Optional<String> projectId,
        Duration timeout,
        int maxQueryLength,
        boolean enableInDevelopment,
        boolean enableInProduction,
        String environment,
        Optional<String> applicationName,
        Optional<String> applicationVersion
    ) {
        public ReportingConfig {
            if (maxQueryLength < 1) {
                throw new IllegalArgumentException("reporting.max-query-length must be at least 1: " + maxQueryLength);
            }
        }

        public static ReportingConfig from(Config c) {
            return new ReportingConfig(
                nonBlank(c, "endpoint"),
                nonBlank(c, "api-key"),
                nonBlank(c, "project-id"),
                duration(c, "timeout", Duration.ofSeconds(5)),
                intVal(c, "max-query-length", 10_000),
                bool(c, "enable-in-development", true),
                bool(c, "enable-in-production", false),
                nonBlank(c, "environment").orElse("production"),
                nonBlank(c, "application-name"),
                nonBlank(c, "application-version")
            );
        }
    }
}

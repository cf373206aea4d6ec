package com.queryscope.analyzer.report;

import com.queryscope.analyzer.config.AnalyzerConfig.ReportingConfig;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Where reports come from: the environment tag and application identity
 * stamped on every report.
 */
public record ReportEnvironment(String environment, Optional<String> applicationName, Optional<String> applicationVersion) {

    public static final String DEVELOPMENT = "development";
    public static final String PRODUCTION = "production";

    public ReportEnvironment {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(applicationName, "applicationName");
        Objects.requireNonNull(applicationVersion, "applicationVersion");
    }

    public static ReportEnvironment from(ReportingConfig config) {
        Optional<String> name = config.applicationName()
            .or(() -> Optional.ofNullable(System.getenv("APPLICATION_NAME")).filter(s -> !s.isBlank()));
        return new ReportEnvironment(config.environment(), name, config.applicationVersion());
    }

    public static ReportEnvironment of(String environment) {
        return new ReportEnvironment(environment, Optional.empty(), Optional.empty());
    }

    public boolean isDevelopment() {
        return DEVELOPMENT.equals(environment.toLowerCase(Locale.ROOT));
    }
}

package com.queryscope.analyzer.report;

import com.queryscope.analyzer.config.AnalyzerConfig.ReportingConfig;
import com.queryscope.platform.base.Result;
import com.queryscope.platform.serialization.Codec;
import com.queryscope.platform.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Posts reports as JSON to the configured collector endpoint.
 *
 * Reporting is gated per environment: development reports only if
 * {@code enable-in-development}, every other environment only if
 * {@code enable-in-production}. A non-2xx answer is logged and not retried.
 * Transport failures complete the returned future exceptionally.
 */
public final class HttpReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(HttpReportSink.class);

    static final String USER_AGENT = "queryscope/1.0.0";
    static final String PROJECT_HEADER = "X-PROJECT-ID";

    private final HttpClient httpClient;
    private final ReportingConfig config;
    private final ReportEnvironment environment;
    private final Optional<URI> endpoint;
    private final Codec<ReportPayload> codec = JsonCodec.forClass(ReportPayload.class);

    private HttpReportSink(HttpClient httpClient, ReportingConfig config, ReportEnvironment environment) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.config = Objects.requireNonNull(config, "config");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.endpoint = config.endpoint().map(URI::create);
    }

    public static HttpReportSink create(ReportingConfig config, ReportEnvironment environment) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
        return create(client, config, environment);
    }

    public static HttpReportSink create(HttpClient httpClient, ReportingConfig config, ReportEnvironment environment) {
        return new HttpReportSink(httpClient, config, environment);
    }

    /** Whether the current environment is allowed to report at all. */
    public boolean isEnabled() {
        return environment.isDevelopment() ? config.enableInDevelopment() : config.enableInProduction();
    }

    @Override
    public CompletableFuture<Void> report(SlowQueryReport report) {
        if (!isEnabled()) {
            log.trace("Reporting disabled in environment {}; skipping {}", environment.environment(), report.operationId());
            return CompletableFuture.completedFuture(null);
        }
        if (endpoint.isEmpty()) {
            log.warn("Reporting endpoint not configured; slow query {} not reported", report.operationId());
            return CompletableFuture.completedFuture(null);
        }

        Result<byte[]> body = codec.encode(ReportPayload.from(report, config.maxQueryLength()));
        if (body.isFailure()) {
            return CompletableFuture.failedFuture(new ReportDeliveryException(
                "Could not serialize report " + report.operationId(), body.error().orElse(null)));
        }

        HttpRequest request = buildRequest(endpoint.get(), body.getOrThrow());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, e) -> {
                    if (e != null) {
                        throw new ReportDeliveryException("Failed to report slow query " + report.operationId(), e);
                    }
                    if (response.statusCode() / 100 != 2) {
                        log.error("Failed to report slow query {}. Status: {}, Response: {}",
                            report.operationId(), response.statusCode(), response.body());
                    } else {
                        log.info("Slow query reported: {} ({}ms)", report.operationId(), report.elapsedMillis());
                    }
                    return null;
                });
    }

    HttpRequest buildRequest(URI uri, byte[] body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(config.timeout())
                .header("Content-Type", codec.contentType())
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        config.apiKey().ifPresent(key -> builder.header("Authorization", "Bearer " + key));
        config.projectId().ifPresent(id -> builder.header(PROJECT_HEADER, id));
        return builder.build();
    }
}

package com.queryscope.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.queryscope.analyzer.config.AnalyzerConfig;
import com.queryscope.analyzer.plan.ExecutionPlanCapture;
import com.queryscope.analyzer.report.InMemoryReportSink;
import com.queryscope.analyzer.report.ReportEnvironment;
import com.queryscope.analyzer.report.SlowQueryReport;
import com.queryscope.analyzer.stack.CapturedFrame;
import com.queryscope.analyzer.stack.StackTraceFilter;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class QueryAnalyzerTest {

    private static final String SQL = "SELECT * FROM orders WHERE customer_id = @customerId";

    private final AtomicLong nanos = new AtomicLong();
    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
    private final InMemoryReportSink sink = new InMemoryReportSink();

    private final List<Logger> capturedLoggers = new ArrayList<>();

    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = analyzer("""
                queryscope {
                  threshold = 100ms
                  stack-trace.application-packages = ["com.acme."]
                }
                """);
    }

    @AfterEach
    void detachAppenders() {
        capturedLoggers.forEach(Logger::detachAndStopAllAppenders);
    }

    private ListAppender<ILoggingEvent> capture(Class<?> source) {
        Logger logger = (Logger) LoggerFactory.getLogger(source);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        capturedLoggers.add(logger);
        return appender;
    }

    private static boolean hasWarning(ListAppender<ILoggingEvent> appender, String prefix) {
        return appender.list.stream()
            .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().startsWith(prefix));
    }

    private QueryAnalyzer analyzer(String hocon) {
        return QueryAnalyzer.builder()
            .config(AnalyzerConfig.from(ConfigFactory.parseString(hocon)))
            .sink(sink)
            .environment(ReportEnvironment.of("test"))
            .stackCaptureProvider(() -> List.of(
                CapturedFrame.of("com.queryscope.analyzer.QueryAnalyzer", "onCommandStarting", "QueryAnalyzer.java", 80),
                CapturedFrame.of("com.acme.orders.OrderRepository", "byCustomer", "OrderRepository.java", 27)))
            .clock(clock, nanos::get)
            .build();
    }

    private void run(Object connectionId, Object commandId, long elapsedMillis) {
        analyzer.onCommandStarting(connectionId, commandId, SQL, Map.of("@customerId", 7), "OrdersContext", null, null);
        nanos.addAndGet(Duration.ofMillis(elapsedMillis).toNanos());
        analyzer.onCommandCompleted(connectionId, commandId);
    }

    @Test
    void slowCommandIsReportedWithoutPlan() {
        run("conn-1", 1, 150);
        analyzer.close();

        assertEquals(1, sink.count());
        SlowQueryReport report = sink.reports().get(0);
        assertEquals(SQL, report.commandText());
        assertEquals(7, report.parameters().get("@customerId"));
        assertEquals(150.0, report.elapsedMillis(), 0.0001);
        assertEquals("OrdersContext", report.contextTag());
        assertEquals("test", report.environment());
        assertEquals(Instant.parse("2025-06-01T12:00:00Z"), report.timestamp());
        assertEquals(List.of("com.acme.orders.OrderRepository.byCustomer(OrderRepository.java:27)"), report.stackTrace());
        assertNull(report.executionPlan());
        assertEquals(0, analyzer.activeOperations());
    }

    @Test
    void fastCommandLeavesNoTrace() {
        run("conn-1", 1, 40);

        assertEquals(0, analyzer.queuedOperations());
        assertEquals(0, analyzer.activeOperations());
        analyzer.close();
        assertEquals(0, sink.count());
    }

    @Test
    void unknownCompletionIsIgnored() {
        assertDoesNotThrow(() -> analyzer.onCommandCompleted("never", "started"));
        assertDoesNotThrow(() -> analyzer.onCommandCompleted(null, null));
        analyzer.close();

        assertEquals(0, sink.count());
    }

    @Test
    void slowCommandWithUnreachableDatabaseStillReports() {
        QueryAnalyzer withPlans = analyzer("""
                queryscope {
                  threshold = 100ms
                  plan-capture.enabled = true
                }
                """);
        ListAppender<ILoggingEvent> planLog = capture(ExecutionPlanCapture.class);
        withPlans.onCommandStarting("c", 1, SQL, Map.of(), "OrdersContext", null, new Object());
        nanos.addAndGet(Duration.ofMillis(300).toNanos());
        withPlans.onCommandCompleted("c", 1);
        withPlans.close();

        assertEquals(1, sink.count());
        assertNull(sink.reports().get(0).executionPlan());
        assertTrue(hasWarning(planLog, "No connection available to capture execution plan"));
    }

    @Test
    void slowCommandFinishingAfterCloseIsLoggedNotQueued() {
        ListAppender<ILoggingEvent> analyzerLog = capture(QueryAnalyzer.class);
        analyzer.start();
        analyzer.onCommandStarting("conn-1", 1, SQL, Map.of(), "OrdersContext", null, null);
        analyzer.close();

        nanos.addAndGet(Duration.ofMillis(500).toNanos());
        analyzer.onCommandCompleted("conn-1", 1);

        assertEquals(0, analyzer.queuedOperations());
        assertEquals(0, analyzer.activeOperations());
        assertEquals(0, sink.count());
        assertTrue(hasWarning(analyzerLog, "Query analyzer closed; slow operation"));
    }

    @Test
    void fastCommandFinishingAfterCloseIsSilent() {
        ListAppender<ILoggingEvent> analyzerLog = capture(QueryAnalyzer.class);
        analyzer.onCommandStarting("conn-1", 2, SQL, Map.of(), "OrdersContext", null, null);
        analyzer.close();

        nanos.addAndGet(Duration.ofMillis(40).toNanos());
        analyzer.onCommandCompleted("conn-1", 2);

        assertEquals(0, analyzer.activeOperations());
        assertTrue(analyzerLog.list.isEmpty());
    }

    @Test
    void backgroundWorkerReportsWhileRunning() throws Exception {
        analyzer.start();
        try {
            run("conn-1", 1, 500);
            run("conn-2", 1, 500);
            long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
            while (sink.count() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            analyzer.close();
        }

        assertEquals(2, sink.count());
        assertEquals(2, analyzer.processedOperations());
    }

    @Test
    void disabledAnalyzerIgnoresEverything() {
        QueryAnalyzer disabled = QueryAnalyzer.builder()
            .config(AnalyzerConfig.from(ConfigFactory.parseString("queryscope.enabled = false")))
            .build();

        disabled.start();
        disabled.onCommandStarting("c", 1, SQL, Map.of(), "Ctx", null, null);
        disabled.onCommandCompleted("c", 1);
        disabled.close();

        assertFalse(disabled.isEnabled());
        assertEquals(0, disabled.activeOperations());
        assertEquals(0, disabled.queuedOperations());
    }

    @Test
    void enabledAnalyzerNeedsASink() {
        QueryAnalyzerBuilder builder = QueryAnalyzer.builder().config(AnalyzerConfig.defaults());

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void configuredEndpointSuppliesHttpSink() {
        QueryAnalyzer http = QueryAnalyzer.builder()
            .config(AnalyzerConfig.from(ConfigFactory.parseString("queryscope.reporting.endpoint = \"http://localhost:1/x\"")))
            .stackCaptureProvider(List::of)
            .build();

        assertTrue(http.isEnabled());
        http.close();
    }

    @Test
    void projectRootFromConfigIsUsed() {
        AnalyzerConfig config = AnalyzerConfig.from(ConfigFactory.parseString("queryscope.stack-trace.project-root = \"/srv/shop\""));

        assertEquals(Optional.of("/srv/shop"), config.stackTrace().projectRoot());
        assertEquals(Path.of("/srv/shop").toAbsolutePath(),
            StackTraceFilter.from(config.stackTrace(), List::of).projectRoot());
    }
}

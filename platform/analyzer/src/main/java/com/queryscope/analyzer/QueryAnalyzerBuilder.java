package com.queryscope.analyzer;

import com.queryscope.analyzer.config.AnalyzerConfig;
import com.queryscope.analyzer.plan.ConnectionFactory;
import com.queryscope.analyzer.plan.ConnectionStringResolver;
import com.queryscope.analyzer.plan.ExecutionPlanCapture;
import com.queryscope.analyzer.plan.PlanDialect;
import com.queryscope.analyzer.queue.AnalysisPipeline;
import com.queryscope.analyzer.queue.AnalysisQueue;
import com.queryscope.analyzer.queue.AnalysisWorker;
import com.queryscope.analyzer.report.CompositeReportSink;
import com.queryscope.analyzer.report.HttpReportSink;
import com.queryscope.analyzer.report.ReportEnvironment;
import com.queryscope.analyzer.report.ReportSink;
import com.queryscope.analyzer.stack.StackCaptureProvider;
import com.queryscope.analyzer.stack.StackTraceFilter;
import com.queryscope.analyzer.stack.StackWalkerCaptureProvider;
import com.queryscope.analyzer.tracking.OperationTracker;
import com.queryscope.analyzer.tracking.ThresholdEvaluator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

import static com.queryscope.platform.observe.Log.*;

/**
 * Assembles a {@link QueryAnalyzer} from config and optional collaborators.
 *
 * At least one sink is required while enabled: either added with
 * {@link #sink}, or the HTTP sink from {@link #withHttpReporting()} or a
 * configured {@code reporting.endpoint}.
 */
public final class QueryAnalyzerBuilder {

    private AnalyzerConfig config;
    private final List<ReportSink> sinks = new ArrayList<>();
    private boolean httpReporting;
    private StackCaptureProvider stackCaptureProvider;
    private ConnectionFactory connectionFactory;
    private ConnectionStringResolver connectionStringResolver;
    private PlanDialect dialect;
    private ReportEnvironment environment;
    private Clock clock = Clock.systemUTC();
    private LongSupplier nanoTime = System::nanoTime;

    QueryAnalyzerBuilder() {}

    public QueryAnalyzerBuilder config(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public QueryAnalyzerBuilder sink(ReportSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
        return this;
    }

    /** Add the HTTP sink built from {@code reporting.*}. */
    public QueryAnalyzerBuilder withHttpReporting() {
        this.httpReporting = true;
        return this;
    }

    public QueryAnalyzerBuilder stackCaptureProvider(StackCaptureProvider provider) {
        this.stackCaptureProvider = provider;
        return this;
    }

    public QueryAnalyzerBuilder connectionFactory(ConnectionFactory factory) {
        this.connectionFactory = factory;
        return this;
    }

    public QueryAnalyzerBuilder connectionStringResolver(ConnectionStringResolver resolver) {
        this.connectionStringResolver = resolver;
        return this;
    }

    /** Force a plan dialect instead of detecting it per connection. */
    public QueryAnalyzerBuilder dialect(PlanDialect dialect) {
        this.dialect = dialect;
        return this;
    }

    public QueryAnalyzerBuilder environment(ReportEnvironment environment) {
        this.environment = environment;
        return this;
    }

    public QueryAnalyzerBuilder clock(Clock clock, LongSupplier nanoTime) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        return this;
    }

    /**
     * @throws IllegalStateException when enabled and no sink can be built
     */
    public QueryAnalyzer build() {
        AnalyzerConfig cfg = config != null ? config : AnalyzerConfig.load();
        ReportEnvironment env = environment != null ? environment : ReportEnvironment.from(cfg.reporting());

        StackTraceFilter stackFilter = StackTraceFilter.from(cfg.stackTrace(),
            stackCaptureProvider != null ? stackCaptureProvider : new StackWalkerCaptureProvider());
        OperationTracker tracker = new OperationTracker(stackFilter, cfg.stackTrace().maxLines(), clock, nanoTime);

        AnalysisQueue queue = new AnalysisQueue(cfg.queue().maxSize(), cfg.queue().overflowPolicy());
        ThresholdEvaluator evaluator = new ThresholdEvaluator(cfg.threshold(), queue);

        AnalysisPipeline pipeline = new AnalysisPipeline(
            planCapture(cfg), resolveSink(cfg, env), env, cfg.threshold(), cfg.queue().dispatchTimeout());
        AnalysisWorker worker = new AnalysisWorker(queue, pipeline, cfg.queue());

        info("Query analyzer built (enabled={}, threshold={}ms, plan capture={}, environment={})",
            cfg.enabled(), cfg.threshold().toMillis(), cfg.planCapture().enabled(), env.environment());
        return new QueryAnalyzer(cfg, tracker, evaluator, queue, worker);
    }

    private Optional<ExecutionPlanCapture> planCapture(AnalyzerConfig cfg) {
        if (!cfg.planCapture().enabled()) {
            return Optional.empty();
        }
        ConnectionFactory factory = connectionFactory != null
            ? connectionFactory
            : ConnectionFactory.driverManager(cfg.planCapture().username(), cfg.planCapture().password());
        return Optional.of(new ExecutionPlanCapture(cfg.planCapture(), factory, connectionStringResolver, dialect));
    }

    private ReportSink resolveSink(AnalyzerConfig cfg, ReportEnvironment env) {
        List<ReportSink> all = new ArrayList<>(sinks);
        if (httpReporting || (all.isEmpty() && cfg.reporting().endpoint().isPresent())) {
            all.add(HttpReportSink.create(cfg.reporting(), env));
        }
        if (all.isEmpty()) {
            if (cfg.enabled()) {
                throw new IllegalStateException(
                    "No report sink configured: add a sink or set queryscope.reporting.endpoint");
            }
            return report -> CompletableFuture.completedFuture(null);
        }
        return all.size() == 1 ? all.get(0) : new CompositeReportSink(all);
    }
}

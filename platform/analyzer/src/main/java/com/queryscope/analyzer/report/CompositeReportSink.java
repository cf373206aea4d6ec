package com.queryscope.analyzer.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fans a report out to several sinks. A failing sink is logged and does not
 * affect the others; the returned future always completes normally.
 */
public final class CompositeReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeReportSink.class);

    private final List<ReportSink> sinks;

    public CompositeReportSink(List<? extends ReportSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public CompletableFuture<Void> report(SlowQueryReport report) {
        CompletableFuture<?>[] deliveries = sinks.stream()
            .map(sink -> isolate(sink, report))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(deliveries);
    }

    private static CompletableFuture<Void> isolate(ReportSink sink, SlowQueryReport report) {
        CompletableFuture<Void> delivery;
        try {
            delivery = sink.report(report);
            if (delivery == null) {
                delivery = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException e) {
            delivery = CompletableFuture.failedFuture(e);
        }
        return delivery.handle((ok, e) -> {
            if (e != null) {
                log.error("Report sink {} failed for operation {}",
                    sink.getClass().getName(), report.operationId(), e);
            }
            return null;
        });
    }
}

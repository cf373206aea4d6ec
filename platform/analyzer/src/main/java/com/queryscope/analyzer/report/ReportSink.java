package com.queryscope.analyzer.report;

import java.util.concurrent.CompletableFuture;

/**
 * Destination for slow-operation reports.
 *
 * Implementations may fail either by throwing or by completing the future
 * exceptionally; callers handle both.
 */
@FunctionalInterface
public interface ReportSink {

    CompletableFuture<Void> report(SlowQueryReport report);
}

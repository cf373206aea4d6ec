package com.queryscope.analyzer.report;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every report in memory. Useful in tests and local runs.
 */
public final class InMemoryReportSink implements ReportSink {

    private final List<SlowQueryReport> reports = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> report(SlowQueryReport report) {
        reports.add(report);
        return CompletableFuture.completedFuture(null);
    }

    /** Snapshot of the reports received so far, oldest first. */
    public List<SlowQueryReport> reports() {
        return List.copyOf(reports);
    }

    public int count() {
        return reports.size();
    }

    public void clear() {
        reports.clear();
    }
}

package com.queryscope.analyzer.tracking;

import com.queryscope.analyzer.queue.AnalysisQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Classifies completed operations; only slow ones reach the analysis queue.
 *
 * An elapsed time equal to the threshold counts as slow.
 */
public final class ThresholdEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ThresholdEvaluator.class);

    private final Duration threshold;
    private final long thresholdNanos;
    private final AnalysisQueue queue;

    public ThresholdEvaluator(Duration threshold, AnalysisQueue queue) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.thresholdNanos = threshold.toNanos();
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    public boolean isSlow(Duration elapsed) {
        return isSlowNanos(elapsed.toNanos());
    }

    /** Allocation-free form used on the completion path. */
    public boolean isSlowNanos(long elapsedNanos) {
        return elapsedNanos >= thresholdNanos;
    }

    /**
     * Enqueue the operation if it is slow.
     *
     * @return true when the operation was queued for analysis
     */
    public boolean offer(CompletedOperation operation) {
        if (!isSlow(operation.elapsed())) {
            return false;
        }
        boolean queued = queue.enqueue(operation);
        if (queued) {
            log.trace("Queued slow operation {} for analysis", operation.operationId());
        }
        return queued;
    }

    public Duration threshold() {
        return threshold;
    }
}

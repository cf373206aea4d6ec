package com.queryscope.analyzer.queue;

/**
 * What a bounded {@link AnalysisQueue} does when it is full.
 */
public enum OverflowPolicy {
    /** Reject the item being enqueued. */
    DROP_NEWEST,
    /** Evict the oldest queued item to make room. */
    DROP_OLDEST
}

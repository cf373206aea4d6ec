package com.queryscope.analyzer.queue;

import com.queryscope.analyzer.tracking.CompletedOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Multi-producer, single-consumer FIFO between command threads and the
 * analysis worker.
 *
 * Enqueue never blocks. The queue is unbounded unless a max size is given,
 * in which case the {@link OverflowPolicy} decides which item is dropped.
 */
public final class AnalysisQueue {

    private static final Logger log = LoggerFactory.getLogger(AnalysisQueue.class);
    private static final long DROP_LOG_EVERY = 1000;

    private final ConcurrentLinkedQueue<CompletedOperation> items = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();
    private final LongAdder dropped = new LongAdder();
    private final int maxSize;
    private final OverflowPolicy overflowPolicy;

    /** Unbounded queue. */
    public AnalysisQueue() {
        this(0, OverflowPolicy.DROP_NEWEST);
    }

    /**
     * @param maxSize        0 for unbounded
     * @param overflowPolicy applied only when {@code maxSize > 0}
     */
    public AnalysisQueue(int maxSize, OverflowPolicy overflowPolicy) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        this.maxSize = maxSize;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    }

    /**
     * Add an item for background analysis.
     *
     * @return false only when a bounded queue dropped this item
     */
    public boolean enqueue(CompletedOperation item) {
        Objects.requireNonNull(item, "item");
        if (maxSize > 0 && size.get() >= maxSize) {
            if (overflowPolicy == OverflowPolicy.DROP_NEWEST) {
                recordDrop(item);
                return false;
            }
            CompletedOperation evicted = poll();
            if (evicted != null) {
                recordDrop(evicted);
            }
        }
        items.offer(item);
        size.incrementAndGet();
        return true;
    }

    /** Next item in FIFO order, or null when empty. */
    public CompletedOperation poll() {
        CompletedOperation item = items.poll();
        if (item != null) {
            size.decrementAndGet();
        }
        return item;
    }

    /** Remove a specific item that no consumer will take any more. */
    public boolean remove(CompletedOperation item) {
        if (items.remove(item)) {
            size.decrementAndGet();
            return true;
        }
        return false;
    }

    public int size() {
        return size.get();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    private void recordDrop(CompletedOperation item) {
        dropped.increment();
        long total = dropped.sum();
        if (total == 1 || total % DROP_LOG_EVERY == 0) {
            log.warn("Analysis queue full (max {}); dropped operation {} ({} dropped so far)",
                maxSize, item.operationId(), total);
        }
    }
}

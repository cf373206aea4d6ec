package com.queryscope.analyzer.queue;

import com.queryscope.analyzer.config.AnalyzerConfig.QueueConfig;
import com.queryscope.analyzer.tracking.CompletedOperation;
import com.queryscope.platform.base.Result;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

import static com.queryscope.platform.observe.Log.*;

/**
 * Single background consumer of the {@link AnalysisQueue}.
 *
 * Drains up to {@code batchSize} items per pass, then waits
 * {@code pollInterval} on the stop latch. One failing item is logged and
 * skipped. On {@link #close()} the loop wakes, drains every remaining item
 * regardless of batch size, and exits. Stopping never interrupts the thread,
 * so an in-flight JDBC or HTTP call finishes or times out on its own.
 */
public final class AnalysisWorker implements AutoCloseable {

    static final String THREAD_NAME = "queryscope-analysis";

    private final AnalysisQueue queue;
    private final AnalysisPipeline pipeline;
    private final QueueConfig config;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Object lifecycle = new Object();
    private final LongAdder processed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    // Written under lifecycle, so start() and close() agree on who drains
    private volatile Thread thread;

    public AnalysisWorker(AnalysisQueue queue, AnalysisPipeline pipeline, QueueConfig config) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Start the drain thread. Calling it again, or after close, does nothing. */
    public void start() {
        synchronized (lifecycle) {
            if (isStopRequested()) {
                warn("Analysis worker already closed; not starting");
                return;
            }
            if (thread != null) {
                return;
            }
            Thread t = new Thread(this::runLoop, THREAD_NAME);
            t.setDaemon(true);
            thread = t;
            t.start();
        }
        info("Analysis worker started (batch size {}, poll interval {}ms)",
            config.batchSize(), config.pollInterval().toMillis());
    }

    private void runLoop() {
        if (config.traceAnalysis()) {
            enableInvestigation();
        }
        while (!isStopRequested()) {
            try {
                drain(config.batchSize());
                if (awaitStop(config.pollInterval())) {
                    break;
                }
            } catch (RuntimeException e) {
                error("Error in analysis worker loop", e);
                if (awaitStop(config.errorBackoff())) {
                    break;
                }
            }
        }

        // Final drain runs with the interrupt flag cleared so JDBC/HTTP calls are not cut short
        boolean interrupted = Thread.interrupted();
        int remaining = drain(Integer.MAX_VALUE);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        info("Analysis worker stopped; drained {} remaining items ({} processed, {} failed)",
            remaining, processed.sum(), failed.sum());
    }

    /**
     * Process up to {@code max} queued items on the calling thread.
     *
     * @return number of items taken from the queue
     */
    int drain(int max) {
        int count = 0;
        CompletedOperation item;
        while (count < max && (item = queue.poll()) != null) {
            processOne(item);
            count++;
        }
        return count;
    }

    /** One bounded drain pass on the calling thread. */
    public int drainBatch() {
        return drain(config.batchSize());
    }

    private void processOne(CompletedOperation item) {
        try {
            pipeline.process(item);
            processed.increment();
        } catch (Exception e) {
            failed.increment();
            error("Error processing queued query analysis for operation {}", item.operationId(), e);
        }
    }

    private boolean awaitStop(Duration wait) {
        try {
            return stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Stop the worker and wait for the final drain.
     * If the worker never started, the remaining items are drained on the calling thread.
     */
    @Override
    public void close() {
        Thread t;
        synchronized (lifecycle) {
            stopSignal.countDown();
            t = thread;
        }
        if (t == null) {
            int remaining = drain(Integer.MAX_VALUE);
            if (remaining > 0) {
                info("Drained {} queued items on close", remaining);
            }
            return;
        }
        if (t == Thread.currentThread()) {
            return;
        }
        boolean stopped = Result.join(t, config.shutdownTimeout().toMillis()).getOrElse(false);
        if (!stopped) {
            warn("Analysis worker still running after {}ms; {} items queued",
                config.shutdownTimeout().toMillis(), queue.size());
        }
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public long processedCount() {
        return processed.sum();
    }

    public long failedCount() {
        return failed.sum();
    }
}

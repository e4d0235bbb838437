package com.sensorstream.service.sink;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.EnrichedRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fire-and-forget front of the storage sink.
 *
 * Processing lanes only enqueue; a single writer thread drains the queue with
 * bounded retry. When the queue is full the overflow policy decides:
 * - DROP_OLDEST: evict the oldest pending write to make room
 * - REJECT_NEW: discard the incoming write
 * Either way the drop is counted and never blocks the caller.
 */
@Slf4j
@Component
public class SinkDispatcher {

    private static final long DROP_LOG_EVERY = 1000;

    private record SinkTask(String description, Consumer<StorageSink> write) {
    }

    private final StorageSink sink;
    private final EngineProperties.OverflowPolicy overflowPolicy;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Duration drainTimeout;
    private final BlockingDeque<SinkTask> queue;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running;
    private Thread writer;

    public SinkDispatcher(StorageSink sink, EngineProperties properties) {
        EngineProperties.Sink config = properties.getSink();
        this.sink = sink;
        this.overflowPolicy = config.getOverflowPolicy();
        this.maxAttempts = config.getMaxAttempts();
        this.retryBackoff = config.getRetryBackoff();
        this.drainTimeout = config.getDrainTimeout();
        this.queue = new LinkedBlockingDeque<>(config.getBufferDepth());
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        writer = new Thread(this::drainLoop, "sink-writer");
        writer.setDaemon(true);
        writer.start();
        log.info("Sink dispatcher started (depth={}, overflow={})", queue.remainingCapacity(), overflowPolicy);
    }

    public boolean submitRecord(EnrichedRecord record) {
        return enqueue(new SinkTask("record of machine " + record.getMachineId(), s -> s.write(record)));
    }

    public boolean submitAggregates(List<AggregateSummary> aggregates) {
        if (aggregates.isEmpty()) {
            return true;
        }
        return enqueue(new SinkTask(aggregates.size() + " aggregate(s)", s -> s.writeBatch(aggregates)));
    }

    private boolean enqueue(SinkTask task) {
        if (!running) {
            recordDrop("dispatcher stopped, discarded " + task.description());
            return false;
        }
        if (queue.offer(task)) {
            enqueued.incrementAndGet();
            return true;
        }
        if (overflowPolicy == EngineProperties.OverflowPolicy.REJECT_NEW) {
            recordDrop("buffer full, rejected " + task.description());
            return false;
        }
        while (!queue.offer(task)) {
            SinkTask evicted = queue.pollFirst();
            if (evicted != null) {
                recordDrop("buffer full, evicted " + evicted.description());
            }
        }
        enqueued.incrementAndGet();
        return true;
    }

    private void recordDrop(String detail) {
        long count = dropped.incrementAndGet();
        if (count == 1 || count % DROP_LOG_EVERY == 0) {
            log.warn("Sink write dropped ({} so far): {}", count, detail);
        }
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            SinkTask task;
            try {
                task = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Sink writer interrupted with {} pending write(s)", queue.size());
                return;
            }
            if (task != null) {
                deliver(task);
            }
        }
    }

    private void deliver(SinkTask task) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                task.write().accept(sink);
                written.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                if (attempt == maxAttempts) {
                    failed.incrementAndGet();
                    log.error("Giving up on {} after {} attempt(s)", task.description(), maxAttempts, e);
                    return;
                }
                log.debug("Sink attempt {}/{} failed for {}: {}", attempt, maxAttempts, task.description(), e.getMessage());
                try {
                    Thread.sleep(retryBackoff.multipliedBy(attempt).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    failed.incrementAndGet();
                    log.warn("Interrupted while retrying {}", task.description());
                    return;
                }
            }
        }
    }

    /**
     * Stops admission and waits up to the drain timeout for pending writes.
     */
    @PreDestroy
    public void close() {
        Thread current;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            current = writer;
        }
        try {
            current.join(drainTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            current.interrupt();
            log.warn("Sink dispatcher closed with {} write(s) still pending", queue.size());
        } else {
            log.info("Sink dispatcher closed (written={}, dropped={}, failed={})",
                written.get(), dropped.get(), failed.get());
        }
    }

    public long getEnqueued() {
        return enqueued.get();
    }

    public long getWritten() {
        return written.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public int getQueueDepth() {
        return queue.size();
    }
}

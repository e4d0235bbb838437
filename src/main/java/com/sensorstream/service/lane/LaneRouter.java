package com.sensorstream.service.lane;

import com.sensorstream.config.EngineProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fixed set of single-threaded lanes, each owning a disjoint set of machines.
 *
 * A machine always hashes to the same lane, so all work for it runs
 * sequentially while lanes run in parallel. No cross-lane locking.
 */
@Slf4j
@Component
public class LaneRouter {

    private final List<ExecutorService> lanes;
    private final Duration shutdownTimeout;
    private volatile boolean accepting = true;

    public LaneRouter(EngineProperties properties) {
        int count = properties.getLanes().getCount();
        this.shutdownTimeout = properties.getLanes().getShutdownTimeout();
        this.lanes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = "lane-" + i;
            lanes.add(Executors.newSingleThreadExecutor(task -> {
                Thread thread = new Thread(task, name);
                thread.setDaemon(true);
                return thread;
            }));
        }
        log.info("Started {} processing lane(s)", count);
    }

    public int laneFor(String machineId) {
        return Math.floorMod(machineId.hashCode(), lanes.size());
    }

    /**
     * Runs the work on the machine's lane.
     *
     * The returned future always completes: work still queued when shutdown
     * gives up waiting completes exceptionally with a RejectedExecutionException.
     *
     * @throws RejectedExecutionException once shutdown has begun
     */
    public <T> CompletableFuture<T> submit(String machineId, Supplier<T> work) {
        if (!accepting) {
            throw new RejectedExecutionException("Lanes are shutting down");
        }
        LaneTask<T> task = new LaneTask<>(work);
        lanes.get(laneFor(machineId)).execute(task);
        return task.future;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public int getLaneCount() {
        return lanes.size();
    }

    /**
     * Refuses new work and waits for queued and in-flight work to finish.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!accepting) {
            return;
        }
        accepting = false;
        lanes.forEach(ExecutorService::shutdown);

        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        for (ExecutorService lane : lanes) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!lane.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Lane did not finish within {}, interrupting", shutdownTimeout);
                    abandonQueued(lane);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandonQueued(lane);
            }
        }
        log.info("All processing lanes stopped");
    }

    private static void abandonQueued(ExecutorService lane) {
        int abandoned = 0;
        for (Runnable queued : lane.shutdownNow()) {
            if (queued instanceof LaneTask<?> task) {
                task.abandon();
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.warn("Abandoned {} queued task(s) of a stopped lane", abandoned);
        }
    }

    /**
     * Queued unit of lane work that keeps a handle on its future, so work
     * dropped by shutdownNow() can still complete it.
     */
    private static final class LaneTask<T> implements Runnable {

        private final Supplier<T> work;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        LaneTask(Supplier<T> work) {
            this.work = work;
        }

        @Override
        public void run() {
            try {
                future.complete(work.get());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }

        void abandon() {
            future.completeExceptionally(new RejectedExecutionException("Lane stopped before the task ran"));
        }
    }
}

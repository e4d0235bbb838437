package com.sensorstream.service.window;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.Metric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-machine bounded history of recent readings.
 *
 * Thread Safety Strategy:
 * - one window per machine_id, created lazily, held in a ConcurrentHashMap
 * - updates for one machine must come from a single lane (see LaneRouter)
 * - updates for different machines never share a lock
 *
 * Performance:
 * - eviction reverses the Welford update for the evicted reading; a rescan
 *   happens only when the evicted reading carried nearly all of the variance
 * - min/max via monotonic deques, amortized O(1)
 */
@Slf4j
@Component
public class RollingWindowStore {

    private final Map<String, MachineWindow> windows = new ConcurrentHashMap<>();
    private final int capacity;
    private final Map<Metric, Double> trendDeltas;

    public RollingWindowStore(EngineProperties properties) {
        this.capacity = properties.getWindow().getSize();
        this.trendDeltas = properties.getWindow().getTrendDeltas();
    }

    /**
     * Appends a reading to the machine's window, evicting the oldest at capacity.
     *
     * @throws WindowCorruptedException when the window fails its consistency check
     */
    public WindowSnapshot update(String machineId, EnrichedReading enriched) {
        MachineWindow window = windows.computeIfAbsent(machineId, id -> {
            log.debug("Creating window for machine {} with capacity {}", id, capacity);
            return new MachineWindow(id, capacity);
        });
        window.push(enriched);
        return window.snapshot(trendDeltas);
    }

    public WindowSnapshot snapshot(String machineId) {
        MachineWindow window = windows.get(machineId);
        if (window == null) {
            return WindowSnapshot.empty(machineId, capacity);
        }
        return window.snapshot(trendDeltas);
    }

    public OptionalDouble lag(String machineId, Metric metric, int k) {
        return snapshot(machineId).lag(metric, k);
    }

    /**
     * Drops the machine's window; the next reading starts a fresh one.
     */
    public void reset(String machineId) {
        if (windows.remove(machineId) != null) {
            log.warn("Window of machine {} reset", machineId);
        }
    }

    public int machineCount() {
        return windows.size();
    }

    public int getCapacity() {
        return capacity;
    }
}

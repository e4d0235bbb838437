package com.sensorstream.service.window;

import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.Metric;
import com.sensorstream.model.TrendDirection;
import com.sensorstream.model.TrendVerdict;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Bounded FIFO of the most recent readings of one machine plus running aggregates.
 *
 * Owned by {@link RollingWindowStore}. Callers route all readings of a machine
 * through one lane; the monitor only guards snapshot queries racing an update.
 */
class MachineWindow {

    /** Trend needs an oldest, a newest and at least one reading between them. */
    static final int MIN_TREND_READINGS = 3;

    private final String machineId;
    private final int capacity;
    private final Deque<EnrichedReading> readings;
    private final Map<Metric, MetricAccumulator> accumulators = new EnumMap<>(Metric.class);

    /** Sequence number of the oldest reading still in the window. */
    private long headSequence;
    private long nextSequence;

    MachineWindow(String machineId, int capacity) {
        this.machineId = machineId;
        this.capacity = capacity;
        this.readings = new ArrayDeque<>(capacity);
        for (Metric metric : Metric.values()) {
            accumulators.put(metric, new MetricAccumulator());
        }
    }

    synchronized void push(EnrichedReading enriched) {
        if (readings.size() == capacity) {
            EnrichedReading evicted = readings.pollFirst();
            for (Metric metric : Metric.values()) {
                MetricAccumulator accumulator = accumulators.get(metric);
                if (!accumulator.evict(headSequence, evicted.value(metric))) {
                    accumulator.rebase(series(metric));
                }
            }
            headSequence++;
        }
        long sequence = nextSequence++;
        readings.addLast(enriched);
        for (Metric metric : Metric.values()) {
            accumulators.get(metric).add(sequence, enriched.value(metric));
        }
        verify();
    }

    synchronized WindowSnapshot snapshot(Map<Metric, Double> trendDeltas) {
        int size = readings.size();
        Map<Metric, double[]> values = new EnumMap<>(Metric.class);
        Map<Metric, WindowStatistics> statistics = new EnumMap<>(Metric.class);
        Map<Metric, TrendVerdict> trends = new EnumMap<>(Metric.class);

        for (Metric metric : Metric.values()) {
            double[] series = series(metric);
            values.put(metric, series);
            statistics.put(metric, accumulators.get(metric).statistics());
            trends.put(metric, new TrendVerdict(metric, trend(series, trendDeltas.get(metric))));
        }
        if (size == 0) {
            return WindowSnapshot.empty(machineId, capacity);
        }
        return new WindowSnapshot(machineId, capacity, values, statistics, trends);
    }

    private double[] series(Metric metric) {
        double[] series = new double[readings.size()];
        Iterator<EnrichedReading> iterator = readings.iterator();
        for (int i = 0; i < series.length; i++) {
            series[i] = iterator.next().value(metric);
        }
        return series;
    }

    synchronized int size() {
        return readings.size();
    }

    private static TrendDirection trend(double[] series, double delta) {
        if (series.length < MIN_TREND_READINGS) {
            return TrendDirection.INSUFFICIENT_DATA;
        }
        double oldest = series[0];
        double newest = series[series.length - 1];
        if (newest > oldest + delta) {
            return TrendDirection.INCREASING;
        }
        if (newest < oldest - delta) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    private void verify() {
        if (readings.size() > capacity) {
            throw new WindowCorruptedException(machineId,
                "holds " + readings.size() + " readings, capacity is " + capacity);
        }
        if (nextSequence - headSequence != readings.size()) {
            throw new WindowCorruptedException(machineId, "sequence range does not match reading count");
        }
        for (Map.Entry<Metric, MetricAccumulator> entry : accumulators.entrySet()) {
            MetricAccumulator accumulator = entry.getValue();
            if (accumulator.count() != readings.size() || !accumulator.isConsistent()) {
                throw new WindowCorruptedException(machineId,
                    "running aggregates of " + entry.getKey().jsonName() + " are inconsistent");
            }
        }
    }
}

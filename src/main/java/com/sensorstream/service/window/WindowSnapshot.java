package com.sensorstream.service.window;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorstream.model.Metric;
import com.sensorstream.model.TrendDirection;
import com.sensorstream.model.TrendVerdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable view of a machine window taken right after an update or on query.
 */
public final class WindowSnapshot {

    private static final List<String> FEATURE_SUFFIXES =
        List.of("_lag_1", "_diff", "_mean", "_std", "_min", "_max", "_trend");

    private final String machineId;
    private final int size;
    private final int capacity;
    private final Map<Metric, WindowStatistics> statistics;
    private final Map<Metric, TrendVerdict> trends;

    /** Per metric, oldest first. */
    private final Map<Metric, double[]> values;

    WindowSnapshot(String machineId, int capacity, Map<Metric, double[]> values,
                   Map<Metric, WindowStatistics> statistics, Map<Metric, TrendVerdict> trends) {
        this.machineId = machineId;
        this.capacity = capacity;
        this.values = values;
        this.size = values.isEmpty() ? 0 : values.get(Metric.TEMPERATURE).length;
        this.statistics = Collections.unmodifiableMap(statistics);
        this.trends = Collections.unmodifiableMap(trends);
    }

    /**
     * Snapshot of a machine that has no readings yet.
     */
    public static WindowSnapshot empty(String machineId, int capacity) {
        Map<Metric, TrendVerdict> trends = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            trends.put(metric, new TrendVerdict(metric, TrendDirection.INSUFFICIENT_DATA));
        }
        return new WindowSnapshot(machineId, capacity, new EnumMap<>(Metric.class),
            new EnumMap<>(Metric.class), trends);
    }

    @JsonProperty("machine_id")
    public String getMachineId() {
        return machineId;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size == 0;
    }

    public Map<String, WindowStatistics> getStatistics() {
        Map<String, WindowStatistics> byName = new LinkedHashMap<>();
        statistics.forEach((metric, stats) -> byName.put(metric.jsonName(), stats));
        return byName;
    }

    public Optional<WindowStatistics> statistics(Metric metric) {
        return Optional.ofNullable(statistics.get(metric));
    }

    public Map<String, TrendDirection> getTrends() {
        Map<String, TrendDirection> directions = new LinkedHashMap<>();
        trends.forEach((metric, verdict) -> directions.put(metric.jsonName(), verdict.direction()));
        return directions;
    }

    public TrendVerdict trend(Metric metric) {
        return trends.get(metric);
    }

    /**
     * Value of the metric k positions back from the newest reading; lag 0 is the newest.
     * Empty when the window holds fewer than k + 1 readings.
     */
    public OptionalDouble lag(Metric metric, int k) {
        if (k < 0 || k >= size) {
            return OptionalDouble.empty();
        }
        double[] series = values.get(metric);
        return OptionalDouble.of(series[series.length - 1 - k]);
    }

    /**
     * Newest value minus the previous one.
     */
    public OptionalDouble diff(Metric metric) {
        OptionalDouble previous = lag(metric, 1);
        if (previous.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(lag(metric, 0).getAsDouble() - previous.getAsDouble());
    }

    /**
     * True for every name {@link #features()} can produce, whether or not the
     * current window is full enough to produce it.
     */
    public static boolean isFeatureName(String name) {
        for (Metric metric : Metric.values()) {
            String prefix = metric.featurePrefix();
            if (name.startsWith(prefix) && FEATURE_SUFFIXES.contains(name.substring(prefix.length()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Flat window features for the outbound record, e.g. temp_lag_1, vib_std, pressure_trend.
     * Lag and diff are omitted while the window holds a single reading.
     */
    public Map<String, Object> features() {
        Map<String, Object> features = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            String prefix = metric.featurePrefix();
            lag(metric, 1).ifPresent(value -> features.put(prefix + "_lag_1", value));
            diff(metric).ifPresent(value -> features.put(prefix + "_diff", value));
            statistics(metric).ifPresent(stats -> {
                features.put(prefix + "_mean", stats.mean());
                features.put(prefix + "_std", stats.stddev());
                features.put(prefix + "_min", stats.min());
                features.put(prefix + "_max", stats.max());
            });
            features.put(prefix + "_trend", trends.get(metric).direction());
        }
        return features;
    }
}

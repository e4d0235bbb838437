package com.sensorstream.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A raw reading that passed type validation.
 *
 * Range checks are advisory: rangeWarning is set when any metric is outside
 * its plausible physical range, and the offending metrics are listed in
 * outOfRangeMetrics. Unknown inbound fields are kept in attributes so the outbound
 * record stays a superset of the inbound one.
 */
@Value
@Builder
public class ValidatedReading {

    String machineId;

    /** Unix seconds. */
    long timestamp;

    double temperature;
    double vibration;
    double pressure;

    boolean rangeWarning;

    @Singular("outOfRange")
    List<Metric> outOfRangeMetrics;

    @Singular
    Map<String, Object> attributes;

    public double value(Metric metric) {
        return switch (metric) {
            case TEMPERATURE -> temperature;
            case VIBRATION -> vibration;
            case PRESSURE -> pressure;
        };
    }
}

package com.sensorstream.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A validated reading plus its per-reading derived features and rule flags.
 * Immutable once built.
 */
@Value
@Builder
public class EnrichedReading {

    public static final String DATA_VERSION = "1.0";

    ValidatedReading reading;

    double tempVibRatio;
    double pressureTempRatio;

    boolean anomalyTemp;
    boolean anomalyVib;
    boolean anomalyPressure;

    /** Number of rule flags raised, 0 to 3. */
    int ruleAnomalyScore;

    Instant processedAt;

    public String getMachineId() {
        return reading.getMachineId();
    }

    public long getTimestamp() {
        return reading.getTimestamp();
    }

    public double value(Metric metric) {
        return reading.value(metric);
    }

    public FeatureVector featureVector() {
        return new FeatureVector(
                reading.getTemperature(),
                reading.getVibration(),
                reading.getPressure(),
                tempVibRatio,
                pressureTempRatio);
    }
}

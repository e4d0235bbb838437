package com.sensorstream.service;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.Metric;
import com.sensorstream.model.ValidatedReading;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Derives per-reading ratios and rule-based anomaly flags.
 *
 * Deterministic for a given reading and clock; no shared state.
 */
@Component
@RequiredArgsConstructor
public class FeatureEnricher {

    /** Denominator guard for the ratio features. */
    public static final double EPSILON = 0.001;

    private final EngineProperties properties;
    private final Clock clock;

    public EnrichedReading enrich(ValidatedReading reading) {
        Map<Metric, Double> thresholds = properties.getRules().getThresholds();

        boolean anomalyTemp = reading.getTemperature() > thresholds.get(Metric.TEMPERATURE);
        boolean anomalyVib = reading.getVibration() > thresholds.get(Metric.VIBRATION);
        boolean anomalyPressure = reading.getPressure() > thresholds.get(Metric.PRESSURE);

        return EnrichedReading.builder()
            .reading(reading)
            .tempVibRatio(reading.getTemperature() / (reading.getVibration() + EPSILON))
            .pressureTempRatio(reading.getPressure() / (reading.getTemperature() + EPSILON))
            .anomalyTemp(anomalyTemp)
            .anomalyVib(anomalyVib)
            .anomalyPressure(anomalyPressure)
            .ruleAnomalyScore(flag(anomalyTemp) + flag(anomalyVib) + flag(anomalyPressure))
            .processedAt(clock.instant())
            .build();
    }

    private static int flag(boolean raised) {
        return raised ? 1 : 0;
    }
}

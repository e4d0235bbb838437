package com.sensorstream.service;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.Metric;
import com.sensorstream.model.RejectionReason;
import com.sensorstream.model.ValidatedReading;
import com.sensorstream.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Checks a raw reading for required fields, numeric coercibility and plausible ranges.
 *
 * Rules:
 * - machine_id, temperature, vibration and pressure must be present
 * - metrics must be numbers or numeric strings, finite
 * - timestamp must be integral (numbers are truncated, strings must parse as a long)
 *   and within Instant's range; when absent it defaults to ingestion time
 * - out-of-range metrics only raise range_warning, they never reject
 *
 * Pure apart from reading the clock; logging warnings is left to the caller.
 */
@Component
@RequiredArgsConstructor
public class ReadingValidator {

    public static final String MACHINE_ID = "machine_id";
    public static final String TIMESTAMP = "timestamp";

    private static final Set<String> KNOWN_FIELDS = Set.of(
        MACHINE_ID, TIMESTAMP,
        Metric.TEMPERATURE.jsonName(), Metric.VIBRATION.jsonName(), Metric.PRESSURE.jsonName());

    private final EngineProperties properties;
    private final Clock clock;

    public ValidationResult validate(Map<String, Object> raw) {
        if (raw == null) {
            return ValidationResult.rejected(RejectionReason.missingField(MACHINE_ID));
        }

        // Step 1: presence
        Object machineId = raw.get(MACHINE_ID);
        if (machineId == null || machineId.toString().isBlank()) {
            return ValidationResult.rejected(RejectionReason.missingField(MACHINE_ID));
        }
        for (Metric metric : Metric.values()) {
            if (!raw.containsKey(metric.jsonName())) {
                return ValidationResult.rejected(RejectionReason.missingField(metric.jsonName()));
            }
        }

        // Step 2: types
        double[] values = new double[Metric.values().length];
        for (Metric metric : Metric.values()) {
            Object value = raw.get(metric.jsonName());
            Double parsed = toDouble(value);
            if (parsed == null) {
                return ValidationResult.rejected(RejectionReason.typeError(metric.jsonName(),
                    "is not a number: " + describe(value)));
            }
            if (!Double.isFinite(parsed)) {
                return ValidationResult.rejected(RejectionReason.typeError(metric.jsonName(),
                    "is not finite: " + parsed));
            }
            values[metric.ordinal()] = parsed;
        }

        long timestamp;
        if (raw.containsKey(TIMESTAMP)) {
            Long parsed = toLong(raw.get(TIMESTAMP));
            if (parsed == null) {
                return ValidationResult.rejected(RejectionReason.typeError(TIMESTAMP,
                    "is not an integer: " + describe(raw.get(TIMESTAMP))));
            }
            if (parsed < Instant.MIN.getEpochSecond() || parsed > Instant.MAX.getEpochSecond()) {
                return ValidationResult.rejected(RejectionReason.typeError(TIMESTAMP,
                    "is outside the representable range: " + parsed));
            }
            timestamp = parsed;
        } else {
            timestamp = clock.instant().getEpochSecond();
        }

        // Step 3: advisory ranges
        ValidatedReading.ValidatedReadingBuilder builder = ValidatedReading.builder()
            .machineId(machineId.toString())
            .timestamp(timestamp)
            .temperature(values[Metric.TEMPERATURE.ordinal()])
            .vibration(values[Metric.VIBRATION.ordinal()])
            .pressure(values[Metric.PRESSURE.ordinal()]);

        boolean rangeWarning = false;
        for (Metric metric : Metric.values()) {
            double value = values[metric.ordinal()];
            if (value < properties.getRanges().getMin().get(metric)
                    || value > properties.getRanges().getMax().get(metric)) {
                builder.outOfRange(metric);
                rangeWarning = true;
            }
        }
        builder.rangeWarning(rangeWarning);

        raw.forEach((field, value) -> {
            if (!KNOWN_FIELDS.contains(field)) {
                builder.attribute(field, value);
            }
        });

        return ValidationResult.valid(builder.build());
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Long toLong(Object value) {
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            return Double.isFinite(asDouble) ? number.longValue() : null;
        }
        if (value instanceof String text) {
            // "1.5" is not an integer even though 1.5 would be truncated
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String describe(Object value) {
        return value == null ? "null" : "'" + value + "'";
    }
}

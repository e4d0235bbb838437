package com.sensorstream.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sensorstream.model.Severity;
import com.sensorstream.model.VerdictSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Outbound enriched record: the inbound reading, its derived features,
 * window features and the anomaly verdict.
 *
 * Rule flags are 0/1 integers, as downstream queries sum them.
 * extraFields carries inbound fields the engine does not interpret plus the
 * flat window features (temp_lag_1, vib_trend, ...), written at top level.
 * Extra fields never reuse a name in {@link #PROPERTY_NAMES}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichedRecord {

    /** Outbound names of the record's own properties. */
    public static final Set<String> PROPERTY_NAMES = Set.of(
        "machine_id", "timestamp", "temperature", "vibration", "pressure",
        "temp_vib_ratio", "pressure_temp_ratio",
        "is_anomaly_temp", "is_anomaly_vib", "is_anomaly_pressure", "rule_anomaly_score", "range_warning",
        "is_anomaly", "severity", "source", "confidence",
        "data_version", "processed_at", "processing_time_ms");

    private String machineId;
    private long timestamp;
    private double temperature;
    private double vibration;
    private double pressure;

    private double tempVibRatio;
    private double pressureTempRatio;
    private int isAnomalyTemp;
    private int isAnomalyVib;
    private int isAnomalyPressure;
    private int ruleAnomalyScore;
    private boolean rangeWarning;

    @JsonProperty("is_anomaly")
    private boolean anomaly;
    private Severity severity;
    private VerdictSource source;
    private Double confidence;

    private String dataVersion;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant processedAt;

    private double processingTimeMs;

    @Builder.Default
    private Map<String, Object> extraFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtraFields() {
        return extraFields;
    }
}

package com.sensorstream.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sensorstream.model.Severity;
import com.sensorstream.model.VerdictSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Alert raised for every reading classified as an anomaly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertMessage {

    public static final String ANOMALY_DETECTED = "anomaly_detected";

    @Builder.Default
    private String alertType = ANOMALY_DETECTED;

    private String machineId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant timestamp;

    private SensorData sensorData;
    private PredictionDetail prediction;
    private Severity severity;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SensorData {
        private double temperature;
        private double vibration;
        private double pressure;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PredictionDetail {
        private int prediction;
        private String predictionLabel;
        private Double confidence;
        private VerdictSource source;
    }
}

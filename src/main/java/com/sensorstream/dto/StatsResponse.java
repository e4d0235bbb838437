package com.sensorstream.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for stats query endpoint.
 *
 * Provides:
 * - readingsCount: persisted readings in the time window
 * - anomalyCount: readings whose verdict was an anomaly
 * - anomalyRate: anomalies per 100 readings
 * - avg of each metric
 * - status: "Healthy" if anomalyRate < 10, else "Warning"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StatsResponse {

    private String machineId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant start;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant end;

    private long readingsCount;
    private long anomalyCount;
    private double anomalyRate;
    private double avgTemperature;
    private double avgVibration;
    private double avgPressure;
    private String status;
}

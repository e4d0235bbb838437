package com.sensorstream.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response item for top anomalous machines endpoint.
 *
 * Contains:
 * - machineId: machine identifier
 * - anomalyCount: readings classified as anomalies
 * - readingCount: number of readings
 * - anomalyPercent: anomalies per 100 readings (rounded to 2 decimals)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TopAnomalousMachineResponse {

    private String machineId;
    private long anomalyCount;
    private long readingCount;
    private double anomalyPercent;
}

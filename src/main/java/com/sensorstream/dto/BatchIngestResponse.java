package com.sensorstream.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for batch ingestion endpoint.
 *
 * Tracks:
 * - accepted: readings processed with a verdict attached
 * - rejected: readings that failed validation
 * - failed: readings lost to an internal error or refused during shutdown
 * - anomalies: accepted readings whose verdict is an anomaly
 * - degraded: accepted readings classified on rules alone because the model was unavailable
 * - rejections: one entry per rejected or failed reading
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchIngestResponse {

    private int accepted;
    private int rejected;
    private int failed;
    private int anomalies;
    private int degraded;
    private double processingTimeMs;

    @Builder.Default
    private List<RejectionDetail> rejections = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RejectionDetail {
        private int index;
        private String machineId;
        private String reason;
    }
}

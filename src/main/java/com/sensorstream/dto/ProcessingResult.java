package com.sensorstream.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sensorstream.model.AnomalyVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of handling a single raw reading.
 *
 * - PROCESSED (200): record and verdict attached, possibly degraded to rule-only
 * - REJECTED (400): validation failure, reason attached, no state touched
 * - FAILED (500): unexpected internal error for this record only
 * - REFUSED (503): engine is shutting down and no longer admits readings
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessingResult {

    public enum Status {
        PROCESSED(200),
        REJECTED(400),
        FAILED(500),
        REFUSED(503);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private Status status;
    private String machineId;
    private EnrichedRecord record;
    private AnomalyVerdict verdict;
    private boolean degraded;
    private String reason;

    @JsonIgnore
    public int getHttpStatus() {
        return status.httpStatus();
    }

    public static ProcessingResult rejected(String machineId, String reason) {
        return ProcessingResult.builder()
            .status(Status.REJECTED)
            .machineId(machineId)
            .reason(reason)
            .build();
    }

    public static ProcessingResult failed(String machineId, String reason) {
        return ProcessingResult.builder()
            .status(Status.FAILED)
            .machineId(machineId)
            .reason(reason)
            .build();
    }

    public static ProcessingResult refused(String machineId) {
        return ProcessingResult.builder()
            .status(Status.REFUSED)
            .machineId(machineId)
            .reason("engine is shutting down")
            .build();
    }
}

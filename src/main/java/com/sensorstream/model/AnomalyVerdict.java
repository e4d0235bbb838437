package com.sensorstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Final anomaly decision for one reading.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyVerdict {

    @JsonProperty("machine_id")
    String machineId;

    @JsonProperty("is_anomaly")
    boolean anomaly;

    Severity severity;

    VerdictSource source;

    /** Model confidence, null for rule-only verdicts. */
    Double confidence;

    /**
     * Baseline verdict: anomalous as soon as any rule flag is raised.
     */
    public static AnomalyVerdict ruleBased(EnrichedReading enriched) {
        boolean anomaly = enriched.getRuleAnomalyScore() > 0;
        return AnomalyVerdict.builder()
                .machineId(enriched.getMachineId())
                .anomaly(anomaly)
                .severity(anomaly ? Severity.HIGH : Severity.NORMAL)
                .source(VerdictSource.RULE)
                .build();
    }
}

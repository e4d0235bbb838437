package com.sensorstream.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of the running engine, including sink back-pressure outcomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EngineStatsResponse {

    private boolean accepting;
    private int laneCount;

    private long processed;
    private long rejected;
    private long failed;
    private long refused;
    private long anomalies;
    private long degraded;

    private int trackedMachines;
    private int liveBuckets;
    private long lateCorrected;
    private long lateDropped;

    private long sinkEnqueued;
    private long sinkWritten;
    private long sinkDropped;
    private long sinkFailed;
    private int sinkQueueDepth;
}

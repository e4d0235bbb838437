package com.sensorstream.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing one emitted aggregate bucket.
 *
 * Correction rows share machineId/bucketStart with the original row; consumers
 * add them to it rather than replace it.
 */
@Entity
@Table(name = "machine_aggregates", indexes = {
    @Index(name = "idx_aggregate_machine_bucket", columnList = "machineId,bucketStart")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MachineAggregate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String machineId;

    @Column(nullable = false)
    private Instant bucketStart;

    @Column(nullable = false)
    private Instant bucketEnd;

    private long recordCount;
    private long anomalyCount;

    private double temperatureMean;
    private double temperatureStddev;
    private double temperatureMin;
    private double temperatureMax;

    private double vibrationMean;
    private double vibrationStddev;
    private double vibrationMin;
    private double vibrationMax;

    private double pressureMean;
    private double pressureStddev;
    private double pressureMin;
    private double pressureMax;

    private boolean correction;
}

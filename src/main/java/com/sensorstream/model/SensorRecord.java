package com.sensorstream.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing one enriched and classified sensor reading.
 *
 * Key design decisions:
 * - surrogate id, readings carry no natural key
 * - indexes on machineId and eventTime for the stats queries
 * - verdict columns are denormalized so the stats queries need no join
 */
@Entity
@Table(name = "sensor_records", indexes = {
    @Index(name = "idx_record_machine_time", columnList = "machineId,eventTime"),
    @Index(name = "idx_record_event_time", columnList = "eventTime")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String machineId;

    @Column(nullable = false)
    private Instant eventTime;

    @Column(nullable = false)
    private Instant processedAt;

    private double temperature;
    private double vibration;
    private double pressure;

    private double tempVibRatio;
    private double pressureTempRatio;

    private int ruleAnomalyScore;

    private boolean rangeWarning;

    private boolean anomaly;

    @Column(length = 20)
    private String severity;

    @Column(length = 20)
    private String source;

    /**
     * Model confidence, null when the verdict is rule-only.
     */
    private Double confidence;
}

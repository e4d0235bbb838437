package com.sensorstream.service.sink;

import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.EnrichedRecord;
import com.sensorstream.model.MachineAggregate;
import com.sensorstream.model.SensorRecord;
import com.sensorstream.model.Severity;
import com.sensorstream.model.VerdictSource;
import com.sensorstream.repository.MachineAggregateRepository;
import com.sensorstream.repository.SensorRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for JpaStorageSink.
 *
 * Tests cover:
 * 1. Enriched record lands in sensor_records with its verdict
 * 2. Aggregate batch lands in machine_aggregates, correction flag kept
 */
@SpringBootTest
@ActiveProfiles("test")
class JpaStorageSinkTest {

    @Autowired
    private JpaStorageSink sink;

    @Autowired
    private SensorRecordRepository recordRepository;

    @Autowired
    private MachineAggregateRepository aggregateRepository;

    /**
     * Test 1: write(record) → one row, epoch seconds stored as an instant
     */
    @Test
    void testWriteRecord() {
        sink.write(EnrichedRecord.builder()
            .machineId("J-001")
            .timestamp(1705312800L)
            .temperature(85.0)
            .vibration(1.0)
            .pressure(100.0)
            .tempVibRatio(84.9)
            .pressureTempRatio(1.18)
            .ruleAnomalyScore(1)
            .anomaly(true)
            .severity(Severity.HIGH)
            .source(VerdictSource.COMBINED)
            .confidence(0.93)
            .processedAt(Instant.parse("2024-01-15T10:00:01Z"))
            .build());

        List<SensorRecord> stored = recordRepository.findByMachineIdOrderByEventTimeAsc("J-001");
        assertEquals(1, stored.size());
        SensorRecord row = stored.get(0);
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), row.getEventTime());
        assertTrue(row.isAnomaly());
        assertEquals("high", row.getSeverity());
        assertEquals("combined", row.getSource());
        assertEquals(0.93, row.getConfidence());
    }

    /**
     * Test 2: writeBatch → one row per bucket in bucket order
     */
    @Test
    void testWriteAggregates() {
        sink.writeBatch(List.of(
            aggregate("J-002", "2024-01-15T11:00:00Z", false),
            aggregate("J-002", "2024-01-15T10:00:00Z", true)));

        List<MachineAggregate> stored = aggregateRepository.findByMachineIdOrderByBucketStartAsc("J-002");
        assertEquals(2, stored.size());
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), stored.get(0).getBucketStart());
        assertTrue(stored.get(0).isCorrection());
        assertEquals(12, stored.get(1).getRecordCount());
        assertEquals(72.5, stored.get(1).getTemperatureMean());
        assertEquals(3, stored.get(1).getAnomalyCount());
    }

    private static AggregateSummary aggregate(String machineId, String bucketStart, boolean correction) {
        Instant start = Instant.parse(bucketStart);
        AggregateSummary.MetricSummary metric = AggregateSummary.MetricSummary.builder()
            .mean(72.5).stddev(1.2).min(70.0).max(75.0)
            .build();
        return AggregateSummary.builder()
            .machineId(machineId)
            .bucketStart(start)
            .bucketEnd(start.plusSeconds(3600))
            .count(12)
            .temperature(metric)
            .vibration(metric)
            .pressure(metric)
            .anomalyCount(3)
            .correction(correction)
            .build();
    }
}

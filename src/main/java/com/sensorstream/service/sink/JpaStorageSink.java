package com.sensorstream.service.sink;

import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.EnrichedRecord;
import com.sensorstream.model.MachineAggregate;
import com.sensorstream.model.SensorRecord;
import com.sensorstream.repository.MachineAggregateRepository;
import com.sensorstream.repository.SensorRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Storage sink backed by the sensor_records and machine_aggregates tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaStorageSink implements StorageSink {

    private final SensorRecordRepository recordRepository;
    private final MachineAggregateRepository aggregateRepository;

    @Override
    public void write(EnrichedRecord record) {
        try {
            recordRepository.save(toEntity(record));
        } catch (DataAccessException e) {
            throw new SinkException("Failed to store record of machine " + record.getMachineId(), e);
        }
    }

    @Override
    @Transactional
    public void writeBatch(List<AggregateSummary> aggregates) {
        if (aggregates.isEmpty()) {
            return;
        }
        try {
            aggregateRepository.saveAll(aggregates.stream().map(JpaStorageSink::toEntity).toList());
            log.debug("Stored {} aggregate(s)", aggregates.size());
        } catch (DataAccessException e) {
            throw new SinkException("Failed to store " + aggregates.size() + " aggregate(s)", e);
        }
    }

    private static SensorRecord toEntity(EnrichedRecord record) {
        return SensorRecord.builder()
            .machineId(record.getMachineId())
            .eventTime(Instant.ofEpochSecond(record.getTimestamp()))
            .processedAt(record.getProcessedAt())
            .temperature(record.getTemperature())
            .vibration(record.getVibration())
            .pressure(record.getPressure())
            .tempVibRatio(record.getTempVibRatio())
            .pressureTempRatio(record.getPressureTempRatio())
            .ruleAnomalyScore(record.getRuleAnomalyScore())
            .rangeWarning(record.isRangeWarning())
            .anomaly(record.isAnomaly())
            .severity(record.getSeverity() != null ? record.getSeverity().jsonValue() : null)
            .source(record.getSource() != null ? record.getSource().jsonValue() : null)
            .confidence(record.getConfidence())
            .build();
    }

    private static MachineAggregate toEntity(AggregateSummary summary) {
        return MachineAggregate.builder()
            .machineId(summary.getMachineId())
            .bucketStart(summary.getBucketStart())
            .bucketEnd(summary.getBucketEnd())
            .recordCount(summary.getCount())
            .anomalyCount(summary.getAnomalyCount())
            .temperatureMean(summary.getTemperature().getMean())
            .temperatureStddev(summary.getTemperature().getStddev())
            .temperatureMin(summary.getTemperature().getMin())
            .temperatureMax(summary.getTemperature().getMax())
            .vibrationMean(summary.getVibration().getMean())
            .vibrationStddev(summary.getVibration().getStddev())
            .vibrationMin(summary.getVibration().getMin())
            .vibrationMax(summary.getVibration().getMax())
            .pressureMean(summary.getPressure().getMean())
            .pressureStddev(summary.getPressure().getStddev())
            .pressureMin(summary.getPressure().getMin())
            .pressureMax(summary.getPressure().getMax())
            .correction(summary.isCorrection())
            .build();
    }
}

package com.sensorstream.service;

import com.sensorstream.dto.StatsResponse;
import com.sensorstream.dto.TopAnomalousMachineResponse;
import com.sensorstream.repository.SensorRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-side queries over persisted enriched records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MachineStatsService {

    static final double WARNING_ANOMALY_RATE = 10.0;

    private final SensorRecordRepository recordRepository;

    /**
     * Get statistics for a machine within a time window.
     *
     * anomalyRate is anomalies per 100 readings; status is "Healthy" below
     * the warning rate, "Warning" otherwise.
     */
    @Transactional(readOnly = true)
    public StatsResponse getStats(String machineId, Instant start, Instant end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start");
        }
        long readingsCount = recordRepository.countByMachineAndTimeRange(machineId, start, end);
        long anomalyCount = recordRepository.countAnomaliesByMachineAndTimeRange(machineId, start, end);

        double anomalyRate = readingsCount > 0 ? anomalyCount * 100.0 / readingsCount : 0.0;
        String status = anomalyRate < WARNING_ANOMALY_RATE ? "Healthy" : "Warning";

        double avgTemperature = 0.0, avgVibration = 0.0, avgPressure = 0.0;
        List<Object[]> averages = recordRepository.averagesByMachineAndTimeRange(machineId, start, end);
        if (!averages.isEmpty()) {
            Object[] row = averages.get(0);
            avgTemperature = toDouble(row[0]);
            avgVibration = toDouble(row[1]);
            avgPressure = toDouble(row[2]);
        }

        return StatsResponse.builder()
            .machineId(machineId)
            .start(start)
            .end(end)
            .readingsCount(readingsCount)
            .anomalyCount(anomalyCount)
            .anomalyRate(round2(anomalyRate))
            .avgTemperature(round2(avgTemperature))
            .avgVibration(round2(avgVibration))
            .avgPressure(round2(avgPressure))
            .status(status)
            .build();
    }

    /**
     * Machines with the most anomalies in the window, most anomalous first.
     */
    @Transactional(readOnly = true)
    public List<TopAnomalousMachineResponse> getTopAnomalousMachines(Instant from, Instant to, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<Object[]> results = recordRepository.findAnomalyCountsByMachine(from, to);

        return results.stream()
            .limit(limit)
            .map(row -> {
                String machineId = (String) row[0];
                long anomalyCount = ((Number) row[1]).longValue();
                long readingCount = ((Number) row[2]).longValue();
                double anomalyPercent = readingCount > 0 ? (anomalyCount * 100.0 / readingCount) : 0.0;

                return TopAnomalousMachineResponse.builder()
                    .machineId(machineId)
                    .anomalyCount(anomalyCount)
                    .readingCount(readingCount)
                    .anomalyPercent(round2(anomalyPercent))
                    .build();
            })
            .collect(Collectors.toList());
    }

    private static double toDouble(Object value) {
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

package com.sensorstream.repository;

import com.sensorstream.model.SensorRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for SensorRecord entity.
 *
 * Provides:
 * - Basic CRUD operations (from JpaRepository)
 * - Custom queries for machine statistics
 */
@Repository
public interface SensorRecordRepository extends JpaRepository<SensorRecord, Long> {

    /**
     * Count readings for a machine within a time window.
     * Start is inclusive, end is exclusive.
     */
    @Query("SELECT COUNT(r) FROM SensorRecord r WHERE r.machineId = :machineId " +
           "AND r.eventTime >= :start AND r.eventTime < :end")
    long countByMachineAndTimeRange(
        @Param("machineId") String machineId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    /**
     * Count readings classified as anomalies for a machine within a time window.
     */
    @Query("SELECT COUNT(r) FROM SensorRecord r WHERE r.machineId = :machineId " +
           "AND r.eventTime >= :start AND r.eventTime < :end " +
           "AND r.anomaly = true")
    long countAnomaliesByMachineAndTimeRange(
        @Param("machineId") String machineId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    /**
     * Average temperature, vibration and pressure for a machine within a time window.
     * Returns a single row of three nullable doubles.
     */
    @Query("SELECT AVG(r.temperature), AVG(r.vibration), AVG(r.pressure) FROM SensorRecord r " +
           "WHERE r.machineId = :machineId " +
           "AND r.eventTime >= :start AND r.eventTime < :end")
    List<Object[]> averagesByMachineAndTimeRange(
        @Param("machineId") String machineId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    /**
     * Anomaly and reading counts per machine, most anomalies first.
     * Used for top-anomalous-machines endpoint.
     */
    @Query("SELECT r.machineId, " +
           "SUM(CASE WHEN r.anomaly = true THEN 1 ELSE 0 END), COUNT(r) " +
           "FROM SensorRecord r " +
           "WHERE r.eventTime >= :from AND r.eventTime < :to " +
           "GROUP BY r.machineId " +
           "ORDER BY SUM(CASE WHEN r.anomaly = true THEN 1 ELSE 0 END) DESC, r.machineId")
    List<Object[]> findAnomalyCountsByMachine(
        @Param("from") Instant from,
        @Param("to") Instant to
    );

    List<SensorRecord> findByMachineIdOrderByEventTimeAsc(String machineId);
}

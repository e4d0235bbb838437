package com.sensorstream.controller;

import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.BatchIngestResponse;
import com.sensorstream.dto.EngineStatsResponse;
import com.sensorstream.dto.ProcessingResult;
import com.sensorstream.dto.StatsResponse;
import com.sensorstream.dto.TopAnomalousMachineResponse;
import com.sensorstream.service.MachineStatsService;
import com.sensorstream.service.StreamingEngine;
import com.sensorstream.service.window.WindowSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for sensor readings.
 *
 * Endpoints:
 * 1. POST /readings - Process one reading
 * 2. POST /readings/batch - Process a batch of readings
 * 3. GET /machines/{machineId}/window - Current rolling window of a machine
 * 4. POST /aggregates/flush - Emit every live aggregate bucket
 * 5. POST /aggregates/flush/{machineId} - Emit one aggregate bucket
 * 6. GET /engine/stats - Engine counters
 * 7. GET /stats - Query statistics for a machine
 * 8. GET /stats/top-anomalous-machines - Machines with the most anomalies
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ReadingController {

    private final StreamingEngine engine;
    private final MachineStatsService statsService;

    /**
     * Process a single reading.
     *
     * POST /readings
     *
     * Response: ProcessingResult; 200 processed, 400 rejected,
     * 500 failed, 503 shutting down.
     */
    @PostMapping("/readings")
    public ResponseEntity<ProcessingResult> ingest(@RequestBody Map<String, Object> reading) {
        ProcessingResult result = engine.process(reading);
        return ResponseEntity.status(result.getHttpStatus()).body(result);
    }

    /**
     * Process a batch of readings.
     *
     * POST /readings/batch
     *
     * Request body: JSON array of readings
     * Response: BatchIngestResponse with counts and per-reading rejection details
     */
    @PostMapping("/readings/batch")
    public ResponseEntity<BatchIngestResponse> ingestBatch(@RequestBody List<Map<String, Object>> readings) {
        log.info("Received batch of {} readings", readings.size());
        BatchIngestResponse response = engine.processBatch(readings);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/machines/{machineId}/window")
    public ResponseEntity<WindowSnapshot> getWindow(@PathVariable String machineId) {
        return ResponseEntity.ok(engine.window(machineId));
    }

    @PostMapping("/aggregates/flush")
    public ResponseEntity<List<AggregateSummary>> flushAggregates() {
        List<AggregateSummary> flushed = engine.flushAggregates();
        log.info("Flushed {} aggregate bucket(s) on request", flushed.size());
        return ResponseEntity.ok(flushed);
    }

    /**
     * Emit the live bucket of a machine containing the given time.
     *
     * POST /aggregates/flush/M-001?bucketStart=1705276800
     *
     * Response: the emitted AggregateSummary, or 404 when no such bucket is live
     */
    @PostMapping("/aggregates/flush/{machineId}")
    public ResponseEntity<AggregateSummary> flushAggregate(
            @PathVariable String machineId,
            @RequestParam long bucketStart) {

        return engine.flushAggregate(machineId, bucketStart)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/engine/stats")
    public ResponseEntity<EngineStatsResponse> getEngineStats() {
        return ResponseEntity.ok(engine.stats());
    }

    /**
     * Get statistics for a machine within a time window.
     *
     * GET /stats?machineId=M-001&start=2026-01-15T00:00:00Z&end=2026-01-15T06:00:00Z
     *
     * Query params:
     * - machineId: machine identifier
     * - start: start time (inclusive), ISO-8601 format
     * - end: end time (exclusive), ISO-8601 format
     */
    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats(
            @RequestParam String machineId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        log.info("Querying stats for machine={}, start={}, end={}", machineId, start, end);
        return ResponseEntity.ok(statsService.getStats(machineId, start, end));
    }

    /**
     * Get the machines with the most anomalies.
     *
     * GET /stats/top-anomalous-machines?from=2026-01-15T00:00:00Z&to=2026-01-15T23:59:59Z&limit=10
     *
     * Response: List of TopAnomalousMachineResponse sorted by anomaly count (descending)
     */
    @GetMapping("/stats/top-anomalous-machines")
    public ResponseEntity<List<TopAnomalousMachineResponse>> getTopAnomalousMachines(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "10") int limit) {

        log.info("Querying top anomalous machines from={}, to={}, limit={}", from, to, limit);
        return ResponseEntity.ok(statsService.getTopAnomalousMachines(from, to, limit));
    }

    /**
     * Malformed bodies and bad query parameters.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Error processing request", e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage()));
    }

    private record ErrorResponse(String message) {}
}

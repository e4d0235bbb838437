package com.sensorstream.service;

import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.AlertMessage;
import com.sensorstream.dto.BatchIngestResponse;
import com.sensorstream.dto.EngineStatsResponse;
import com.sensorstream.dto.EnrichedRecord;
import com.sensorstream.dto.ProcessingResult;
import com.sensorstream.model.AggregateBucket;
import com.sensorstream.model.AnomalyVerdict;
import com.sensorstream.model.BucketKey;
import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.ValidatedReading;
import com.sensorstream.model.ValidationResult;
import com.sensorstream.service.aggregation.Aggregator;
import com.sensorstream.service.alert.AlertNotifier;
import com.sensorstream.service.classification.AnomalyClassifier;
import com.sensorstream.service.classification.ClassificationOutcome;
import com.sensorstream.service.classification.ModelPredictor;
import com.sensorstream.service.lane.LaneRouter;
import com.sensorstream.service.sink.SinkDispatcher;
import com.sensorstream.service.window.RollingWindowStore;
import com.sensorstream.service.window.WindowCorruptedException;
import com.sensorstream.service.window.WindowSnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streaming pipeline for sensor readings.
 *
 * Per reading:
 * 1. Validate on the caller's thread (rejections never reach a lane)
 * 2. On the machine's lane: enrich, update the window, classify
 * 3. Fold into the aggregate bucket, hand the record to the sink, raise an alert
 *
 * Failures are isolated per record: a rejected or failed reading never stops
 * the stream or other machines. A corrupted window is reset and only the
 * offending record fails.
 */
@Slf4j
@Service
public class StreamingEngine {

    private final ReadingValidator validator;
    private final FeatureEnricher enricher;
    private final RollingWindowStore windowStore;
    private final AnomalyClassifier classifier;
    private final Aggregator aggregator;
    private final SinkDispatcher sinkDispatcher;
    private final AlertNotifier alertNotifier;
    private final LaneRouter laneRouter;
    private final ModelPredictor modelPredictor;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong refused = new AtomicLong();
    private final AtomicLong anomalies = new AtomicLong();
    private final AtomicLong degraded = new AtomicLong();

    public StreamingEngine(ReadingValidator validator,
                           FeatureEnricher enricher,
                           RollingWindowStore windowStore,
                           AnomalyClassifier classifier,
                           Aggregator aggregator,
                           SinkDispatcher sinkDispatcher,
                           AlertNotifier alertNotifier,
                           LaneRouter laneRouter,
                           ObjectProvider<ModelPredictor> modelPredictor) {
        this.validator = validator;
        this.enricher = enricher;
        this.windowStore = windowStore;
        this.classifier = classifier;
        this.aggregator = aggregator;
        this.sinkDispatcher = sinkDispatcher;
        this.alertNotifier = alertNotifier;
        this.laneRouter = laneRouter;
        this.modelPredictor = modelPredictor.getIfAvailable();
        log.info("Streaming engine ready ({} classification)",
            this.modelPredictor != null ? "model-assisted" : "rule-only");
    }

    /**
     * Process one raw reading and wait for its result.
     */
    public ProcessingResult process(Map<String, Object> raw) {
        return submit(raw).join();
    }

    /**
     * Admit one raw reading; the future completes once its lane has handled it.
     */
    public CompletableFuture<ProcessingResult> submit(Map<String, Object> raw) {
        long startNanos = System.nanoTime();
        ValidationResult validation = validator.validate(raw);
        if (!validation.isValid()) {
            rejected.incrementAndGet();
            String machineId = raw != null && raw.get(ReadingValidator.MACHINE_ID) != null
                ? raw.get(ReadingValidator.MACHINE_ID).toString() : null;
            String reason = validation.rejection().message();
            log.warn("Rejected reading of machine {}: {}", machineId, reason);
            return CompletableFuture.completedFuture(ProcessingResult.rejected(machineId, reason));
        }

        ValidatedReading reading = validation.reading();
        if (reading.isRangeWarning()) {
            log.warn("Reading of machine {} outside plausible range for {}",
                reading.getMachineId(), reading.getOutOfRangeMetrics());
        }

        try {
            return laneRouter.submit(reading.getMachineId(), () -> handle(reading, startNanos))
                .exceptionally(e -> unfinished(reading.getMachineId(), e));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(unfinished(reading.getMachineId(), e));
        }
    }

    /**
     * Result for a reading whose lane never ran it (refused or abandoned at shutdown)
     * or whose lane work failed outside of {@link #handle}.
     */
    private ProcessingResult unfinished(String machineId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RejectedExecutionException) {
            refused.incrementAndGet();
            log.warn("Refused reading of machine {}: engine is shutting down", machineId);
            return ProcessingResult.refused(machineId);
        }
        failed.incrementAndGet();
        log.error("Lane failed reading of machine {}", machineId, cause);
        return ProcessingResult.failed(machineId, "internal error: " + cause.getMessage());
    }

    /**
     * Process a batch of raw readings. Readings of different machines run in
     * parallel; each machine's readings keep their batch order.
     */
    public BatchIngestResponse processBatch(List<Map<String, Object>> readings) {
        long startNanos = System.nanoTime();
        BatchIngestResponse.BatchIngestResponseBuilder responseBuilder = BatchIngestResponse.builder()
            .accepted(0)
            .rejected(0)
            .failed(0)
            .anomalies(0)
            .degraded(0)
            .rejections(new ArrayList<>());

        if (readings == null || readings.isEmpty()) {
            return responseBuilder.build();
        }

        List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>(readings.size());
        for (Map<String, Object> raw : readings) {
            futures.add(submit(raw));
        }

        int accepted = 0, rejectedCount = 0, failedCount = 0, anomalyCount = 0, degradedCount = 0;
        List<BatchIngestResponse.RejectionDetail> rejections = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            ProcessingResult result = futures.get(i).join();
            switch (result.getStatus()) {
                case PROCESSED -> {
                    accepted++;
                    if (result.getVerdict().isAnomaly()) {
                        anomalyCount++;
                    }
                    if (result.isDegraded()) {
                        degradedCount++;
                    }
                }
                case REJECTED -> {
                    rejectedCount++;
                    rejections.add(rejection(i, result));
                }
                case FAILED, REFUSED -> {
                    failedCount++;
                    rejections.add(rejection(i, result));
                }
            }
        }

        double duration = elapsedMillis(startNanos);
        log.info("Batch processing complete: {} accepted, {} rejected, {} failed, {} anomalies in {} ms",
            accepted, rejectedCount, failedCount, anomalyCount, String.format("%.2f", duration));

        return responseBuilder
            .accepted(accepted)
            .rejected(rejectedCount)
            .failed(failedCount)
            .anomalies(anomalyCount)
            .degraded(degradedCount)
            .processingTimeMs(duration)
            .rejections(rejections)
            .build();
    }

    private ProcessingResult handle(ValidatedReading reading, long startNanos) {
        String machineId = reading.getMachineId();
        try {
            EnrichedReading enriched = enricher.enrich(reading);

            WindowSnapshot snapshot;
            try {
                snapshot = windowStore.update(machineId, enriched);
            } catch (WindowCorruptedException e) {
                log.error("Invariant violation, resetting window of machine {}", machineId, e);
                windowStore.reset(machineId);
                failed.incrementAndGet();
                return ProcessingResult.failed(machineId, e.getMessage());
            }

            ClassificationOutcome outcome = classifier.classify(enriched, snapshot, modelPredictor);
            if (!outcome.hasVerdict()) {
                failed.incrementAndGet();
                return ProcessingResult.failed(machineId, "classification failed: " + outcome.getReason());
            }
            AnomalyVerdict verdict = outcome.getVerdict();
            boolean wasDegraded = outcome.getStatus() == ClassificationOutcome.Status.DEGRADED;

            aggregator.add(machineId, reading.getTimestamp(), enriched, verdict.isAnomaly());

            EnrichedRecord record = toRecord(enriched, snapshot, verdict, startNanos);
            sinkDispatcher.submitRecord(record);

            if (verdict.isAnomaly()) {
                anomalies.incrementAndGet();
                raiseAlert(enriched, verdict);
            }
            if (wasDegraded) {
                degraded.incrementAndGet();
            }
            processed.incrementAndGet();

            return ProcessingResult.builder()
                .status(ProcessingResult.Status.PROCESSED)
                .machineId(machineId)
                .record(record)
                .verdict(verdict)
                .degraded(wasDegraded)
                .reason(wasDegraded ? outcome.getReason() : null)
                .build();
        } catch (RuntimeException e) {
            log.error("Unexpected error processing reading of machine {}", machineId, e);
            failed.incrementAndGet();
            return ProcessingResult.failed(machineId, "internal error: " + e.getMessage());
        }
    }

    private EnrichedRecord toRecord(EnrichedReading enriched, WindowSnapshot snapshot,
                                    AnomalyVerdict verdict, long startNanos) {
        ValidatedReading reading = enriched.getReading();
        EnrichedRecord record = EnrichedRecord.builder()
            .machineId(reading.getMachineId())
            .timestamp(reading.getTimestamp())
            .temperature(reading.getTemperature())
            .vibration(reading.getVibration())
            .pressure(reading.getPressure())
            .tempVibRatio(enriched.getTempVibRatio())
            .pressureTempRatio(enriched.getPressureTempRatio())
            .isAnomalyTemp(enriched.isAnomalyTemp() ? 1 : 0)
            .isAnomalyVib(enriched.isAnomalyVib() ? 1 : 0)
            .isAnomalyPressure(enriched.isAnomalyPressure() ? 1 : 0)
            .ruleAnomalyScore(enriched.getRuleAnomalyScore())
            .rangeWarning(reading.isRangeWarning())
            .anomaly(verdict.isAnomaly())
            .severity(verdict.getSeverity())
            .source(verdict.getSource())
            .confidence(verdict.getConfidence())
            .dataVersion(EnrichedReading.DATA_VERSION)
            .processedAt(enriched.getProcessedAt())
            .build();
        reading.getAttributes().forEach((name, value) -> {
            if (EnrichedRecord.PROPERTY_NAMES.contains(name) || WindowSnapshot.isFeatureName(name)) {
                log.debug("Ignoring inbound field {} of machine {}, the engine derives it", name, reading.getMachineId());
            } else {
                record.getExtraFields().put(name, value);
            }
        });
        record.getExtraFields().putAll(snapshot.features());
        record.setProcessingTimeMs(elapsedMillis(startNanos));
        return record;
    }

    private void raiseAlert(EnrichedReading enriched, AnomalyVerdict verdict) {
        AlertMessage alert = AlertMessage.builder()
            .machineId(enriched.getMachineId())
            .timestamp(Instant.ofEpochSecond(enriched.getTimestamp()))
            .sensorData(AlertMessage.SensorData.builder()
                .temperature(enriched.getReading().getTemperature())
                .vibration(enriched.getReading().getVibration())
                .pressure(enriched.getReading().getPressure())
                .build())
            .prediction(AlertMessage.PredictionDetail.builder()
                .prediction(1)
                .predictionLabel("anomaly")
                .confidence(verdict.getConfidence())
                .source(verdict.getSource())
                .build())
            .severity(verdict.getSeverity())
            .build();
        try {
            alertNotifier.notify(alert);
        } catch (RuntimeException e) {
            log.error("Error sending alert for machine {}", enriched.getMachineId(), e);
        }
    }

    /**
     * Emits buckets that fell behind their machine's watermark.
     */
    @Scheduled(fixedDelayString = "${sensor-engine.aggregation.close-interval:PT60S}")
    public List<AggregateSummary> closeExpiredBuckets() {
        return emit(aggregator.closeExpired());
    }

    /**
     * Emits every live bucket, e.g. at job completion.
     */
    public List<AggregateSummary> flushAggregates() {
        return emit(aggregator.flushAll());
    }

    public Optional<AggregateSummary> flushAggregate(String machineId, long timestamp) {
        BucketKey key = aggregator.keyFor(machineId, timestamp);
        return aggregator.flush(key)
            .map(bucket -> emit(List.of(bucket)).get(0));
    }

    public WindowSnapshot window(String machineId) {
        return windowStore.snapshot(machineId);
    }

    private List<AggregateSummary> emit(List<AggregateBucket> buckets) {
        List<AggregateSummary> summaries = buckets.stream().map(AggregateSummary::from).toList();
        sinkDispatcher.submitAggregates(summaries);
        return summaries;
    }

    public EngineStatsResponse stats() {
        return EngineStatsResponse.builder()
            .accepting(laneRouter.isAccepting())
            .laneCount(laneRouter.getLaneCount())
            .processed(processed.get())
            .rejected(rejected.get())
            .failed(failed.get())
            .refused(refused.get())
            .anomalies(anomalies.get())
            .degraded(degraded.get())
            .trackedMachines(windowStore.machineCount())
            .liveBuckets(aggregator.liveBucketCount())
            .lateCorrected(aggregator.getLateCorrected())
            .lateDropped(aggregator.getLateDropped())
            .sinkEnqueued(sinkDispatcher.getEnqueued())
            .sinkWritten(sinkDispatcher.getWritten())
            .sinkDropped(sinkDispatcher.getDropped())
            .sinkFailed(sinkDispatcher.getFailed())
            .sinkQueueDepth(sinkDispatcher.getQueueDepth())
            .build();
    }

    /**
     * Refuses new readings, lets in-flight readings finish, then hands every
     * live bucket to the sink.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down streaming engine");
        laneRouter.shutdown();
        List<AggregateSummary> flushed = flushAggregates();
        log.info("Streaming engine stopped ({} processed, {} aggregate(s) flushed)", processed.get(), flushed.size());
    }

    private static BatchIngestResponse.RejectionDetail rejection(int index, ProcessingResult result) {
        return BatchIngestResponse.RejectionDetail.builder()
            .index(index)
            .machineId(result.getMachineId())
            .reason(result.getReason())
            .build();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}

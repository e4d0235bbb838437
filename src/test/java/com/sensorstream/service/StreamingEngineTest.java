package com.sensorstream.service;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sensorstream.TestReadings;
import com.sensorstream.config.EngineProperties;
import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.AlertMessage;
import com.sensorstream.dto.BatchIngestResponse;
import com.sensorstream.dto.EngineStatsResponse;
import com.sensorstream.dto.EnrichedRecord;
import com.sensorstream.dto.ProcessingResult;
import com.sensorstream.model.Metric;
import com.sensorstream.model.Prediction;
import com.sensorstream.model.TrendDirection;
import com.sensorstream.model.VerdictSource;
import com.sensorstream.service.aggregation.Aggregator;
import com.sensorstream.service.alert.AlertNotifier;
import com.sensorstream.service.classification.AnomalyClassifier;
import com.sensorstream.service.classification.ClassificationException;
import com.sensorstream.service.classification.ModelPredictor;
import com.sensorstream.service.lane.LaneRouter;
import com.sensorstream.service.sink.SinkDispatcher;
import com.sensorstream.service.sink.StorageSink;
import com.sensorstream.service.window.RollingWindowStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for StreamingEngine, wired by hand with in-memory collaborators.
 *
 * Tests cover:
 * 1. Valid reading → enriched record with window features, sink and alert
 * 2. Invalid reading → rejected, no state touched
 * 3. Corrupted window → only that record fails, window reset
 * 4. Unavailable model → degraded rule verdict
 * 5. Batch counts and per-machine ordering
 * 6. Concurrent ingestion across machines
 * 7. Shutdown refuses readings and flushes live buckets
 * 8. Failing alert notifier does not affect the record
 * 9. Explicit flush of one bucket
 * 10. Readings abandoned by a timed-out shutdown are answered REFUSED
 * 11. Inbound fields named like derived fields do not reach the record
 */
class StreamingEngineTest {

    private static final long T0 = 1705312800L;
    private static final int WINDOW = 5;

    private final List<EnrichedRecord> records = new CopyOnWriteArrayList<>();
    private final List<AggregateSummary> aggregates = new CopyOnWriteArrayList<>();
    private final List<AlertMessage> alerts = new CopyOnWriteArrayList<>();

    private EngineProperties properties;
    private AnomalyClassifier classifier;
    private SinkDispatcher dispatcher;
    private StreamingEngine engine;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getWindow().setSize(WINDOW);
        properties.getLanes().setCount(4);
        properties.getLanes().setShutdownTimeout(Duration.ofSeconds(5));
        properties.getModel().setMaxAttempts(2);
        properties.getModel().setAttemptTimeout(Duration.ofMillis(100));
        properties.getModel().setRetryBackoff(Duration.ofMillis(5));
        properties.getSink().setDrainTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
        dispatcher.close();
        classifier.shutdown();
    }

    /**
     * Test 1: Hot reading → processed anomaly, record carries ratios, flags,
     * window features and unknown inbound fields; stored and alerted
     */
    @Test
    void testValidReadingIsProcessed() throws InterruptedException {
        engine = build(null, alerts::add);
        engine.process(TestReadings.raw("M-001", T0, 70.0, 1.0, 100.0));

        Map<String, Object> raw = TestReadings.raw("M-001", T0 + 60, 85.0, 1.0, 100.0);
        raw.put("site", "plant-7");
        ProcessingResult result = engine.process(raw);

        assertEquals(ProcessingResult.Status.PROCESSED, result.getStatus());
        assertEquals(200, result.getHttpStatus());
        assertTrue(result.getVerdict().isAnomaly());
        assertEquals(VerdictSource.RULE, result.getVerdict().getSource());

        EnrichedRecord record = result.getRecord();
        assertEquals(1, record.getIsAnomalyTemp());
        assertEquals(0, record.getIsAnomalyVib());
        assertEquals(1, record.getRuleAnomalyScore());
        assertEquals("1.0", record.getDataVersion());
        assertEquals(TestReadings.NOW, record.getProcessedAt());
        assertEquals("plant-7", record.getExtraFields().get("site"));
        assertEquals(70.0, record.getExtraFields().get("temp_lag_1"));
        assertEquals(15.0, record.getExtraFields().get("temp_diff"));
        assertEquals(77.5, record.getExtraFields().get("temp_mean"));
        assertEquals(TrendDirection.INSUFFICIENT_DATA, record.getExtraFields().get("temp_trend"));

        awaitCondition(() -> records.size() == 2);
        assertEquals(1, alerts.size());
        assertEquals("M-001", alerts.get(0).getMachineId());
        assertEquals(AlertMessage.ANOMALY_DETECTED, alerts.get(0).getAlertType());
        assertEquals(1, alerts.get(0).getPrediction().getPrediction());
    }

    /**
     * Test 2: Missing pressure → REJECTED(400); window, buckets and sink untouched
     */
    @Test
    void testInvalidReadingTouchesNoState() {
        engine = build(null, alerts::add);
        Map<String, Object> raw = new HashMap<>();
        raw.put("machine_id", "M-001");
        raw.put("temperature", 70.0);
        raw.put("vibration", 1.0);

        ProcessingResult result = engine.process(raw);

        assertEquals(ProcessingResult.Status.REJECTED, result.getStatus());
        assertEquals(400, result.getHttpStatus());
        assertEquals("MISSING_FIELD: pressure", result.getReason());
        assertEquals(0, engine.window("M-001").getSize());

        EngineStatsResponse stats = engine.stats();
        assertEquals(1, stats.getRejected());
        assertEquals(0, stats.getProcessed());
        assertEquals(0, stats.getTrackedMachines());
        assertEquals(0, stats.getLiveBuckets());
        assertEquals(0, stats.getSinkEnqueued());
    }

    /**
     * Test 3: An overflowing value corrupts M-001's window → that record FAILED(500),
     * window reset, M-002 unaffected and M-001 recovers on the next reading
     */
    @Test
    void testCorruptedWindowFailsOnlyThatRecord() {
        engine = build(null, alerts::add);
        engine.process(TestReadings.raw("M-001", T0, 70.0, 1.0, 100.0));
        engine.process(TestReadings.raw("M-002", T0, 70.0, 1.0, 100.0));

        ProcessingResult failed = engine.process(TestReadings.raw("M-001", T0 + 1, 1e200, 1.0, 100.0));

        assertEquals(ProcessingResult.Status.FAILED, failed.getStatus());
        assertEquals(500, failed.getHttpStatus());
        assertEquals(0, engine.window("M-001").getSize());
        assertEquals(1, engine.window("M-002").getSize());

        ProcessingResult next = engine.process(TestReadings.raw("M-001", T0 + 2, 71.0, 1.0, 100.0));
        assertEquals(ProcessingResult.Status.PROCESSED, next.getStatus());
        assertEquals(1, engine.window("M-001").getSize());
        assertEquals(1, engine.stats().getFailed());
    }

    /**
     * Test 4: Model keeps failing → processed, degraded, rule verdict
     */
    @Test
    void testUnavailableModelDegrades() {
        engine = build(features -> {
            throw new ClassificationException("503 from inference endpoint");
        }, alerts::add);

        ProcessingResult result = engine.process(TestReadings.raw("M-001", T0, 90.0, 1.0, 100.0));

        assertEquals(ProcessingResult.Status.PROCESSED, result.getStatus());
        assertTrue(result.isDegraded());
        assertTrue(result.getVerdict().isAnomaly());
        assertEquals(VerdictSource.RULE, result.getVerdict().getSource());
        assertNotNull(result.getReason());
        assertEquals(1, engine.stats().getDegraded());
    }

    /**
     * Test 5: Batch of mixed readings → counts per outcome; a machine's
     * readings are applied in batch order
     */
    @Test
    void testBatchCountsAndOrdering() {
        engine = build(features -> new Prediction(false, 0.2), alerts::add);
        List<Map<String, Object>> batch = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            batch.add(TestReadings.raw("M-" + (i % 3), T0 + i, 60.0 + i, 1.0, 100.0));
        }
        Map<String, Object> bad = TestReadings.raw("M-0", T0, "hot", 1.0, 100.0);
        batch.add(bad);

        BatchIngestResponse response = engine.processBatch(batch);

        assertEquals(30, response.getAccepted());
        assertEquals(1, response.getRejected());
        assertEquals(0, response.getFailed());
        assertEquals(9, response.getAnomalies()); // temperatures 81..89
        assertEquals(1, response.getRejections().size());
        assertEquals(30, response.getRejections().get(0).getIndex());
        assertTrue(response.getRejections().get(0).getReason().startsWith("TYPE_ERROR: temperature"));

        assertEquals(87.0, engine.window("M-0").lag(Metric.TEMPERATURE, 0).getAsDouble());
        assertEquals(84.0, engine.window("M-0").lag(Metric.TEMPERATURE, 1).getAsDouble());
        assertEquals(TrendDirection.INCREASING, engine.window("M-0").trend(Metric.TEMPERATURE).direction());
    }

    /**
     * Test 6: 8 threads, one machine each, 200 readings per machine
     */
    @Test
    void testConcurrentIngestionAcrossMachines() throws Exception {
        engine = build(null, alerts::add);
        int threads = 8;
        int perMachine = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String machineId = "M-" + t;
            tasks.add(() -> {
                int processed = 0;
                for (int i = 0; i < perMachine; i++) {
                    ProcessingResult result = engine.process(
                        TestReadings.raw(machineId, T0 + i, 60.0 + (i % 10), 1.0, 100.0));
                    if (result.getStatus() == ProcessingResult.Status.PROCESSED) {
                        processed++;
                    }
                }
                return processed;
            });
        }

        int total = 0;
        for (Future<Integer> future : executor.invokeAll(tasks)) {
            total += future.get();
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perMachine, total);
        assertEquals(threads * perMachine, engine.stats().getProcessed());
        for (int t = 0; t < threads; t++) {
            assertEquals(WINDOW, engine.window("M-" + t).getSize());
            assertEquals(69.0, engine.window("M-" + t).lag(Metric.TEMPERATURE, 0).getAsDouble());
        }

        List<AggregateSummary> flushed = engine.flushAggregates();
        assertEquals(threads, flushed.size());
        flushed.forEach(summary -> assertEquals(perMachine, summary.getCount()));
    }

    /**
     * Test 7: After shutdown new readings get REFUSED(503) and live buckets reach the sink
     */
    @Test
    void testShutdownRefusesAndFlushes() throws InterruptedException {
        engine = build(null, alerts::add);
        engine.process(TestReadings.raw("M-001", T0, 70.0, 1.0, 100.0));
        engine.process(TestReadings.raw("M-002", T0, 70.0, 1.0, 100.0));

        engine.shutdown();

        ProcessingResult refused = engine.process(TestReadings.raw("M-001", T0 + 1, 70.0, 1.0, 100.0));
        assertEquals(ProcessingResult.Status.REFUSED, refused.getStatus());
        assertEquals(503, refused.getHttpStatus());
        assertFalse(engine.stats().isAccepting());

        awaitCondition(() -> aggregates.size() == 2);
        assertEquals(0, engine.stats().getLiveBuckets());
    }

    /**
     * Test 8: Notifier throws → record still processed
     */
    @Test
    void testAlertFailureIsIsolated() {
        engine = build(null, alert -> {
            throw new IllegalStateException("notifier down");
        });

        ProcessingResult result = engine.process(TestReadings.raw("M-001", T0, 95.0, 1.0, 100.0));

        assertEquals(ProcessingResult.Status.PROCESSED, result.getStatus());
        assertTrue(result.getVerdict().isAnomaly());
    }

    /**
     * Test 9: flush(machine, time) emits the bucket containing that time once
     */
    @Test
    void testFlushSingleBucket() throws InterruptedException {
        engine = build(null, alerts::add);
        engine.process(TestReadings.raw("M-001", T0 + 10, 70.0, 1.0, 100.0));
        engine.process(TestReadings.raw("M-001", T0 + 20, 90.0, 1.0, 100.0));

        AggregateSummary summary = engine.flushAggregate("M-001", T0).orElseThrow();

        assertEquals(2, summary.getCount());
        assertEquals(1, summary.getAnomalyCount());
        assertEquals(80.0, summary.getTemperature().getMean(), 1e-9);
        assertTrue(engine.flushAggregate("M-001", T0).isEmpty());
        awaitCondition(() -> aggregates.size() == 1);
    }

    /**
     * Test 10: 1 lane, 100 ms shutdown timeout; a reading stuck in the notifier
     * holds the lane, the reading queued behind it completes as REFUSED(503)
     */
    @Test
    void testTimedOutShutdownAnswersQueuedReadings() throws Exception {
        properties.getLanes().setCount(1);
        properties.getLanes().setShutdownTimeout(Duration.ofMillis(100));
        CountDownLatch notifying = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        engine = build(null, alert -> {
            notifying.countDown();
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        CompletableFuture<ProcessingResult> stuck = engine.submit(TestReadings.raw("M-001", T0, 95.0, 1.0, 100.0));
        CompletableFuture<ProcessingResult> queued = engine.submit(TestReadings.raw("M-002", T0, 70.0, 1.0, 100.0));
        assertTrue(notifying.await(5, TimeUnit.SECONDS));

        engine.shutdown();

        ProcessingResult refused = queued.get(1, TimeUnit.SECONDS);
        assertEquals(ProcessingResult.Status.REFUSED, refused.getStatus());
        assertEquals("M-002", refused.getMachineId());
        assertEquals(503, refused.getHttpStatus());
        assertEquals(ProcessingResult.Status.PROCESSED, stuck.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(1, engine.stats().getRefused());
    }

    /**
     * Test 11: Replayed record carrying is_anomaly, severity, processed_at and temp_mean →
     * the engine's values win and the JSON has each key once
     */
    @Test
    void testInboundFieldsDoNotShadowDerivedFields() throws Exception {
        engine = build(null, alerts::add);
        Map<String, Object> raw = TestReadings.raw("M-001", T0, 70.0, 1.0, 100.0);
        raw.put("is_anomaly", true);
        raw.put("severity", "high");
        raw.put("processed_at", "2020-01-01T00:00:00.000Z");
        raw.put("temp_mean", 12.0);
        raw.put("temp_lag_1", 11.0);
        raw.put("site", "plant-7");

        EnrichedRecord record = engine.process(raw).getRecord();

        assertEquals("plant-7", record.getExtraFields().get("site"));
        assertEquals(70.0, record.getExtraFields().get("temp_mean"));
        assertFalse(record.getExtraFields().containsKey("is_anomaly"));
        assertFalse(record.getExtraFields().containsKey("temp_lag_1"));

        JsonMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();
        JsonNode json = mapper.readTree(mapper.writeValueAsString(record));
        assertFalse(json.get("is_anomaly").asBoolean());
        assertEquals("normal", json.get("severity").asText());
        assertEquals("2026-01-15T10:30:00.000Z", json.get("processed_at").asText());
        assertEquals(70.0, json.get("temp_mean").asDouble());
    }

    private StreamingEngine build(ModelPredictor predictor, AlertNotifier notifier) {
        StorageSink sink = new StorageSink() {
            @Override
            public void write(EnrichedRecord record) {
                records.add(record);
            }

            @Override
            public void writeBatch(List<AggregateSummary> batch) {
                aggregates.addAll(batch);
            }
        };
        classifier = new AnomalyClassifier(properties);
        dispatcher = new SinkDispatcher(sink, properties);
        dispatcher.start();

        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        if (predictor != null) {
            beans.addBean("modelPredictor", predictor);
        }
        return new StreamingEngine(
            new ReadingValidator(properties, TestReadings.CLOCK),
            new FeatureEnricher(properties, TestReadings.CLOCK),
            new RollingWindowStore(properties),
            classifier,
            new Aggregator(properties),
            dispatcher,
            notifier,
            new LaneRouter(properties),
            beans.getBeanProvider(ModelPredictor.class));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not reached within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}

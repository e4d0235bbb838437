package com.sensorstream.service.classification;

import com.sensorstream.TestReadings;
import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.AnomalyVerdict;
import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.Prediction;
import com.sensorstream.model.Severity;
import com.sensorstream.model.VerdictSource;
import com.sensorstream.service.window.WindowSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for AnomalyClassifier.
 *
 * Tests cover:
 * 1. Rule-only verdicts
 * 2. Model anomaly → combined with model confidence
 * 3. Model and rules both normal → source model
 * 4. Hanging model → degraded rule verdict within the retry bound
 * 5. Transient model failure is retried
 * 6. Mismatched window → fatal
 */
class AnomalyClassifierTest {

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration ATTEMPT_TIMEOUT = Duration.ofMillis(100);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(10);

    private AnomalyClassifier classifier;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getModel().setMaxAttempts(MAX_ATTEMPTS);
        properties.getModel().setAttemptTimeout(ATTEMPT_TIMEOUT);
        properties.getModel().setRetryBackoff(RETRY_BACKOFF);
        classifier = new AnomalyClassifier(properties);
    }

    @AfterEach
    void tearDown() {
        classifier.shutdown();
    }

    /**
     * Test 1: No predictor → anomaly iff rule score > 0, source rule, no confidence
     */
    @Test
    void testRuleOnlyVerdicts() {
        EnrichedReading hot = TestReadings.enriched("M-001", 1L, 85.0, 1.0, 100.0);
        EnrichedReading normal = TestReadings.enriched("M-001", 2L, 70.0, 1.0, 100.0);

        ClassificationOutcome hotOutcome = classifier.classify(hot, emptyWindow("M-001"));
        ClassificationOutcome normalOutcome = classifier.classify(normal, emptyWindow("M-001"));

        assertEquals(ClassificationOutcome.Status.OK, hotOutcome.getStatus());
        assertTrue(hotOutcome.getVerdict().isAnomaly());
        assertEquals(Severity.HIGH, hotOutcome.getVerdict().getSeverity());
        assertEquals(VerdictSource.RULE, hotOutcome.getVerdict().getSource());
        assertNull(hotOutcome.getVerdict().getConfidence());

        assertFalse(normalOutcome.getVerdict().isAnomaly());
        assertEquals(Severity.NORMAL, normalOutcome.getVerdict().getSeverity());
    }

    /**
     * Test 2: Model says anomaly while rules are quiet → combined, anomaly, confidence kept
     */
    @Test
    void testModelAnomalyIsCombined() {
        EnrichedReading normal = TestReadings.enriched("M-001", 1L, 70.0, 1.0, 100.0);

        ClassificationOutcome outcome = classifier.classify(normal, emptyWindow("M-001"),
            features -> new Prediction(true, 0.91));

        AnomalyVerdict verdict = outcome.getVerdict();
        assertEquals(ClassificationOutcome.Status.OK, outcome.getStatus());
        assertTrue(verdict.isAnomaly());
        assertEquals(VerdictSource.COMBINED, verdict.getSource());
        assertEquals(0.91, verdict.getConfidence());
    }

    /**
     * Test 3: Model and rules agree on normal → source model
     */
    @Test
    void testModelNormalVerdict() {
        EnrichedReading normal = TestReadings.enriched("M-001", 1L, 70.0, 1.0, 100.0);

        AnomalyVerdict verdict = classifier.classify(normal, emptyWindow("M-001"),
            features -> new Prediction(false, 0.12)).getVerdict();

        assertFalse(verdict.isAnomaly());
        assertEquals(Severity.NORMAL, verdict.getSeverity());
        assertEquals(VerdictSource.MODEL, verdict.getSource());
    }

    /**
     * Test 4: Model never answers → DEGRADED rule verdict, returned within
     * attempts * timeout + total backoff (plus scheduling slack)
     */
    @Test
    void testHangingModelDegradesToRules() {
        EnrichedReading hot = TestReadings.enriched("M-001", 1L, 85.0, 1.0, 100.0);
        AtomicInteger calls = new AtomicInteger();
        ModelPredictor hanging = features -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new Prediction(false, null);
        };

        long start = System.nanoTime();
        ClassificationOutcome outcome = classifier.classify(hot, emptyWindow("M-001"), hanging);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        long bound = MAX_ATTEMPTS * ATTEMPT_TIMEOUT.toMillis() + RETRY_BACKOFF.toMillis() * 3 + 1_000;
        assertTrue(elapsedMs < bound, "took " + elapsedMs + " ms");
        assertEquals(ClassificationOutcome.Status.DEGRADED, outcome.getStatus());
        assertTrue(outcome.getVerdict().isAnomaly());
        assertEquals(VerdictSource.RULE, outcome.getVerdict().getSource());
        assertTrue(outcome.getReason().contains("after " + MAX_ATTEMPTS + " attempts"));
        assertEquals(MAX_ATTEMPTS, calls.get());
    }

    /**
     * Test 5: First call fails, second succeeds → OK
     */
    @Test
    void testTransientFailureIsRetried() {
        EnrichedReading normal = TestReadings.enriched("M-001", 1L, 70.0, 1.0, 100.0);
        AtomicInteger calls = new AtomicInteger();
        ModelPredictor flaky = features -> {
            if (calls.incrementAndGet() == 1) {
                throw new ClassificationException("connection reset");
            }
            return new Prediction(true, 0.7);
        };

        ClassificationOutcome outcome = classifier.classify(normal, emptyWindow("M-001"), flaky);

        assertEquals(ClassificationOutcome.Status.OK, outcome.getStatus());
        assertEquals(VerdictSource.COMBINED, outcome.getVerdict().getSource());
        assertEquals(2, calls.get());
    }

    /**
     * Test 6: A window of another machine is a programming error → FATAL, no verdict
     */
    @Test
    void testMismatchedWindowIsFatal() {
        EnrichedReading reading = TestReadings.enriched("M-001", 1L, 70.0, 1.0, 100.0);

        ClassificationOutcome outcome = classifier.classify(reading, emptyWindow("M-002"));

        assertEquals(ClassificationOutcome.Status.FATAL, outcome.getStatus());
        assertFalse(outcome.hasVerdict());
        assertInstanceOf(IllegalArgumentException.class, outcome.getError());
        assertThrows(IllegalStateException.class, outcome::getVerdict);
    }

    private static WindowSnapshot emptyWindow(String machineId) {
        return WindowSnapshot.empty(machineId, 20);
    }
}

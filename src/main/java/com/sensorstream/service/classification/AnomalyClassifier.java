package com.sensorstream.service.classification;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.AnomalyVerdict;
import com.sensorstream.model.EnrichedReading;
import com.sensorstream.model.FeatureVector;
import com.sensorstream.model.Prediction;
import com.sensorstream.model.Severity;
import com.sensorstream.model.VerdictSource;
import com.sensorstream.service.window.WindowSnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns rule flags and an optional model prediction into a final verdict.
 *
 * Algorithm:
 * 1. Baseline: anomalous when the rule score is above zero, source rule
 * 2. With a predictor: call it with the feature vector, each attempt bounded
 *    by the attempt timeout, up to maxAttempts with backoff n * retryBackoff
 * 3. On success: anomalous when the model or the rules say so, confidence
 *    from the model, source combined (model when both signals are normal)
 * 4. On exhaustion: fail open with the baseline verdict (DEGRADED)
 *
 * Stateless between calls.
 */
@Slf4j
@Component
public class AnomalyClassifier {

    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Duration attemptTimeout;
    private final ExecutorService inferenceExecutor;

    public AnomalyClassifier(EngineProperties properties) {
        EngineProperties.Model model = properties.getModel();
        this.maxAttempts = model.getMaxAttempts();
        this.retryBackoff = model.getRetryBackoff();
        this.attemptTimeout = model.getAttemptTimeout();
        AtomicInteger threadIds = new AtomicInteger();
        this.inferenceExecutor = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "model-inference-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Rule-only classification.
     */
    public ClassificationOutcome classify(EnrichedReading enriched, WindowSnapshot snapshot) {
        return classify(enriched, snapshot, null);
    }

    /**
     * @param predictor external model, or null to classify on rules alone
     */
    public ClassificationOutcome classify(EnrichedReading enriched, WindowSnapshot snapshot, ModelPredictor predictor) {
        try {
            if (snapshot != null && !snapshot.getMachineId().equals(enriched.getMachineId())) {
                throw new IllegalArgumentException("Window of machine " + snapshot.getMachineId()
                    + " supplied for reading of machine " + enriched.getMachineId());
            }

            AnomalyVerdict baseline = AnomalyVerdict.ruleBased(enriched);
            if (predictor == null) {
                return ClassificationOutcome.ok(baseline);
            }
            return classifyWithModel(enriched, baseline, predictor);
        } catch (RuntimeException e) {
            log.error("Classification failed for machine {}", enriched != null ? enriched.getMachineId() : null, e);
            return ClassificationOutcome.fatal(e);
        }
    }

    private ClassificationOutcome classifyWithModel(EnrichedReading enriched, AnomalyVerdict baseline,
                                                    ModelPredictor predictor) {
        FeatureVector features = enriched.featureVector();
        String lastFailure = "no attempt made";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Prediction prediction = invoke(predictor, features);
                return ClassificationOutcome.ok(combine(baseline, prediction));
            } catch (ClassificationException e) {
                lastFailure = e.getMessage();
                log.debug("Model attempt {}/{} failed for machine {}: {}",
                    attempt, maxAttempts, enriched.getMachineId(), lastFailure);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return degraded(enriched, baseline, "interrupted while waiting for the model");
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(retryBackoff.multipliedBy(attempt).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return degraded(enriched, baseline, "interrupted during retry backoff");
                }
            }
        }
        return degraded(enriched, baseline,
            "model unavailable after " + maxAttempts + " attempts: " + lastFailure);
    }

    private Prediction invoke(ModelPredictor predictor, FeatureVector features) throws InterruptedException {
        Future<Prediction> future;
        try {
            future = inferenceExecutor.submit(() -> predictor.predict(features));
        } catch (RejectedExecutionException e) {
            throw new ClassificationException("inference executor is shut down", e);
        }
        try {
            Prediction prediction = future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (prediction == null) {
                throw new ClassificationException("model returned no prediction");
            }
            return prediction;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ClassificationException("timed out after " + attemptTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ClassificationException(String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static AnomalyVerdict combine(AnomalyVerdict baseline, Prediction prediction) {
        boolean anomaly = prediction.anomaly() || baseline.isAnomaly();
        return AnomalyVerdict.builder()
            .machineId(baseline.getMachineId())
            .anomaly(anomaly)
            .severity(anomaly ? Severity.HIGH : Severity.NORMAL)
            .source(anomaly ? VerdictSource.COMBINED : VerdictSource.MODEL)
            .confidence(prediction.confidence())
            .build();
    }

    private static ClassificationOutcome degraded(EnrichedReading enriched, AnomalyVerdict baseline, String reason) {
        log.warn("Falling back to rule-only verdict for machine {}: {}", enriched.getMachineId(), reason);
        return ClassificationOutcome.degraded(baseline, reason);
    }

    @PreDestroy
    public void shutdown() {
        inferenceExecutor.shutdownNow();
    }
}

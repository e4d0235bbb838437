package com.sensorstream.service.classification;

import com.sensorstream.model.AnomalyVerdict;

/**
 * Tagged result of a classification call.
 *
 * - OK: verdict computed with every configured signal
 * - DEGRADED: model unavailable, verdict is rule-only; reason says why
 * - FATAL: no verdict could be produced; error carries the cause
 */
public final class ClassificationOutcome {

    public enum Status {
        OK,
        DEGRADED,
        FATAL
    }

    private final Status status;
    private final AnomalyVerdict verdict;
    private final String reason;
    private final Throwable error;

    private ClassificationOutcome(Status status, AnomalyVerdict verdict, String reason, Throwable error) {
        this.status = status;
        this.verdict = verdict;
        this.reason = reason;
        this.error = error;
    }

    public static ClassificationOutcome ok(AnomalyVerdict verdict) {
        return new ClassificationOutcome(Status.OK, verdict, null, null);
    }

    public static ClassificationOutcome degraded(AnomalyVerdict verdict, String reason) {
        return new ClassificationOutcome(Status.DEGRADED, verdict, reason, null);
    }

    public static ClassificationOutcome fatal(Throwable error) {
        return new ClassificationOutcome(Status.FATAL, null, error.getMessage(), error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean hasVerdict() {
        return verdict != null;
    }

    public AnomalyVerdict getVerdict() {
        if (verdict == null) {
            throw new IllegalStateException("Fatal classification outcome has no verdict", error);
        }
        return verdict;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getError() {
        return error;
    }
}

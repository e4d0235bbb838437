package com.sensorstream.model;

/**
 * Either a validated reading or the reason it was rejected, never both.
 */
public final class ValidationResult {

    private final ValidatedReading reading;
    private final RejectionReason rejection;

    private ValidationResult(ValidatedReading reading, RejectionReason rejection) {
        this.reading = reading;
        this.rejection = rejection;
    }

    public static ValidationResult valid(ValidatedReading reading) {
        return new ValidationResult(reading, null);
    }

    public static ValidationResult rejected(RejectionReason rejection) {
        return new ValidationResult(null, rejection);
    }

    public boolean isValid() {
        return reading != null;
    }

    public ValidatedReading reading() {
        if (reading == null) {
            throw new IllegalStateException("Rejected reading has no value: " + rejection.message());
        }
        return reading;
    }

    public RejectionReason rejection() {
        if (rejection == null) {
            throw new IllegalStateException("Valid reading has no rejection reason");
        }
        return rejection;
    }
}

package com.sensorstream.model;

/**
 * Answer of the external anomaly model. confidence is null when the model does not report one.
 */
public record Prediction(boolean anomaly, Double confidence) {
}

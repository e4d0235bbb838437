package com.sensorstream.service.classification;

import com.sensorstream.model.FeatureVector;
import com.sensorstream.model.Prediction;

/**
 * External anomaly model. Implementations may block; the classifier bounds
 * each call with a timeout and retries on any exception.
 */
@FunctionalInterface
public interface ModelPredictor {

    Prediction predict(FeatureVector features);
}

package com.sensorstream.service.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorstream.model.FeatureVector;
import com.sensorstream.model.Prediction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls the inference endpoint over HTTP.
 *
 * Request: the feature vector as JSON. Accepted responses:
 * - {"prediction": 1, "prediction_label": "anomaly", "confidence": 0.8}
 * - a bare 0 / 1
 */
@Slf4j
public class HttpModelPredictor implements ModelPredictor {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public HttpModelPredictor(RestTemplate restTemplate, ObjectMapper objectMapper, String endpoint) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public Prediction predict(FeatureVector features) {
        String body;
        try {
            body = restTemplate.postForObject(endpoint, features, String.class);
        } catch (RestClientException e) {
            throw new ClassificationException("inference call to " + endpoint + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new ClassificationException("inference endpoint returned an empty body");
        }
        return parse(body.trim());
    }

    Prediction parse(String body) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ClassificationException("unreadable inference response: " + body, e);
        }

        if (node.isNumber()) {
            return new Prediction(node.asInt() == 1, null);
        }
        JsonNode prediction = node.get("prediction");
        if (prediction == null || !prediction.isNumber()) {
            throw new ClassificationException("inference response has no numeric prediction: " + body);
        }
        JsonNode confidence = node.get("confidence");
        Double confidenceValue = confidence != null && confidence.isNumber() ? confidence.asDouble() : null;
        log.debug("Model predicted {} with confidence {}", prediction.asInt(), confidenceValue);
        return new Prediction(prediction.asInt() == 1, confidenceValue);
    }
}

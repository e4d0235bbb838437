package com.sensorstream.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engineered features handed to the external model, in the order the model was trained on.
 */
public record FeatureVector(
        @JsonProperty("temperature") double temperature,
        @JsonProperty("vibration") double vibration,
        @JsonProperty("pressure") double pressure,
        @JsonProperty("temp_vib_ratio") double tempVibRatio,
        @JsonProperty("pressure_temp_ratio") double pressureTempRatio) {
}

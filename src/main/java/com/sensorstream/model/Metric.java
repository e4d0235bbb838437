package com.sensorstream.model;

/**
 * The three physical quantities every reading carries.
 *
 * jsonName is the inbound/outbound field name, featurePrefix is used for
 * derived window features (temp_lag_1, vib_trend, pressure_mean, ...).
 */
public enum Metric {
    TEMPERATURE("temperature", "temp"),
    VIBRATION("vibration", "vib"),
    PRESSURE("pressure", "pressure");

    private final String jsonName;
    private final String featurePrefix;

    Metric(String jsonName, String featurePrefix) {
        this.jsonName = jsonName;
        this.featurePrefix = featurePrefix;
    }

    public String jsonName() {
        return jsonName;
    }

    public String featurePrefix() {
        return featurePrefix;
    }
}

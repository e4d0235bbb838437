package com.sensorstream.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which signal produced an anomaly verdict.
 */
public enum VerdictSource {
    RULE,
    MODEL,
    COMBINED;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.sensorstream.model;

/**
 * Direction of one metric between the oldest and newest reading of a window.
 */
public record TrendVerdict(Metric metric, TrendDirection direction) {
}

package com.sensorstream.service.window;

/**
 * Running statistics of one metric over a machine window. stddev is the population deviation.
 */
public record WindowStatistics(double mean, double stddev, double min, double max) {
}

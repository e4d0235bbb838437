package com.sensorstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the Sensor Stream Engine.
 * Validates and enriches machine sensor readings, classifies anomalies and
 * rolls readings up into per-machine time buckets.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SensorStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorStreamApplication.class, args);
    }
}

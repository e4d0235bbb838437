package com.sensorstream.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sensorstream.model.AggregateBucket;
import com.sensorstream.model.Metric;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound aggregate for one emitted bucket.
 *
 * Per metric: mean, sample stddev, min, max. correction marks a record built
 * from readings that arrived after the bucket was emitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregateSummary {

    private String machineId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant bucketStart;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant bucketEnd;

    private long count;
    private MetricSummary temperature;
    private MetricSummary vibration;
    private MetricSummary pressure;
    private long anomalyCount;
    private boolean correction;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricSummary {
        private double mean;
        private double stddev;
        private double min;
        private double max;
    }

    public static AggregateSummary from(AggregateBucket bucket) {
        return AggregateSummary.builder()
            .machineId(bucket.getKey().machineId())
            .bucketStart(Instant.ofEpochSecond(bucket.getBucketStart()))
            .bucketEnd(Instant.ofEpochSecond(bucket.getBucketEnd()))
            .count(bucket.getCount())
            .temperature(summary(bucket, Metric.TEMPERATURE))
            .vibration(summary(bucket, Metric.VIBRATION))
            .pressure(summary(bucket, Metric.PRESSURE))
            .anomalyCount(bucket.getAnomalyCount())
            .correction(bucket.isCorrection())
            .build();
    }

    private static MetricSummary summary(AggregateBucket bucket, Metric metric) {
        return MetricSummary.builder()
            .mean(bucket.mean(metric))
            .stddev(bucket.stddev(metric))
            .min(bucket.min(metric))
            .max(bucket.max(metric))
            .build();
    }
}

package com.sensorstream.config;

import com.sensorstream.model.Metric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration surface of the engine, bound from the sensor-engine prefix.
 *
 * Defaults match the production deployment; see application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sensor-engine")
public class EngineProperties {

    @Valid
    private Window window = new Window();

    @Valid
    private Rules rules = new Rules();

    @Valid
    private Ranges ranges = new Ranges();

    @Valid
    private Model model = new Model();

    @Valid
    private Sink sink = new Sink();

    @Valid
    private Aggregation aggregation = new Aggregation();

    @Valid
    private Lanes lanes = new Lanes();

    @Data
    public static class Window {

        /** Readings kept per machine. Trends need at least 3. */
        @Min(3)
        private int size = 20;

        /** Oldest-vs-newest delta above which a metric is trending. */
        @NotNull
        private Map<Metric, Double> trendDeltas = defaults(5.0, 0.5, 10.0);
    }

    @Data
    public static class Rules {

        /** A reading is flagged when a metric is strictly above its threshold. */
        @NotNull
        private Map<Metric, Double> thresholds = defaults(80.0, 2.0, 150.0);
    }

    @Data
    public static class Ranges {

        @NotNull
        private Map<Metric, Double> min = defaults(0.0, 0.0, 0.0);

        @NotNull
        private Map<Metric, Double> max = defaults(200.0, 10.0, 200.0);
    }

    @Data
    public static class Model {

        /** Inference endpoint; the engine runs rule-only when unset. */
        private String endpoint;

        @Min(1)
        private int maxAttempts = 3;

        /** Backoff before retry n is n times this value. */
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(200);

        @NotNull
        private Duration attemptTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Sink {

        @Min(1)
        private int bufferDepth = 10_000;

        @NotNull
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryBackoff = Duration.ofMillis(100);

        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Aggregation {

        @NotNull
        private Duration bucket = Duration.ofHours(1);

        /** How far behind the newest event time a bucket may still receive readings. */
        @NotNull
        private Duration allowedLateness = Duration.ZERO;

        @NotNull
        private LatePolicy latePolicy = LatePolicy.CORRECTION;

        @NotNull
        private Duration closeInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Lanes {

        @Min(1)
        private int count = Runtime.getRuntime().availableProcessors();

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    public enum OverflowPolicy {
        DROP_OLDEST,
        REJECT_NEW
    }

    public enum LatePolicy {
        CORRECTION,
        DROP
    }

    private static Map<Metric, Double> defaults(double temperature, double vibration, double pressure) {
        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        values.put(Metric.TEMPERATURE, temperature);
        values.put(Metric.VIBRATION, vibration);
        values.put(Metric.PRESSURE, pressure);
        return values;
    }
}

package com.sensorstream.model;

/**
 * Additive accumulator for one (machine, time bucket).
 *
 * Every operation is commutative and associative, so readings may be folded
 * in any order and from any thread.
 */
public class AggregateBucket {

    private static final int METRICS = Metric.values().length;

    private final BucketKey key;
    private final long bucketEnd;
    private final boolean correction;

    private long count;
    private long anomalyCount;
    private final double[] sum = new double[METRICS];
    private final double[] sumOfSquares = new double[METRICS];
    private final double[] min = new double[METRICS];
    private final double[] max = new double[METRICS];

    public AggregateBucket(BucketKey key, long granularitySeconds, boolean correction) {
        this.key = key;
        this.bucketEnd = key.end(granularitySeconds);
        this.correction = correction;
        for (int i = 0; i < METRICS; i++) {
            min[i] = Double.POSITIVE_INFINITY;
            max[i] = Double.NEGATIVE_INFINITY;
        }
    }

    public synchronized void add(EnrichedReading enriched, boolean anomalous) {
        count++;
        if (anomalous) {
            anomalyCount++;
        }
        for (Metric metric : Metric.values()) {
            int i = metric.ordinal();
            double value = enriched.value(metric);
            sum[i] += value;
            sumOfSquares[i] += value * value;
            min[i] = Math.min(min[i], value);
            max[i] = Math.max(max[i], value);
        }
    }

    public BucketKey getKey() {
        return key;
    }

    public long getBucketStart() {
        return key.bucketStart();
    }

    public long getBucketEnd() {
        return bucketEnd;
    }

    public boolean isCorrection() {
        return correction;
    }

    public synchronized long getCount() {
        return count;
    }

    public synchronized long getAnomalyCount() {
        return anomalyCount;
    }

    public synchronized double mean(Metric metric) {
        return count == 0 ? 0.0 : sum[metric.ordinal()] / count;
    }

    /**
     * Sample standard deviation (n - 1), 0 for fewer than two readings.
     */
    public synchronized double stddev(Metric metric) {
        if (count < 2) {
            return 0.0;
        }
        int i = metric.ordinal();
        double variance = (sumOfSquares[i] - sum[i] * sum[i] / count) / (count - 1);
        return Math.sqrt(Math.max(variance, 0.0));
    }

    public synchronized double min(Metric metric) {
        return count == 0 ? 0.0 : min[metric.ordinal()];
    }

    public synchronized double max(Metric metric) {
        return count == 0 ? 0.0 : max[metric.ordinal()];
    }
}

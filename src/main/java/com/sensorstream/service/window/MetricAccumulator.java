package com.sensorstream.service.window;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Running aggregates of one metric over a sliding window.
 *
 * Mean and variance follow Welford's update, reversed on eviction, so both
 * stay O(1) per reading. Evicting a value that carried almost all of the
 * spread leaves the remainder as cancellation noise; the owner then rebases
 * the accumulator from the window contents. min and max are kept in monotonic
 * deques of (sequence, value) so eviction is amortized O(1) without rescanning.
 */
class MetricAccumulator {

    /** Evictions that shrink M2 by more than this factor trigger a rebase. */
    static final double REBASE_RATIO = 1e6;

    private record Entry(long sequence, double value) {
    }

    private long count;
    private double mean;
    private double m2;

    private final Deque<Entry> minCandidates = new ArrayDeque<>();
    private final Deque<Entry> maxCandidates = new ArrayDeque<>();

    void add(long sequence, double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);

        while (!minCandidates.isEmpty() && minCandidates.peekLast().value() >= value) {
            minCandidates.pollLast();
        }
        minCandidates.addLast(new Entry(sequence, value));

        while (!maxCandidates.isEmpty() && maxCandidates.peekLast().value() <= value) {
            maxCandidates.pollLast();
        }
        maxCandidates.addLast(new Entry(sequence, value));
    }

    /**
     * Removes the contribution of the oldest element, which must carry the given sequence.
     *
     * @return false when the remaining mean and M2 are no longer trustworthy and
     *         {@link #rebase(double[])} must be called with the remaining values
     */
    boolean evict(long sequence, double value) {
        double previousM2 = m2;
        count--;
        if (count == 0) {
            mean = 0.0;
            m2 = 0.0;
        } else {
            double delta = value - mean;
            mean -= delta / count;
            m2 -= delta * (value - mean);
        }

        if (!minCandidates.isEmpty() && minCandidates.peekFirst().sequence() == sequence) {
            minCandidates.pollFirst();
        }
        if (!maxCandidates.isEmpty() && maxCandidates.peekFirst().sequence() == sequence) {
            maxCandidates.pollFirst();
        }
        return previousM2 <= REBASE_RATIO * Math.max(m2, 0.0);
    }

    /**
     * Recomputes mean and M2 from the values currently in the window, oldest first.
     * min/max deques are exact and left untouched.
     */
    void rebase(double[] values) {
        count = values.length;
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        mean = count == 0 ? 0.0 : total / count;
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        m2 = squares;
    }

    long count() {
        return count;
    }

    boolean isConsistent() {
        return Double.isFinite(mean) && Double.isFinite(m2)
            && (count == 0) == minCandidates.isEmpty()
            && (count == 0) == maxCandidates.isEmpty();
    }

    WindowStatistics statistics() {
        if (count == 0) {
            return null;
        }
        double stddev = 0.0;
        if (count > 1) {
            // population variance; clamp rounding noise below zero
            stddev = Math.sqrt(Math.max(m2, 0.0) / count);
        }
        return new WindowStatistics(mean, stddev, minCandidates.peekFirst().value(), maxCandidates.peekFirst().value());
    }
}

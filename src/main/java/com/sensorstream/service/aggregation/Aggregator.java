package com.sensorstream.service.aggregation;

import com.sensorstream.config.EngineProperties;
import com.sensorstream.model.AggregateBucket;
import com.sensorstream.model.BucketKey;
import com.sensorstream.model.EnrichedReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolls readings up into (machine, time bucket) summaries.
 *
 * Buckets are purely additive, so readings for one bucket may arrive in any
 * order and from any lane. A bucket is emitted once, either when its end is
 * at or behind the machine's watermark (newest event time minus allowed
 * lateness) or on an explicit flush, and is then removed from live state.
 *
 * Late readings (their bucket is already emitted, or is not live and behind
 * the watermark) follow the configured LatePolicy:
 * - CORRECTION: folded into a correction bucket emitted on the next close or flush
 * - DROP: discarded and counted
 */
@Slf4j
@Component
public class Aggregator {

    private static final Comparator<AggregateBucket> EMISSION_ORDER = Comparator
        .comparing((AggregateBucket bucket) -> bucket.getKey().machineId())
        .thenComparingLong(AggregateBucket::getBucketStart)
        .thenComparing(AggregateBucket::isCorrection);

    private final long granularitySeconds;
    private final long allowedLatenessSeconds;
    private final EngineProperties.LatePolicy latePolicy;

    private final Map<BucketKey, AggregateBucket> live = new ConcurrentHashMap<>();
    private final Map<BucketKey, AggregateBucket> corrections = new ConcurrentHashMap<>();
    private final Set<BucketKey> flushed = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> newestEventTime = new ConcurrentHashMap<>();

    private final AtomicLong lateCorrected = new AtomicLong();
    private final AtomicLong lateDropped = new AtomicLong();

    public Aggregator(EngineProperties properties) {
        EngineProperties.Aggregation aggregation = properties.getAggregation();
        this.granularitySeconds = aggregation.getBucket().toSeconds();
        this.allowedLatenessSeconds = aggregation.getAllowedLateness().toSeconds();
        this.latePolicy = aggregation.getLatePolicy();
        if (granularitySeconds <= 0) {
            throw new IllegalArgumentException("Bucket granularity must be at least one second");
        }
    }

    /**
     * Folds a reading into its bucket, counting it as anomalous when any rule flag is raised.
     */
    public void add(String machineId, long timestamp, EnrichedReading enriched) {
        add(machineId, timestamp, enriched, enriched.getRuleAnomalyScore() > 0);
    }

    public void add(String machineId, long timestamp, EnrichedReading enriched, boolean anomalous) {
        BucketKey key = keyFor(machineId, timestamp);
        long watermark = watermark(machineId);
        boolean[] late = new boolean[1];

        live.compute(key, (k, bucket) -> {
            if (bucket != null) {
                bucket.add(enriched, anomalous);
                return bucket;
            }
            if (flushed.contains(k) || bucketEnd(k) <= watermark) {
                late[0] = true;
                return null;
            }
            AggregateBucket created = new AggregateBucket(k, granularitySeconds, false);
            created.add(enriched, anomalous);
            return created;
        });

        if (late[0]) {
            handleLate(key, enriched, anomalous);
        }
        newestEventTime.merge(machineId, timestamp, Math::max);
    }

    public BucketKey keyFor(String machineId, long timestamp) {
        return BucketKey.of(machineId, timestamp, granularitySeconds);
    }

    /**
     * Emits the live bucket with the given key, if any. A key without a live
     * bucket is left untouched, so later readings for it open a normal bucket.
     */
    public Optional<AggregateBucket> flush(BucketKey key) {
        AggregateBucket[] emitted = new AggregateBucket[1];
        // marked under the key's lock so a concurrent add() sees either the live bucket or the mark
        live.computeIfPresent(key, (k, bucket) -> {
            flushed.add(k);
            emitted[0] = bucket;
            return null;
        });
        return Optional.ofNullable(emitted[0]);
    }

    /**
     * Emits every live and correction bucket, e.g. on job completion or shutdown.
     */
    public List<AggregateBucket> flushAll() {
        List<AggregateBucket> emitted = new ArrayList<>();
        for (BucketKey key : new ArrayList<>(live.keySet())) {
            flush(key).ifPresent(emitted::add);
        }
        emitted.addAll(drainCorrections());
        pruneFlushed();
        emitted.sort(EMISSION_ORDER);
        return emitted;
    }

    /**
     * Emits buckets whose end is at or behind their machine's watermark, plus pending corrections.
     */
    public List<AggregateBucket> closeExpired() {
        List<AggregateBucket> emitted = new ArrayList<>();
        for (BucketKey key : new ArrayList<>(live.keySet())) {
            if (bucketEnd(key) <= watermark(key.machineId())) {
                flush(key).ifPresent(emitted::add);
            }
        }
        emitted.addAll(drainCorrections());
        pruneFlushed();

        emitted.sort(EMISSION_ORDER);
        if (!emitted.isEmpty()) {
            log.info("Closed {} aggregate bucket(s)", emitted.size());
        }
        return emitted;
    }

    public int liveBucketCount() {
        return live.size();
    }

    public long getLateCorrected() {
        return lateCorrected.get();
    }

    public long getLateDropped() {
        return lateDropped.get();
    }

    long watermark(String machineId) {
        Long newest = newestEventTime.get(machineId);
        if (newest == null || newest < Long.MIN_VALUE + allowedLatenessSeconds) {
            return Long.MIN_VALUE;
        }
        return newest - allowedLatenessSeconds;
    }

    private long bucketEnd(BucketKey key) {
        return key.end(granularitySeconds);
    }

    private void handleLate(BucketKey key, EnrichedReading enriched, boolean anomalous) {
        if (latePolicy == EngineProperties.LatePolicy.DROP) {
            lateDropped.incrementAndGet();
            log.warn("Dropped late reading of machine {} for bucket starting at {}",
                key.machineId(), key.bucketStart());
            return;
        }
        corrections.compute(key, (k, bucket) -> {
            AggregateBucket target = bucket != null ? bucket : new AggregateBucket(k, granularitySeconds, true);
            target.add(enriched, anomalous);
            return target;
        });
        lateCorrected.incrementAndGet();
        log.debug("Late reading of machine {} folded into correction for bucket {}",
            key.machineId(), key.bucketStart());
    }

    /**
     * Behind the watermark the lateness rule takes over from the flushed set, so
     * at most allowed-lateness / granularity + 1 keys per machine stay behind.
     */
    private void pruneFlushed() {
        flushed.removeIf(key -> bucketEnd(key) <= watermark(key.machineId()));
    }

    int flushedKeyCount() {
        return flushed.size();
    }

    private List<AggregateBucket> drainCorrections() {
        List<AggregateBucket> drained = new ArrayList<>();
        for (BucketKey key : new ArrayList<>(corrections.keySet())) {
            AggregateBucket bucket = corrections.remove(key);
            if (bucket != null) {
                drained.add(bucket);
            }
        }
        return drained;
    }
}

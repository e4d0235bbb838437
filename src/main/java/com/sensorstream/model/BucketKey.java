package com.sensorstream.model;

/**
 * Identity of an aggregate bucket: machine plus the bucket's start in unix seconds.
 */
public record BucketKey(String machineId, long bucketStart) {

    public static BucketKey of(String machineId, long timestamp, long granularitySeconds) {
        long offset = Math.floorMod(timestamp, granularitySeconds);
        // the partial bucket below Long.MIN_VALUE starts at Long.MIN_VALUE
        return new BucketKey(machineId, timestamp < Long.MIN_VALUE + offset ? Long.MIN_VALUE : timestamp - offset);
    }

    /**
     * Exclusive end of the bucket, saturating at Long.MAX_VALUE.
     */
    public long end(long granularitySeconds) {
        return bucketStart > Long.MAX_VALUE - granularitySeconds ? Long.MAX_VALUE : bucketStart + granularitySeconds;
    }
}

package com.sensorstream.service.sink;

import com.sensorstream.dto.AggregateSummary;
import com.sensorstream.dto.EnrichedRecord;

import java.util.List;

/**
 * Durable destination for enriched records and emitted aggregates.
 *
 * Implementations signal failures with {@link SinkException}; the
 * {@link SinkDispatcher} retries them off the processing path.
 */
public interface StorageSink {

    void write(EnrichedRecord record);

    void writeBatch(List<AggregateSummary> aggregates);
}

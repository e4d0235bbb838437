package com.sensorstream.repository;

import com.sensorstream.model.MachineAggregate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for emitted aggregate buckets.
 */
@Repository
public interface MachineAggregateRepository extends JpaRepository<MachineAggregate, Long> {

    List<MachineAggregate> findByMachineIdOrderByBucketStartAsc(String machineId);
}

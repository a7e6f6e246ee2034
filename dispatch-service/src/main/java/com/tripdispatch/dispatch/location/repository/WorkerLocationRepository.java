package com.tripdispatch.dispatch.location.repository;

import com.tripdispatch.dispatch.location.entity.WorkerLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkerLocationRepository extends JpaRepository<WorkerLocation, UUID> {

    Optional<WorkerLocation> findFirstByWorkerIdOrderByCapturedAtDesc(String workerId);

    @Transactional
    @Modifying
    @Query("DELETE FROM WorkerLocation l WHERE l.capturedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}

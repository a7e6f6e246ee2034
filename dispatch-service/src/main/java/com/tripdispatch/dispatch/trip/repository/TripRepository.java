package com.tripdispatch.dispatch.trip.repository;

import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.shared.enums.TripStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID> {

    /** Idempotency keys are scoped to the requester that sent them. */
    Optional<Trip> findByRequesterIdAndIdempotencyKey(String requesterId, String idempotencyKey);

    boolean existsByRequesterIdAndStatusIn(String requesterId, Collection<TripStatus> statuses);

    boolean existsByRequesterIdAndStatusInAndIdNot(String requesterId, Collection<TripStatus> statuses, UUID id);

    boolean existsByWorkerIdAndStatusIn(String workerId, Collection<TripStatus> statuses);

    @Query("SELECT DISTINCT t.workerId FROM Trip t WHERE t.workerId IN :workerIds AND t.status IN :statuses")
    List<String> findBusyWorkers(@Param("workerIds") Collection<String> workerIds,
                                 @Param("statuses") Collection<TripStatus> statuses);

    @Query("SELECT t.id FROM Trip t WHERE t.status = :status AND t.scheduledAt <= :now ORDER BY t.scheduledAt")
    List<UUID> findDueScheduled(@Param("status") TripStatus status, @Param("now") Instant now);

    @Query("""
            SELECT t.id FROM Trip t
            WHERE t.status = :searching
              AND NOT EXISTS (SELECT o.id FROM DispatchOffer o
                              WHERE o.tripId = t.id AND o.status = :pending)
            """)
    List<UUID> findSearchingWithoutPendingOffers(
            @Param("searching") TripStatus searching,
            @Param("pending") OfferStatus pending);

    /**
     * Binds a worker only while the trip is still searching and unbound, and
     * only while the worker is not bound to another live trip. Returns 0 when
     * another worker, a cancellation or the worker's own other trip got there first.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Trip t
            SET t.workerId = :workerId,
                t.status = com.tripdispatch.shared.enums.TripStatus.ASSIGNED,
                t.assignedAt = :now,
                t.updatedAt = :now,
                t.version = t.version + 1
            WHERE t.id = :id
              AND t.workerId IS NULL
              AND t.status = com.tripdispatch.shared.enums.TripStatus.SEARCHING
              AND NOT EXISTS (SELECT b.id FROM Trip b
                              WHERE b.workerId = :workerId
                                AND b.status IN (com.tripdispatch.shared.enums.TripStatus.ASSIGNED,
                                                 com.tripdispatch.shared.enums.TripStatus.ARRIVED_PICKUP,
                                                 com.tripdispatch.shared.enums.TripStatus.IN_PROGRESS,
                                                 com.tripdispatch.shared.enums.TripStatus.ARRIVED_DROPOFF))
            """)
    int bindWorker(@Param("id") UUID id, @Param("workerId") String workerId, @Param("now") Instant now);

    /** Compare-and-set on the batch counter. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Trip t
            SET t.currentBatch = :nextBatch,
                t.escalationLevel = :level,
                t.updatedAt = :now,
                t.version = t.version + 1
            WHERE t.id = :id
              AND t.currentBatch = :expectedBatch
              AND t.status = com.tripdispatch.shared.enums.TripStatus.SEARCHING
            """)
    int advanceBatch(@Param("id") UUID id,
                     @Param("expectedBatch") int expectedBatch,
                     @Param("nextBatch") int nextBatch,
                     @Param("level") int level,
                     @Param("now") Instant now);
}

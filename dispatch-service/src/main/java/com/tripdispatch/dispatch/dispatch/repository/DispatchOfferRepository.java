package com.tripdispatch.dispatch.dispatch.repository;

import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
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
import java.util.Set;
import java.util.UUID;

@Repository
public interface DispatchOfferRepository extends JpaRepository<DispatchOffer, UUID> {

    Optional<DispatchOffer> findByTripIdAndWorkerId(UUID tripId, String workerId);

    List<DispatchOffer> findByTripIdOrderByBatchNumberAscSentAtAsc(UUID tripId);

    List<DispatchOffer> findByTripIdAndStatus(UUID tripId, OfferStatus status);

    boolean existsByTripIdAndStatus(UUID tripId, OfferStatus status);

    @Query("SELECT o.workerId FROM DispatchOffer o WHERE o.tripId = :tripId")
    Set<String> findOfferedWorkerIds(@Param("tripId") UUID tripId);

    @Query("""
            SELECT DISTINCT o.tripId FROM DispatchOffer o
            WHERE o.workerId = :workerId
              AND o.tripId <> :tripId
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
            """)
    List<UUID> findPendingTripIdsForWorker(@Param("workerId") String workerId, @Param("tripId") UUID tripId);

    @Query("SELECT o FROM DispatchOffer o WHERE o.status = :status AND o.expiresAt <= :now")
    List<DispatchOffer> findDue(@Param("status") OfferStatus status, @Param("now") Instant now);

    /** Open offers per worker on trips other than {@code tripId}; rows are [workerId, count]. */
    @Query("""
            SELECT o.workerId, COUNT(o) FROM DispatchOffer o
            WHERE o.workerId IN :workerIds
              AND o.tripId <> :tripId
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
              AND o.expiresAt > :now
            GROUP BY o.workerId
            """)
    List<Object[]> countOpenOffersByWorker(@Param("workerIds") Collection<String> workerIds,
                                           @Param("tripId") UUID tripId,
                                           @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.ACCEPTED,
                o.respondedAt = :now
            WHERE o.id = :id
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
              AND o.expiresAt > :now
            """)
    int acceptIfOpen(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.DECLINED,
                o.respondedAt = :now,
                o.declineReason = :reason
            WHERE o.id = :id
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
            """)
    int declineIfPending(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.EXPIRED
            WHERE o.id = :id
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
              AND o.expiresAt <= :now
            """)
    int expireIfPending(@Param("id") UUID id, @Param("now") Instant now);

    /** Cancels every pending offer of a trip. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.CANCELLED,
                o.respondedAt = :now
            WHERE o.tripId = :tripId
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
            """)
    int cancelPending(@Param("tripId") UUID tripId, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.CANCELLED,
                o.respondedAt = :now
            WHERE o.tripId = :tripId
              AND o.workerId = :workerId
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.ACCEPTED
            """)
    int cancelAccepted(@Param("tripId") UUID tripId, @Param("workerId") String workerId, @Param("now") Instant now);

    /** Withdraws a worker's pending offers on every trip except {@code tripId}. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE DispatchOffer o
            SET o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.CANCELLED,
                o.respondedAt = :now
            WHERE o.workerId = :workerId
              AND o.tripId <> :tripId
              AND o.status = com.tripdispatch.dispatch.dispatch.model.OfferStatus.PENDING
            """)
    int cancelPendingForWorker(@Param("workerId") String workerId, @Param("tripId") UUID tripId,
                               @Param("now") Instant now);
}

package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.fare.FareCalculator;
import com.tripdispatch.dispatch.ledger.LedgerService;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.entity.TripStatusHistory;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.dispatch.trip.repository.TripStatusHistoryRepository;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Applies trip status transitions: validates the edge, stamps the milestone,
 * appends history, settles money on terminal states and raises notifications.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripLifecycleService {

    private final TripRepository tripRepository;
    private final TripStatusHistoryRepository historyRepository;
    private final DispatchOfferRepository offerRepository;
    private final LedgerService ledgerService;
    private final FareCalculator fareCalculator;
    private final CancellationFeePolicy cancellationFeePolicy;
    private final TripEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public void recordCreated(Trip trip, Actor actor) {
        appendHistory(trip.getId(), null, TripStatus.PENDING, actor, null, null, null);
    }

    /** Moves a trip along a regular edge. Must run inside the caller's transaction. */
    @Transactional
    public Trip transition(Trip trip, TripStatus to, Actor actor, String note, Double lat, Double lng) {
        TripStatus previous = trip.getStatus();
        TripStateMachine.require(previous, to);

        Instant now = clock.instant();
        stampMilestone(trip, to, now);
        trip.setStatus(to);
        Trip saved = tripRepository.save(trip);

        appendHistory(saved.getId(), previous, to, actor, note, lat, lng);
        eventPublisher.statusChanged(saved, previous, actor.role(), note, List.of());
        log.info("Trip {} {} -> {} by {} {}", saved.getId(), previous, to, actor.role(), actor.id());
        return saved;
    }

    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public Trip markArrivedPickup(UUID tripId, String workerId, Double lat, Double lng) {
        return workerStep(tripId, workerId, TripStatus.ARRIVED_PICKUP, lat, lng);
    }

    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public Trip startTrip(UUID tripId, String workerId, Double lat, Double lng) {
        return workerStep(tripId, workerId, TripStatus.IN_PROGRESS, lat, lng);
    }

    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public Trip markArrivedDropoff(UUID tripId, String workerId, Double lat, Double lng) {
        return workerStep(tripId, workerId, TripStatus.ARRIVED_DROPOFF, lat, lng);
    }

    /**
     * Completes a trip and captures its hold. Actual distance and duration,
     * when both are given, re-price the trip; otherwise the estimate stands.
     */
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public Trip complete(UUID tripId, String workerId, Double actualDistanceKm, Integer actualDurationMin,
                         Double lat, Double lng) {
        Trip trip = loadTrip(tripId);
        requireBoundWorker(trip, workerId);
        TripStateMachine.require(trip.getStatus(), TripStatus.COMPLETED);

        BigDecimal finalFare = (actualDistanceKm != null && actualDurationMin != null)
                ? fareCalculator.calculate(trip.getVehicleType(), actualDistanceKm, actualDurationMin)
                : trip.getEstimatedFare();
        trip.setFinalFare(finalFare);

        if (trip.getHoldEntryId() != null) {
            ledgerService.captureHold(trip.getHoldEntryId(), finalFare);
        }
        return transition(trip, TripStatus.COMPLETED, Actor.worker(workerId), null, lat, lng);
    }

    /**
     * Cancel on behalf of a participant. The bound worker stepping away before
     * pickup releases the trip back to search instead of cancelling it.
     */
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public CancelOutcome cancel(UUID tripId, Actor actor, String reason) {
        Trip trip = loadTrip(tripId);

        if (actor.role() == UserRole.REQUESTER && !actor.id().equals(trip.getRequesterId())) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "Only the requester or the bound worker may cancel trip " + tripId);
        }
        if (actor.role() == UserRole.WORKER) {
            requireBoundWorker(trip, actor.id());
            if (TripStateMachine.canReassign(trip.getStatus())) {
                return new CancelOutcome(release(trip, actor, reason), true);
            }
        }
        return new CancelOutcome(cancelTrip(trip, actor, reason), false);
    }

    /**
     * Cancels a trip: closes pending offers, reverses the hold (charging the
     * cancellation fee where one applies) and notifies everyone involved.
     */
    @Transactional
    public Trip cancelTrip(Trip trip, Actor actor, String reason) {
        TripStatus previous = trip.getStatus();
        TripStateMachine.require(previous, TripStatus.CANCELLED);

        Instant now = clock.instant();
        BigDecimal fee = cancellationFeePolicy.feeFor(trip, actor.role());
        List<String> offeredWorkers = offerRepository.findByTripIdAndStatus(trip.getId(), OfferStatus.PENDING)
                .stream()
                .map(DispatchOffer::getWorkerId)
                .toList();
        int closed = offerRepository.cancelPending(trip.getId(), now);

        trip.setStatus(TripStatus.CANCELLED);
        trip.setCancelledAt(now);
        trip.setCancelledBy(actor.role());
        trip.setCancellationReason(reason);
        trip.setCancellationFee(fee);
        Trip saved = tripRepository.save(trip);

        if (saved.getHoldEntryId() != null) {
            ledgerService.reverseHold(saved.getHoldEntryId(), fee);
        }

        appendHistory(saved.getId(), previous, TripStatus.CANCELLED, actor, reason, null, null);
        eventPublisher.tripCancelled(saved, previous, actor.role(), reason, offeredWorkers);
        log.info("Trip {} cancelled from {} by {} reason={} fee={} offersClosed={}",
                saved.getId(), previous, actor.role(), reason, fee, closed);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TripStatusHistory> history(UUID tripId) {
        return historyRepository.findByTripIdOrderByIdAsc(tripId);
    }

    private Trip release(Trip trip, Actor worker, String reason) {
        TripStatus previous = trip.getStatus();
        TripStateMachine.requireReassignment(previous);

        Instant now = clock.instant();
        offerRepository.cancelAccepted(trip.getId(), worker.id(), now);

        trip.setWorkerId(null);
        trip.setStatus(TripStatus.SEARCHING);
        trip.setEscalationLevel(0);
        trip.setSearchStartedAt(now);
        trip.setAssignedAt(null);
        trip.setArrivedPickupAt(null);
        Trip saved = tripRepository.save(trip);

        appendHistory(saved.getId(), previous, TripStatus.SEARCHING, worker, reason, null, null);
        eventPublisher.statusChanged(saved, previous, UserRole.WORKER, reason, List.of(worker.id()));
        log.info("Worker {} released trip {} from {}, returning to search", worker.id(), saved.getId(), previous);
        return saved;
    }

    private Trip workerStep(UUID tripId, String workerId, TripStatus to, Double lat, Double lng) {
        Trip trip = loadTrip(tripId);
        requireBoundWorker(trip, workerId);
        return transition(trip, to, Actor.worker(workerId), null, lat, lng);
    }

    private void requireBoundWorker(Trip trip, String workerId) {
        if (trip.getWorkerId() == null || !trip.getWorkerId().equals(workerId)) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "Worker " + workerId + " is not bound to trip " + trip.getId());
        }
    }

    private Trip loadTrip(UUID tripId) {
        return tripRepository.findById(tripId)
                .orElseThrow(() -> new DispatchException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found"));
    }

    private void appendHistory(UUID tripId, TripStatus from, TripStatus to, Actor actor,
                               String note, Double lat, Double lng) {
        historyRepository.save(TripStatusHistory.builder()
                .tripId(tripId)
                .fromStatus(from)
                .toStatus(to)
                .actorId(actor.id())
                .actorRole(actor.role())
                .note(note)
                .lat(lat)
                .lng(lng)
                .occurredAt(clock.instant())
                .build());
    }

    /** History row for a bind done through the conditional update, which bypasses {@link #transition}. */
    @Transactional
    public void recordAssignment(UUID tripId, String workerId) {
        appendHistory(tripId, TripStatus.SEARCHING, TripStatus.ASSIGNED, Actor.worker(workerId), null, null, null);
    }

    private static void stampMilestone(Trip trip, TripStatus to, Instant now) {
        switch (to) {
            case SEARCHING -> trip.setSearchStartedAt(now);
            case ASSIGNED -> trip.setAssignedAt(now);
            case ARRIVED_PICKUP -> trip.setArrivedPickupAt(now);
            case IN_PROGRESS -> trip.setStartedAt(now);
            case ARRIVED_DROPOFF -> trip.setArrivedDropoffAt(now);
            case COMPLETED -> trip.setCompletedAt(now);
            case CANCELLED -> trip.setCancelledAt(now);
            default -> { }
        }
    }
}

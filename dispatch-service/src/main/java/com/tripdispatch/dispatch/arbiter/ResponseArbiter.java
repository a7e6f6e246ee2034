package com.tripdispatch.dispatch.arbiter;

import com.tripdispatch.dispatch.dispatch.BatchDispatcher;
import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.dispatch.worker.WorkerProfile;
import com.tripdispatch.dispatch.worker.WorkerProfileRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Resolves worker responses to offers. When several workers accept the same
 * trip, the conditional bind in the store picks exactly one; everyone else
 * gets ALREADY_ASSIGNED or OFFER_EXPIRED. A worker already bound to a live
 * trip cannot take a second one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseArbiter {

    private final TripRepository tripRepository;
    private final DispatchOfferRepository offerRepository;
    private final WorkerProfileRepository workerProfileRepository;
    private final TripLifecycleService lifecycleService;
    private final BatchDispatcher batchDispatcher;
    private final TripEventPublisher eventPublisher;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public ResponseOutcome respond(UUID tripId, String workerId, OfferDecision decision, String reason) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new DispatchException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found"));
        return decision == OfferDecision.ACCEPT
                ? accept(trip, workerId)
                : decline(trip, workerId, reason);
    }

    private ResponseOutcome accept(Trip trip, String workerId) {
        UUID tripId = trip.getId();
        WorkerProfile profile = workerProfileRepository.findById(workerId).orElse(null);
        if (profile == null || !profile.canTake(trip.getServiceType())) {
            throw new DispatchException(ErrorCode.INELIGIBLE_WORKER,
                    "Worker " + workerId + " is not eligible for " + trip.getServiceType() + " trips");
        }
        if (trip.getWorkerId() == null && tripRepository.existsByWorkerIdAndStatusIn(workerId, TripStatus.ON_TRIP)) {
            throw workerBusy(workerId);
        }
        DispatchOffer offer = offerRepository.findByTripIdAndWorkerId(tripId, workerId)
                .orElseThrow(() -> new DispatchException(ErrorCode.INELIGIBLE_WORKER,
                        "Worker " + workerId + " holds no offer for trip " + tripId));

        Instant now = clock.instant();
        if (!offer.isOpenAt(now)) {
            throw lostOffer(trip, workerId);
        }

        if (tripRepository.bindWorker(tripId, workerId, now) == 0) {
            Trip current = tripRepository.findById(tripId).orElse(trip);
            if (current.getStatus() == TripStatus.SEARCHING && current.getWorkerId() == null) {
                // the trip is still free, so the worker was bound elsewhere in the meantime
                throw workerBusy(workerId);
            }
            throw lostOffer(current, workerId);
        }
        if (offerRepository.acceptIfOpen(offer.getId(), now) == 0) {
            // rolls back the bind above
            throw new DispatchException(ErrorCode.OFFER_EXPIRED, "Offer for trip " + tripId + " has expired");
        }

        List<String> losers = offerRepository.findByTripIdAndStatus(tripId, OfferStatus.PENDING).stream()
                .map(DispatchOffer::getWorkerId)
                .toList();
        offerRepository.cancelPending(tripId, now);
        List<UUID> withdrawn = offerRepository.findPendingTripIdsForWorker(workerId, tripId);
        if (!withdrawn.isEmpty()) {
            offerRepository.cancelPendingForWorker(workerId, tripId, now);
        }
        lifecycleService.recordAssignment(tripId, workerId);

        Trip assigned = tripRepository.findById(tripId).orElseThrow();
        eventPublisher.tripAssigned(assigned, workerId, losers);

        metrics.recordOfferAccepted();
        if (assigned.getSearchStartedAt() != null) {
            metrics.recordTimeToAssign(Duration.between(assigned.getSearchStartedAt(), now));
        }
        log.info("Trip {} assigned to worker {} ({} competing offers closed, {} other offers withdrawn)",
                tripId, workerId, losers.size(), withdrawn.size());
        return new ResponseOutcome(assigned, withdrawn);
    }

    private ResponseOutcome decline(Trip trip, String workerId, String reason) {
        UUID tripId = trip.getId();
        DispatchOffer offer = offerRepository.findByTripIdAndWorkerId(tripId, workerId)
                .orElseThrow(() -> new DispatchException(ErrorCode.INELIGIBLE_WORKER,
                        "Worker " + workerId + " holds no offer for trip " + tripId));

        Instant now = clock.instant();
        if (offerRepository.declineIfPending(offer.getId(), reason, now) == 0) {
            throw lostOffer(trip, workerId);
        }
        metrics.recordOfferDeclined();
        log.info("Worker {} declined trip {} reason={}", workerId, tripId, reason);

        if (!offerRepository.existsByTripIdAndStatus(tripId, OfferStatus.PENDING)) {
            batchDispatcher.advance(tripId);
        }
        return ResponseOutcome.of(tripRepository.findById(tripId).orElseThrow());
    }

    private DispatchException workerBusy(String workerId) {
        return new DispatchException(ErrorCode.INELIGIBLE_WORKER,
                "Worker " + workerId + " is already on another trip");
    }

    private DispatchException lostOffer(Trip trip, String workerId) {
        if (trip.getWorkerId() != null && !trip.getWorkerId().equals(workerId)) {
            metrics.recordLostRace();
            return new DispatchException(ErrorCode.ALREADY_ASSIGNED,
                    "Trip " + trip.getId() + " is already assigned to another worker");
        }
        return new DispatchException(ErrorCode.OFFER_EXPIRED,
                "Offer for trip " + trip.getId() + " is no longer open");
    }
}

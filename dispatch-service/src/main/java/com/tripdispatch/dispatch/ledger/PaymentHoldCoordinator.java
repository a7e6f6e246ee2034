package com.tripdispatch.dispatch.ledger;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.ledger.entity.LedgerEntry;
import com.tripdispatch.dispatch.lifecycle.Actor;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.model.HoldResult;
import com.tripdispatch.dispatch.trip.model.TripDraft;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Creates a trip together with its wallet hold.
 *
 * ┌──── Single DB Transaction ──────────────────────────────────┐
 * │  1. Idempotent replay by key                                │
 * │  2. Touch requester's ledger account (serializes creates)   │
 * │  3. One active trip per requester                           │
 * │  4. available >= estimated fare (non-cash)                  │
 * │  5. INSERT trip PENDING -> SEARCHING | SCHEDULED            │
 * │  6. INSERT HOLD entry, link it on the trip (non-cash)       │
 * └─────────────────────────────────────────────────────────────┘
 *
 * Conflicting concurrent creates lose on the account version or a unique key
 * and are retried; the retry then sees the winner's rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentHoldCoordinator {

    private final TripRepository tripRepository;
    private final LedgerService ledgerService;
    private final TripLifecycleService lifecycleService;
    private final TripEventPublisher eventPublisher;
    private final DispatchMetrics metrics;

    @Retryable(retryFor = {ConcurrencyFailureException.class, DataIntegrityViolationException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 100, multiplier = 2))
    @Transactional
    public HoldResult createTripWithHold(String requesterId, TripDraft draft, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<Trip> existing = tripRepository.findByRequesterIdAndIdempotencyKey(requesterId, idempotencyKey);
            if (existing.isPresent()) {
                log.info("Idempotent replay for requester {} key {}", requesterId, idempotencyKey);
                metrics.recordIdempotentReplay();
                return new HoldResult(existing.get(), existing.get().getHoldEntryId(), true);
            }
        }

        ledgerService.touch(requesterId);

        if (tripRepository.existsByRequesterIdAndStatusIn(requesterId, TripStatus.ACTIVE)) {
            metrics.recordTripRejected();
            throw new DispatchException(ErrorCode.ACTIVE_TRIP_EXISTS,
                    "Requester " + requesterId + " already has an active trip");
        }

        boolean needsHold = draft.getPaymentMethod().requiresHold();
        if (needsHold) {
            BigDecimal available = ledgerService.available(requesterId, draft.getCurrency());
            if (available.compareTo(draft.getEstimatedFare()) < 0) {
                metrics.recordTripRejected();
                throw new DispatchException(ErrorCode.INSUFFICIENT_BALANCE,
                        "Wallet balance " + available + " " + draft.getCurrency()
                                + " does not cover the estimated fare " + draft.getEstimatedFare());
            }
        }

        Trip trip = tripRepository.save(Trip.builder()
                .requesterId(requesterId)
                .status(TripStatus.PENDING)
                .serviceType(draft.getServiceType())
                .vehicleType(draft.getVehicleType())
                .pickupLat(draft.getPickupLat())
                .pickupLng(draft.getPickupLng())
                .pickupAddress(draft.getPickupAddress())
                .dropoffLat(draft.getDropoffLat())
                .dropoffLng(draft.getDropoffLng())
                .dropoffAddress(draft.getDropoffAddress())
                .estimatedDistanceKm(draft.getEstimatedDistanceKm())
                .estimatedDurationMin(draft.getEstimatedDurationMin())
                .estimatedFare(draft.getEstimatedFare())
                .routeFallbackUsed(draft.isRouteFallbackUsed())
                .currency(draft.getCurrency())
                .paymentMethod(draft.getPaymentMethod())
                .scheduledAt(draft.getScheduledAt())
                .idempotencyKey(idempotencyKey)
                .build());
        lifecycleService.recordCreated(trip, Actor.requester(requesterId));

        if (needsHold) {
            LedgerEntry hold = ledgerService.placeHold(requesterId, trip.getId(),
                    draft.getEstimatedFare(), draft.getCurrency());
            trip.setHoldEntryId(hold.getId());
        }

        TripStatus next = draft.getScheduledAt() != null ? TripStatus.SCHEDULED : TripStatus.SEARCHING;
        trip = lifecycleService.transition(trip, next, Actor.requester(requesterId), null, null, null);

        eventPublisher.tripRequested(trip);
        metrics.recordTripCreated();
        log.info("Trip {} created for requester {} status={} fare={} {} hold={}", trip.getId(), requesterId,
                trip.getStatus(), trip.getEstimatedFare(), trip.getCurrency(), trip.getHoldEntryId());
        return new HoldResult(trip, trip.getHoldEntryId(), false);
    }
}

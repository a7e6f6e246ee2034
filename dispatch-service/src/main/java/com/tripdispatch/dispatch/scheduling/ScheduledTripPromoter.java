package com.tripdispatch.dispatch.scheduling;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.lifecycle.Actor;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledTripPromoter {

    public static final String ACTIVE_TRIP_CONFLICT = "ACTIVE_TRIP_CONFLICT";

    private final TripRepository tripRepository;
    private final TripLifecycleService lifecycleService;
    private final TripPolicyProperties tripPolicyProperties;
    private final Clock clock;

    /** Moves one due scheduled trip into search, in its own transaction. */
    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public PromotionOutcome promote(UUID tripId) {
        Trip trip = tripRepository.findById(tripId).orElse(null);
        if (trip == null || trip.getStatus() != TripStatus.SCHEDULED) {
            return PromotionOutcome.SKIPPED;
        }

        Instant now = clock.instant();
        if (tripRepository.existsByRequesterIdAndStatusInAndIdNot(trip.getRequesterId(), TripStatus.ACTIVE, tripId)) {
            Instant deadline = trip.getScheduledAt().plus(tripPolicyProperties.getScheduling().getPromotionGrace());
            if (now.isAfter(deadline)) {
                lifecycleService.cancelTrip(trip, Actor.SYSTEM, ACTIVE_TRIP_CONFLICT);
                log.warn("Scheduled trip {} cancelled: requester {} still on another trip past the grace period",
                        tripId, trip.getRequesterId());
                return PromotionOutcome.CANCELLED;
            }
            log.info("Scheduled trip {} deferred: requester {} has another active trip", tripId, trip.getRequesterId());
            return PromotionOutcome.DEFERRED;
        }

        lifecycleService.transition(trip, TripStatus.SEARCHING, Actor.SYSTEM, "SCHEDULED_DUE", null, null);
        return PromotionOutcome.PROMOTED;
    }
}

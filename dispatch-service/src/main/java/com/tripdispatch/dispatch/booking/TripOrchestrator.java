package com.tripdispatch.dispatch.booking;

import com.tripdispatch.dispatch.arbiter.OfferDecision;
import com.tripdispatch.dispatch.arbiter.ResponseArbiter;
import com.tripdispatch.dispatch.arbiter.ResponseOutcome;
import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.dispatch.BatchDispatcher;
import com.tripdispatch.dispatch.dispatch.model.AdvanceOutcome;
import com.tripdispatch.dispatch.dispatch.model.DispatchStats;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.fare.FareCalculator;
import com.tripdispatch.dispatch.fare.GeoRoutingClient;
import com.tripdispatch.dispatch.fare.RouteEstimate;
import com.tripdispatch.dispatch.ledger.PaymentHoldCoordinator;
import com.tripdispatch.dispatch.ledger.TipService;
import com.tripdispatch.dispatch.lifecycle.Actor;
import com.tripdispatch.dispatch.lifecycle.CancelOutcome;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.tracking.ShareLink;
import com.tripdispatch.dispatch.tracking.ShareTrackingService;
import com.tripdispatch.dispatch.tracking.TrackingView;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.model.CreateTripRequest;
import com.tripdispatch.dispatch.trip.model.HoldResult;
import com.tripdispatch.dispatch.trip.model.TripDraft;
import com.tripdispatch.dispatch.trip.model.TripHistoryEntry;
import com.tripdispatch.dispatch.trip.model.WorkerStepRequest;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import com.tripdispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for trip operations. Each step that owns a transaction is
 * called separately, so a trip is persisted and committed before the first
 * batch is dispatched, and a released worker's trip is committed before it
 * goes back to search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripOrchestrator {

    private final PaymentHoldCoordinator holdCoordinator;
    private final BatchDispatcher dispatcher;
    private final ResponseArbiter arbiter;
    private final TripLifecycleService lifecycleService;
    private final TipService tipService;
    private final ShareTrackingService shareTrackingService;
    private final GeoRoutingClient geoRoutingClient;
    private final FareCalculator fareCalculator;
    private final FeatureFlagService featureFlagService;
    private final TripRepository tripRepository;
    private final TripPolicyProperties tripPolicyProperties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public HoldResult createTrip(String requesterId, CreateTripRequest request, String idempotencyKey) {
        if (featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)) {
            metrics.recordKillSwitchRejection();
            log.warn("Kill switch on, rejecting trip request from {}", requesterId);
            throw new DispatchException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Trip dispatch is temporarily unavailable");
        }
        if (request.getScheduledAt() != null) {
            validateSchedule(request.getScheduledAt());
        }

        RouteEstimate route = geoRoutingClient.route(request.getPickupLat(), request.getPickupLng(),
                request.getDropoffLat(), request.getDropoffLng());
        BigDecimal fare = fareCalculator.calculate(request.getVehicleType(), route);
        String currency = request.getCurrency() != null
                ? request.getCurrency()
                : tripPolicyProperties.getDefaultCurrency();

        TripDraft draft = TripDraft.builder()
                .serviceType(request.getServiceType())
                .vehicleType(request.getVehicleType())
                .pickupLat(request.getPickupLat())
                .pickupLng(request.getPickupLng())
                .pickupAddress(request.getPickupAddress())
                .dropoffLat(request.getDropoffLat())
                .dropoffLng(request.getDropoffLng())
                .dropoffAddress(request.getDropoffAddress())
                .paymentMethod(request.getPaymentMethod())
                .currency(currency)
                .scheduledAt(request.getScheduledAt())
                .estimatedDistanceKm(BigDecimal.valueOf(route.distanceKm()).setScale(3, RoundingMode.HALF_UP))
                .estimatedDurationMin(route.durationMin())
                .estimatedFare(fare)
                .routeFallbackUsed(route.fallback())
                .build();

        HoldResult result = holdCoordinator.createTripWithHold(requesterId, draft, idempotencyKey);
        if (!result.replayed() && result.trip().getStatus() == TripStatus.SEARCHING) {
            dispatch(result.trip().getId());
            Trip current = tripRepository.findById(result.trip().getId()).orElse(result.trip());
            return new HoldResult(current, result.holdId(), false);
        }
        return result;
    }

    public Trip getTrip(UUID tripId, String userId) {
        return participantTrip(tripId, userId);
    }

    /** Trips that lost their offer to the accepting worker are re-dispatched after the accept commits. */
    public Trip respond(UUID tripId, String workerId, OfferDecision decision, String reason) {
        ResponseOutcome outcome = arbiter.respond(tripId, workerId, decision, reason);
        outcome.withdrawnTripIds().forEach(this::dispatch);
        return outcome.trip();
    }

    public Trip cancel(UUID tripId, String userId, UserRole role, String reason) {
        Actor actor = switch (role) {
            case REQUESTER -> Actor.requester(userId);
            case WORKER -> Actor.worker(userId);
            default -> throw new DispatchException(ErrorCode.INVALID_REQUEST, "Role " + role + " cannot cancel trips");
        };
        CancelOutcome outcome = lifecycleService.cancel(tripId, actor, reason);
        if (!outcome.released()) {
            return outcome.trip();
        }
        dispatch(tripId);
        return tripRepository.findById(tripId).orElse(outcome.trip());
    }

    public Trip arrivedAtPickup(UUID tripId, String workerId, WorkerStepRequest step) {
        return lifecycleService.markArrivedPickup(tripId, workerId, lat(step), lng(step));
    }

    public Trip startTrip(UUID tripId, String workerId, WorkerStepRequest step) {
        return lifecycleService.startTrip(tripId, workerId, lat(step), lng(step));
    }

    public Trip arrivedAtDropoff(UUID tripId, String workerId, WorkerStepRequest step) {
        return lifecycleService.markArrivedDropoff(tripId, workerId, lat(step), lng(step));
    }

    public Trip complete(UUID tripId, String workerId, WorkerStepRequest step) {
        return lifecycleService.complete(tripId, workerId,
                step == null ? null : step.getActualDistanceKm(),
                step == null ? null : step.getActualDurationMin(),
                lat(step), lng(step));
    }

    public List<TripHistoryEntry> history(UUID tripId, String userId) {
        participantTrip(tripId, userId);
        return lifecycleService.history(tripId).stream()
                .map(TripHistoryEntry::from)
                .toList();
    }

    public DispatchStats stats(UUID tripId, String userId) {
        return dispatcher.stats(participantTrip(tripId, userId));
    }

    public Trip addTip(UUID tripId, String requesterId, BigDecimal amount) {
        requireFlag(FeatureFlagService.TIPS_ENABLED, "Tipping");
        return tipService.addTip(tripId, requesterId, amount);
    }

    public ShareLink share(UUID tripId, String requesterId) {
        requireFlag(FeatureFlagService.TRIP_SHARING_ENABLED, "Trip sharing");
        return shareTrackingService.issue(tripId, requesterId);
    }

    public int revokeShare(UUID tripId, String requesterId) {
        return shareTrackingService.revoke(tripId, requesterId);
    }

    public TrackingView track(String token) {
        requireFlag(FeatureFlagService.TRIP_SHARING_ENABLED, "Trip sharing");
        return shareTrackingService.view(token);
    }

    private void dispatch(UUID tripId) {
        try {
            AdvanceOutcome outcome = dispatcher.advance(tripId);
            log.debug("Dispatch of trip {}: {}", tripId, outcome);
        } catch (RuntimeException ex) {
            // the expiry sweep picks up SEARCHING trips with no pending offer
            log.error("Dispatch of trip {} failed, leaving it to the sweep: {}", tripId, ex.getMessage(), ex);
        }
    }

    private void validateSchedule(Instant scheduledAt) {
        if (!featureFlagService.isEnabled(FeatureFlagService.SCHEDULED_TRIPS_ENABLED, true)) {
            throw new DispatchException(ErrorCode.INVALID_REQUEST, "Scheduled trips are not available");
        }
        TripPolicyProperties.Scheduling scheduling = tripPolicyProperties.getScheduling();
        Instant now = clock.instant();
        if (scheduledAt.isBefore(now.plus(scheduling.getMinLead()))) {
            throw new DispatchException(ErrorCode.INVALID_REQUEST,
                    "Scheduled trips must be booked at least " + scheduling.getMinLead().toMinutes() + " minutes ahead");
        }
        if (scheduledAt.isAfter(now.plus(scheduling.getMaxHorizon()))) {
            throw new DispatchException(ErrorCode.INVALID_REQUEST,
                    "Scheduled trips cannot be booked more than " + scheduling.getMaxHorizon().toDays() + " days ahead");
        }
    }

    private void requireFlag(String flag, String feature) {
        if (!featureFlagService.isEnabled(flag, true)) {
            throw new DispatchException(ErrorCode.SERVICE_UNAVAILABLE, feature + " is currently disabled");
        }
    }

    private Trip participantTrip(UUID tripId, String userId) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new DispatchException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found"));
        if (!trip.isParticipant(userId)) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "User " + userId + " is not part of trip " + tripId);
        }
        return trip;
    }

    private static Double lat(WorkerStepRequest step) {
        return step == null ? null : step.getLat();
    }

    private static Double lng(WorkerStepRequest step) {
        return step == null ? null : step.getLng();
    }
}

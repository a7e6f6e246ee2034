package com.tripdispatch.dispatch.tracking;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.location.LocationRegistry;
import com.tripdispatch.dispatch.location.model.WorkerPosition;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Share links that let someone outside the trip follow its progress.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShareTrackingService {

    static final Set<TripStatus> SHAREABLE = EnumSet.of(TripStatus.ASSIGNED, TripStatus.ARRIVED_PICKUP,
            TripStatus.IN_PROGRESS, TripStatus.ARRIVED_DROPOFF, TripStatus.COMPLETED);

    private static final Set<TripStatus> LIVE = EnumSet.of(TripStatus.ASSIGNED, TripStatus.ARRIVED_PICKUP,
            TripStatus.IN_PROGRESS, TripStatus.ARRIVED_DROPOFF);

    private final ShareTokenRepository tokenRepository;
    private final TripRepository tripRepository;
    private final LocationRegistry locationRegistry;
    private final TripPolicyProperties tripPolicyProperties;
    private final Clock clock;

    @Transactional
    public ShareLink issue(UUID tripId, String requesterId) {
        Trip trip = requesterTrip(tripId, requesterId);
        if (!SHAREABLE.contains(trip.getStatus())) {
            throw new DispatchException(ErrorCode.INVALID_TRANSITION,
                    "Trip " + tripId + " cannot be shared while " + trip.getStatus());
        }

        Instant now = clock.instant();
        Optional<ShareToken> current = tokenRepository.findByTripIdAndRevokedFalse(tripId).stream()
                .filter(t -> t.isValidAt(now))
                .findFirst();
        if (current.isPresent()) {
            return ShareLink.of(current.get());
        }

        Instant expiresAt = trip.getStatus() == TripStatus.COMPLETED
                ? trip.getCompletedAt().plus(tripPolicyProperties.getSharing().getPostCompletionTtl())
                : now.plus(tripPolicyProperties.getSharing().getTokenTtl());
        if (!expiresAt.isAfter(now)) {
            throw new DispatchException(ErrorCode.INVALID_TRANSITION, "Trip " + tripId + " can no longer be shared");
        }
        ShareToken token = tokenRepository.save(ShareToken.builder()
                .token(UUID.randomUUID().toString())
                .tripId(tripId)
                .createdBy(requesterId)
                .createdAt(now)
                .expiresAt(expiresAt)
                .build());
        log.info("Share token issued for trip {} until {}", tripId, expiresAt);
        return ShareLink.of(token);
    }

    @Transactional
    public int revoke(UUID tripId, String requesterId) {
        requesterTrip(tripId, requesterId);
        int revoked = 0;
        for (ShareToken token : tokenRepository.findByTripIdAndRevokedFalse(tripId)) {
            token.setRevoked(true);
            tokenRepository.save(token);
            revoked++;
        }
        log.info("Revoked {} share tokens for trip {}", revoked, tripId);
        return revoked;
    }

    @Transactional(readOnly = true)
    public TrackingView view(String tokenValue) {
        Instant now = clock.instant();
        ShareToken token = tokenRepository.findById(tokenValue)
                .filter(t -> t.isValidAt(now))
                .orElseThrow(() -> new DispatchException(ErrorCode.SHARE_TOKEN_INVALID,
                        "Share link is invalid or has expired"));
        Trip trip = tripRepository.findById(token.getTripId())
                .orElseThrow(() -> new DispatchException(ErrorCode.SHARE_TOKEN_INVALID,
                        "Share link is invalid or has expired"));

        TrackingView.TrackingViewBuilder view = TrackingView.builder()
                .status(trip.getStatus())
                .vehicleType(trip.getVehicleType())
                .pickupAddress(trip.getPickupAddress())
                .dropoffAddress(trip.getDropoffAddress())
                .assignedAt(trip.getAssignedAt())
                .arrivedPickupAt(trip.getArrivedPickupAt())
                .startedAt(trip.getStartedAt())
                .arrivedDropoffAt(trip.getArrivedDropoffAt())
                .completedAt(trip.getCompletedAt())
                .expiresAt(token.getExpiresAt());

        if (LIVE.contains(trip.getStatus()) && trip.getWorkerId() != null) {
            locationRegistry.latest(trip.getWorkerId()).ifPresent((WorkerPosition p) -> view
                    .workerLat(p.lat())
                    .workerLng(p.lng())
                    .workerLocationAt(p.capturedAt()));
        }
        return view.build();
    }

    private Trip requesterTrip(UUID tripId, String requesterId) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new DispatchException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found"));
        if (!trip.getRequesterId().equals(requesterId)) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "Only the requester may manage sharing for trip " + tripId);
        }
        return trip;
    }
}

package com.tripdispatch.dispatch.tracking;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public view of a shared trip. Carries no party identities and no money.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackingView {
    TripStatus status;
    VehicleType vehicleType;
    String pickupAddress;
    String dropoffAddress;
    Instant assignedAt;
    Instant arrivedPickupAt;
    Instant startedAt;
    Instant arrivedDropoffAt;
    Instant completedAt;
    Double workerLat;
    Double workerLng;
    Instant workerLocationAt;
    Instant expiresAt;
}

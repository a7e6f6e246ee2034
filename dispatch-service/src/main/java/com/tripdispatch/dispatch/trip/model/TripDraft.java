package com.tripdispatch.dispatch.trip.model;

import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/** A validated, priced trip request ready to be persisted with its hold. */
@Value
@Builder
public class TripDraft {
    ServiceType serviceType;
    VehicleType vehicleType;
    double pickupLat;
    double pickupLng;
    String pickupAddress;
    double dropoffLat;
    double dropoffLng;
    String dropoffAddress;
    PaymentMethod paymentMethod;
    String currency;
    Instant scheduledAt;
    BigDecimal estimatedDistanceKm;
    int estimatedDurationMin;
    BigDecimal estimatedFare;
    boolean routeFallbackUsed;
}

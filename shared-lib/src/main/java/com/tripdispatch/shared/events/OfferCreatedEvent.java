package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.VehicleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferCreatedEvent {

    public static final String TOPIC = "trip.offer.created";

    private String offerId;
    private String tripId;
    private String workerId;
    private int batchNumber;
    private ServiceType serviceType;
    private VehicleType vehicleType;
    private String pickupAddress;
    private String dropoffAddress;
    private double distanceKm;
    private int estimatedArrivalMin;
    private BigDecimal estimatedFare;
    private String currency;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant sentAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}

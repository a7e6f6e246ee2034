package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
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
public class TripRequestedEvent {

    public static final String TOPIC = "trip.requested";

    private String tripId;
    private String requesterId;
    private TripStatus status;
    private ServiceType serviceType;
    private VehicleType vehicleType;
    private double pickupLat;
    private double pickupLng;
    private double dropoffLat;
    private double dropoffLng;
    private BigDecimal estimatedFare;
    private String currency;
    private PaymentMethod paymentMethod;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant scheduledAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;
}

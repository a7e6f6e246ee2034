package com.tripdispatch.dispatch.trip.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import com.tripdispatch.shared.enums.VehicleType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TripResponse {
    private UUID tripId;
    private String requesterId;
    private String workerId;
    private TripStatus status;
    private ServiceType serviceType;
    private VehicleType vehicleType;
    private double pickupLat;
    private double pickupLng;
    private String pickupAddress;
    private double dropoffLat;
    private double dropoffLng;
    private String dropoffAddress;
    private BigDecimal estimatedDistanceKm;
    private int estimatedDurationMin;
    private BigDecimal estimatedFare;
    private boolean routeFallbackUsed;
    private BigDecimal finalFare;
    private BigDecimal tipAmount;
    private String currency;
    private PaymentMethod paymentMethod;
    private UUID holdEntryId;
    private Instant scheduledAt;
    private int currentBatch;
    private int escalationLevel;
    private Instant searchStartedAt;
    private Instant assignedAt;
    private Instant arrivedPickupAt;
    private Instant startedAt;
    private Instant arrivedDropoffAt;
    private Instant completedAt;
    private Instant cancelledAt;
    private String cancellationReason;
    private UserRole cancelledBy;
    private BigDecimal cancellationFee;
    private Instant createdAt;
    private boolean replayed;

    public static TripResponse from(Trip t) {
        return from(t, false);
    }

    public static TripResponse from(Trip t, boolean replayed) {
        return TripResponse.builder()
                .tripId(t.getId())
                .requesterId(t.getRequesterId())
                .workerId(t.getWorkerId())
                .status(t.getStatus())
                .serviceType(t.getServiceType())
                .vehicleType(t.getVehicleType())
                .pickupLat(t.getPickupLat())
                .pickupLng(t.getPickupLng())
                .pickupAddress(t.getPickupAddress())
                .dropoffLat(t.getDropoffLat())
                .dropoffLng(t.getDropoffLng())
                .dropoffAddress(t.getDropoffAddress())
                .estimatedDistanceKm(t.getEstimatedDistanceKm())
                .estimatedDurationMin(t.getEstimatedDurationMin())
                .estimatedFare(t.getEstimatedFare())
                .routeFallbackUsed(t.isRouteFallbackUsed())
                .finalFare(t.getFinalFare())
                .tipAmount(t.getTipAmount())
                .currency(t.getCurrency())
                .paymentMethod(t.getPaymentMethod())
                .holdEntryId(t.getHoldEntryId())
                .scheduledAt(t.getScheduledAt())
                .currentBatch(t.getCurrentBatch())
                .escalationLevel(t.getEscalationLevel())
                .searchStartedAt(t.getSearchStartedAt())
                .assignedAt(t.getAssignedAt())
                .arrivedPickupAt(t.getArrivedPickupAt())
                .startedAt(t.getStartedAt())
                .arrivedDropoffAt(t.getArrivedDropoffAt())
                .completedAt(t.getCompletedAt())
                .cancelledAt(t.getCancelledAt())
                .cancellationReason(t.getCancellationReason())
                .cancelledBy(t.getCancelledBy())
                .cancellationFee(t.getCancellationFee())
                .createdAt(t.getCreatedAt())
                .replayed(replayed)
                .build();
    }
}

package com.tripdispatch.dispatch.trip.model;

import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.VehicleType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTripRequest {

    @NotNull
    private ServiceType serviceType;

    @NotNull
    private VehicleType vehicleType;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @Size(max = 255)
    private String pickupAddress;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    @Size(max = 255)
    private String dropoffAddress;

    @NotNull
    private PaymentMethod paymentMethod;

    @Pattern(regexp = "[A-Z]{3}")
    private String currency;

    /** Null for an immediate trip. */
    private Instant scheduledAt;
}

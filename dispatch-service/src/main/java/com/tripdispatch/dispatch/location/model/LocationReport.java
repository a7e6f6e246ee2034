package com.tripdispatch.dispatch.location.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationReport {

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @DecimalMin("0.0")
    @DecimalMax("360.0")
    private Double heading;

    @PositiveOrZero
    private Double speedKmh;

    @PositiveOrZero
    private Double accuracyM;

    @Builder.Default
    private boolean online = true;

    @Builder.Default
    private boolean available = true;
}

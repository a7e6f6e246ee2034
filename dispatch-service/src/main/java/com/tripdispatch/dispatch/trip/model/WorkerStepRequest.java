package com.tripdispatch.dispatch.trip.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional body of the worker lifecycle endpoints. The actuals only apply to completion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStepRequest {

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double lat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double lng;

    @Positive
    private Double actualDistanceKm;

    @Positive
    private Integer actualDurationMin;
}

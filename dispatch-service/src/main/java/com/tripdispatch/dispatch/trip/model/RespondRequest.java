package com.tripdispatch.dispatch.trip.model;

import com.tripdispatch.dispatch.arbiter.OfferDecision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RespondRequest {

    @NotNull
    private OfferDecision decision;

    @Size(max = 255)
    private String reason;
}

package com.tripdispatch.dispatch.dispatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class DispatchStats {
    UUID tripId;
    int workersContacted;
    int batchesIssued;
    int escalationLevel;
    Map<OfferStatus, Long> offersByStatus;
    Double averageDistanceKm;
    Double averageArrivalMin;
}

package com.tripdispatch.dispatch.candidate;

import com.tripdispatch.shared.enums.VehicleType;

public record DispatchCandidate(String workerId, VehicleType vehicleType, double distanceKm,
                                int estimatedArrivalMin) {
}

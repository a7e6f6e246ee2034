package com.tripdispatch.dispatch.candidate;

import com.tripdispatch.shared.enums.VehicleType;

/**
 * Filters loosened as a search escalates. Service capability and worker
 * eligibility are never loosened.
 */
public enum RelaxationTier {
    STRICT,
    VEHICLE_UPGRADE,
    RELAXED_CONCURRENCY;

    public static RelaxationTier forLevel(int escalationLevel) {
        if (escalationLevel <= 0) {
            return STRICT;
        }
        return escalationLevel == 1 ? VEHICLE_UPGRADE : RELAXED_CONCURRENCY;
    }

    public boolean vehicleMatches(VehicleType workerVehicle, VehicleType requested) {
        if (workerVehicle == null) {
            return false;
        }
        return this == STRICT ? workerVehicle == requested : workerVehicle.canServe(requested);
    }

    public int concurrencyCap(int baseCap) {
        return this == RELAXED_CONCURRENCY ? baseCap * 2 : baseCap;
    }
}

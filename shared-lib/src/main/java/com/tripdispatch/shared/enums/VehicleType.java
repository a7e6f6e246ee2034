package com.tripdispatch.shared.enums;

/**
 * Ordered from lowest to highest class. A worker with a higher-class vehicle
 * may serve a lower-class request once dispatch relaxes the vehicle filter.
 */
public enum VehicleType {
    BIKE,
    ECONOMY,
    COMFORT,
    PREMIUM;

    public boolean canServe(VehicleType requested) {
        return this.ordinal() >= requested.ordinal();
    }
}

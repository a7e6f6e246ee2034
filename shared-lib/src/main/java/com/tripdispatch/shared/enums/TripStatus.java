package com.tripdispatch.shared.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TripStatus {
    PENDING,
    SCHEDULED,
    SEARCHING,
    ASSIGNED,
    ARRIVED_PICKUP,
    IN_PROGRESS,
    ARRIVED_DROPOFF,
    COMPLETED,
    CANCELLED;

    /** Statuses counted against the one-active-trip-per-requester rule. */
    public static final Set<TripStatus> ACTIVE = EnumSet.of(
            PENDING, SEARCHING, ASSIGNED, ARRIVED_PICKUP, IN_PROGRESS, ARRIVED_DROPOFF);

    /** A worker bound to a trip in one of these is not free for another. */
    public static final Set<TripStatus> ON_TRIP = EnumSet.of(
            ASSIGNED, ARRIVED_PICKUP, IN_PROGRESS, ARRIVED_DROPOFF);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}

package com.tripdispatch.dispatch.arbiter;

import com.tripdispatch.dispatch.trip.entity.Trip;

import java.util.List;
import java.util.UUID;

/**
 * Result of a worker response. {@code withdrawnTripIds} lists the other trips
 * whose pending offers to the accepting worker were cancelled by the accept.
 */
public record ResponseOutcome(Trip trip, List<UUID> withdrawnTripIds) {

    static ResponseOutcome of(Trip trip) {
        return new ResponseOutcome(trip, List.of());
    }
}

package com.tripdispatch.dispatch.lifecycle;

import com.tripdispatch.dispatch.trip.entity.Trip;

/**
 * Result of a cancel request. {@code released} means the worker stepped away
 * before pickup and the trip went back to search instead of ending.
 */
public record CancelOutcome(Trip trip, boolean released) {
}

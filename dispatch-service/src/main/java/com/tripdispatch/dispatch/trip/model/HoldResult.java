package com.tripdispatch.dispatch.trip.model;

import com.tripdispatch.dispatch.trip.entity.Trip;

import java.util.UUID;

/** {@code holdId} is null for cash trips. */
public record HoldResult(Trip trip, UUID holdId, boolean replayed) {
}

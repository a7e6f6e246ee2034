package com.tripdispatch.dispatch.trip.model;

import com.tripdispatch.dispatch.trip.entity.TripStatusHistory;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;

import java.time.Instant;

public record TripHistoryEntry(TripStatus fromStatus, TripStatus toStatus, String actorId, UserRole actorRole,
                               Double lat, Double lng, String note, Instant occurredAt) {

    public static TripHistoryEntry from(TripStatusHistory h) {
        return new TripHistoryEntry(h.getFromStatus(), h.getToStatus(), h.getActorId(), h.getActorRole(),
                h.getLat(), h.getLng(), h.getNote(), h.getOccurredAt());
    }
}

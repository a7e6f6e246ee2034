package com.tripdispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RealtimeEventType {
    OFFER_CREATED("offer_created"),
    TRIP_ASSIGNED("trip_assigned"),
    TRIP_STATUS_CHANGED("trip_status_changed"),
    TRIP_CANCELLED("trip_cancelled");

    private final String wireName;

    RealtimeEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package com.tripdispatch.dispatch.location.model;

import java.time.Instant;

/** Last known state of a worker as held by the location index. */
public record WorkerPosition(String workerId, double lat, double lng, boolean online, boolean available,
                             Instant capturedAt) {

    public boolean dispatchable() {
        return online && available;
    }
}

package com.tripdispatch.dispatch.location.model;

import java.time.Instant;

public record NearbyWorker(String workerId, double lat, double lng, double distanceKm, Instant capturedAt) {
}

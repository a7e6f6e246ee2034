package com.tripdispatch.dispatch.fare;

/**
 * Distance and duration for a pickup to dropoff leg.
 * {@code fallback} is set when the figures are a straight-line approximation.
 */
public record RouteEstimate(double distanceKm, int durationMin, boolean fallback) {
}

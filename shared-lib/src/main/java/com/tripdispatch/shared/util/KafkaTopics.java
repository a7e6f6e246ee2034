package com.tripdispatch.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String TRIP_REQUESTED           = "trip.requested";
    public static final String TRIP_OFFER_CREATED       = "trip.offer.created";
    public static final String TRIP_ASSIGNED            = "trip.assigned";
    public static final String TRIP_STATUS_CHANGED      = "trip.status.changed";
    public static final String TRIP_CANCELLED           = "trip.cancelled";
    public static final String WORKER_LOCATION_REPORTED = "worker.location.reported";
}

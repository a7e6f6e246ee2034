package com.tripdispatch.dispatch.notification;

import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.UserRole;
import com.tripdispatch.shared.events.OfferCreatedEvent;
import com.tripdispatch.shared.events.RealtimeEvent;
import com.tripdispatch.shared.events.RealtimeEventType;
import com.tripdispatch.shared.events.TripRequestedEvent;
import com.tripdispatch.shared.events.TripStatusChangedEvent;
import com.tripdispatch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds trip notifications and hands them to Spring's event bus.
 * Nothing is sent from here; see {@link TripEventRelay}.
 */
@Component
@RequiredArgsConstructor
public class TripEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void tripRequested(Trip trip) {
        TripRequestedEvent payload = TripRequestedEvent.builder()
                .tripId(trip.getId().toString())
                .requesterId(trip.getRequesterId())
                .status(trip.getStatus())
                .serviceType(trip.getServiceType())
                .vehicleType(trip.getVehicleType())
                .pickupLat(trip.getPickupLat())
                .pickupLng(trip.getPickupLng())
                .dropoffLat(trip.getDropoffLat())
                .dropoffLng(trip.getDropoffLng())
                .estimatedFare(trip.getEstimatedFare())
                .currency(trip.getCurrency())
                .paymentMethod(trip.getPaymentMethod())
                .scheduledAt(trip.getScheduledAt())
                .requestedAt(clock.instant())
                .build();
        // Kafka only; the requester already has the synchronous response.
        applicationEventPublisher.publishEvent(TripNotification.builder()
                .topic(KafkaTopics.TRIP_REQUESTED)
                .key(trip.getId().toString())
                .payload(payload)
                .build());
    }

    public void offerCreated(Trip trip, DispatchOffer offer) {
        OfferCreatedEvent payload = OfferCreatedEvent.builder()
                .offerId(offer.getId().toString())
                .tripId(trip.getId().toString())
                .workerId(offer.getWorkerId())
                .batchNumber(offer.getBatchNumber())
                .serviceType(trip.getServiceType())
                .vehicleType(trip.getVehicleType())
                .pickupAddress(trip.getPickupAddress())
                .dropoffAddress(trip.getDropoffAddress())
                .distanceKm(offer.getDistanceKm().doubleValue())
                .estimatedArrivalMin(offer.getEstimatedArrivalMin())
                .estimatedFare(trip.getEstimatedFare())
                .currency(trip.getCurrency())
                .sentAt(offer.getSentAt())
                .expiresAt(offer.getExpiresAt())
                .build();
        publish(RealtimeEventType.OFFER_CREATED, trip.getId().toString(), List.of(offer.getWorkerId()),
                KafkaTopics.TRIP_OFFER_CREATED, payload);
    }

    /** The winner and the requester get trip_assigned; losing workers get a status change. */
    public void tripAssigned(Trip trip, String workerId, Collection<String> losingWorkerIds) {
        TripStatusChangedEvent payload = statusPayload(trip, workerId, TripStatus.SEARCHING,
                TripStatus.ASSIGNED, UserRole.WORKER, null);
        publish(RealtimeEventType.TRIP_ASSIGNED, trip.getId().toString(),
                List.of(trip.getRequesterId(), workerId), KafkaTopics.TRIP_ASSIGNED, payload);

        if (!losingWorkerIds.isEmpty()) {
            TripStatusChangedEvent closed = statusPayload(trip, workerId, TripStatus.SEARCHING,
                    TripStatus.ASSIGNED, UserRole.SYSTEM, "OFFER_CLOSED");
            applicationEventPublisher.publishEvent(TripNotification.builder()
                    .recipients(losingWorkerIds)
                    .event(envelope(RealtimeEventType.TRIP_STATUS_CHANGED, trip.getId().toString(), closed))
                    .build());
        }
    }

    public void statusChanged(Trip trip, TripStatus previous, UserRole actorRole, String reason,
                              Collection<String> extraRecipients) {
        TripStatusChangedEvent payload = statusPayload(trip, trip.getWorkerId(), previous,
                trip.getStatus(), actorRole, reason);
        Set<String> recipients = participants(trip, extraRecipients);
        publish(RealtimeEventType.TRIP_STATUS_CHANGED, trip.getId().toString(), recipients,
                KafkaTopics.TRIP_STATUS_CHANGED, payload);
    }

    public void tripCancelled(Trip trip, TripStatus previous, UserRole actorRole, String reason,
                              Collection<String> extraRecipients) {
        TripStatusChangedEvent payload = statusPayload(trip, trip.getWorkerId(), previous,
                TripStatus.CANCELLED, actorRole, reason);
        Set<String> recipients = participants(trip, extraRecipients);
        publish(RealtimeEventType.TRIP_CANCELLED, trip.getId().toString(), recipients,
                KafkaTopics.TRIP_CANCELLED, payload);
    }

    private Set<String> participants(Trip trip, Collection<String> extra) {
        Set<String> recipients = new LinkedHashSet<>();
        recipients.add(trip.getRequesterId());
        if (trip.getWorkerId() != null) {
            recipients.add(trip.getWorkerId());
        }
        recipients.addAll(extra);
        return recipients;
    }

    private TripStatusChangedEvent statusPayload(Trip trip, String workerId, TripStatus previous,
                                                 TripStatus status, UserRole actorRole, String reason) {
        return TripStatusChangedEvent.builder()
                .tripId(trip.getId().toString())
                .requesterId(trip.getRequesterId())
                .workerId(workerId)
                .previousStatus(previous)
                .status(status)
                .actorRole(actorRole)
                .reason(reason)
                .changedAt(clock.instant())
                .build();
    }

    private void publish(RealtimeEventType type, String tripId, Collection<String> recipients,
                         String topic, Object payload) {
        applicationEventPublisher.publishEvent(TripNotification.builder()
                .recipients(new ArrayList<>(recipients))
                .event(envelope(type, tripId, payload))
                .topic(topic)
                .key(tripId)
                .payload(payload)
                .build());
    }

    private RealtimeEvent envelope(RealtimeEventType type, String tripId, Object data) {
        Instant now = clock.instant();
        return RealtimeEvent.builder()
                .type(type)
                .tripId(tripId)
                .occurredAt(now)
                .data(data)
                .build();
    }
}

package com.tripdispatch.dispatch.arbiter;

import com.tripdispatch.dispatch.dispatch.BatchDispatcher;
import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.dispatch.worker.WorkerProfile;
import com.tripdispatch.dispatch.worker.WorkerProfileRepository;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.VehicleType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResponseArbiterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String WORKER = "wrk-1";

    @Mock private TripRepository tripRepository;
    @Mock private DispatchOfferRepository offerRepository;
    @Mock private WorkerProfileRepository workerProfileRepository;
    @Mock private TripLifecycleService lifecycleService;
    @Mock private BatchDispatcher batchDispatcher;
    @Mock private TripEventPublisher eventPublisher;

    private ResponseArbiter arbiter;
    private Trip trip;
    private DispatchOffer offer;

    @BeforeEach
    void setUp() {
        arbiter = new ResponseArbiter(tripRepository, offerRepository, workerProfileRepository, lifecycleService,
                batchDispatcher, eventPublisher, new DispatchMetrics(new SimpleMeterRegistry()),
                Clock.fixed(NOW, ZoneOffset.UTC));
        trip = Trip.builder()
                .id(UUID.randomUUID())
                .requesterId("rider-1")
                .status(TripStatus.SEARCHING)
                .serviceType(ServiceType.RIDE)
                .vehicleType(VehicleType.ECONOMY)
                .searchStartedAt(NOW.minusSeconds(30))
                .build();
        offer = DispatchOffer.builder()
                .id(UUID.randomUUID())
                .tripId(trip.getId())
                .workerId(WORKER)
                .status(OfferStatus.PENDING)
                .expiresAt(NOW.plusSeconds(10))
                .build();
    }

    @Test
    @DisplayName("Accept binds the worker, closes competing offers and notifies everyone")
    void acceptWins() {
        Trip assigned = trip.toBuilder().workerId(WORKER).status(TripStatus.ASSIGNED).build();
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip), Optional.of(assigned));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(1);
        when(offerRepository.acceptIfOpen(offer.getId(), NOW)).thenReturn(1);
        when(offerRepository.findByTripIdAndStatus(trip.getId(), OfferStatus.PENDING))
                .thenReturn(List.of(pendingOffer("wrk-2"), pendingOffer("wrk-3")));

        ResponseOutcome outcome = arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null);

        Trip result = outcome.trip();
        assertThat(result.getStatus()).isEqualTo(TripStatus.ASSIGNED);
        assertThat(result.getWorkerId()).isEqualTo(WORKER);
        assertThat(outcome.withdrawnTripIds()).isEmpty();
        verify(offerRepository).cancelPending(trip.getId(), NOW);
        verify(offerRepository, never()).cancelPendingForWorker(anyString(), any(), any());
        verify(lifecycleService).recordAssignment(trip.getId(), WORKER);
        verify(eventPublisher).tripAssigned(assigned, WORKER, List.of("wrk-2", "wrk-3"));
    }

    @Test
    @DisplayName("Accepting withdraws the worker's pending offers on other trips and reports those trips")
    void acceptWithdrawsOffersElsewhere() {
        UUID otherTrip = UUID.randomUUID();
        Trip assigned = trip.toBuilder().workerId(WORKER).status(TripStatus.ASSIGNED).build();
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip), Optional.of(assigned));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(1);
        when(offerRepository.acceptIfOpen(offer.getId(), NOW)).thenReturn(1);
        when(offerRepository.findPendingTripIdsForWorker(WORKER, trip.getId())).thenReturn(List.of(otherTrip));

        ResponseOutcome outcome = arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null);

        assertThat(outcome.withdrawnTripIds()).containsExactly(otherTrip);
        verify(offerRepository).cancelPendingForWorker(WORKER, trip.getId(), NOW);
    }

    @Test
    @DisplayName("A worker already on a live trip cannot accept a second one")
    void busyWorkerRejected() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        eligibleWorker();
        when(tripRepository.existsByWorkerIdAndStatusIn(WORKER, TripStatus.ON_TRIP)).thenReturn(true);

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.INELIGIBLE_WORKER);
        verify(tripRepository, never()).bindWorker(any(), anyString(), any());
        verify(offerRepository, never()).acceptIfOpen(any(), any());
    }

    @Test
    @DisplayName("A bind refused while the trip is still free means the worker was bound elsewhere first")
    void bindRefusedForBusyWorker() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(0);

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.INELIGIBLE_WORKER);
        verify(offerRepository, never()).acceptIfOpen(any(), any());
    }

    @Test
    @DisplayName("Losing the bind to another worker reports ALREADY_ASSIGNED")
    void lostBindRace() {
        Trip takenByOther = trip.toBuilder().workerId("wrk-2").status(TripStatus.ASSIGNED).build();
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip), Optional.of(takenByOther));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(0);

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.ALREADY_ASSIGNED);
        verify(offerRepository, never()).acceptIfOpen(any(), any());
    }

    @Test
    @DisplayName("Losing the bind to a cancellation reports OFFER_EXPIRED")
    void lostBindToCancellation() {
        Trip cancelled = trip.toBuilder().status(TripStatus.CANCELLED).build();
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip), Optional.of(cancelled));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(0);

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.OFFER_EXPIRED);
    }

    @Test
    @DisplayName("An offer past its expiry cannot be accepted")
    void expiredOffer() {
        offer.setExpiresAt(NOW.minusSeconds(1));
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.OFFER_EXPIRED);
        verify(tripRepository, never()).bindWorker(any(), anyString(), any());
    }

    @Test
    @DisplayName("Offer closed between bind and accept update rolls the accept back as OFFER_EXPIRED")
    void offerClosedAfterBind() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(tripRepository.bindWorker(trip.getId(), WORKER, NOW)).thenReturn(1);
        when(offerRepository.acceptIfOpen(offer.getId(), NOW)).thenReturn(0);

        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.OFFER_EXPIRED);
        verify(offerRepository, never()).cancelPending(any(), any());
    }

    @Test
    @DisplayName("Unknown trips, ineligible workers and workers without an offer are rejected in that order")
    void rejectionOrder() {
        UUID unknown = UUID.randomUUID();
        when(tripRepository.findById(unknown)).thenReturn(Optional.empty());
        assertFails(() -> arbiter.respond(unknown, WORKER, OfferDecision.ACCEPT, null), ErrorCode.TRIP_NOT_FOUND);

        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        when(workerProfileRepository.findById(WORKER)).thenReturn(Optional.of(WorkerProfile.builder()
                .workerId(WORKER).vehicleType(VehicleType.ECONOMY).eligible(true)
                .serviceTypes(Set.of(ServiceType.DELIVERY)).build()));
        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.INELIGIBLE_WORKER);

        eligibleWorker();
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.empty());
        assertFails(() -> arbiter.respond(trip.getId(), WORKER, OfferDecision.ACCEPT, null), ErrorCode.INELIGIBLE_WORKER);
    }

    @Test
    @DisplayName("Declining the last pending offer advances dispatch immediately")
    void declineLastOfferAdvances() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(offerRepository.declineIfPending(offer.getId(), "too far", NOW)).thenReturn(1);
        when(offerRepository.existsByTripIdAndStatus(trip.getId(), OfferStatus.PENDING)).thenReturn(false);

        arbiter.respond(trip.getId(), WORKER, OfferDecision.DECLINE, "too far");

        verify(batchDispatcher).advance(trip.getId());
    }

    @Test
    @DisplayName("Declining while others are still pending leaves the batch alone")
    void declineWithOthersPending() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        when(offerRepository.findByTripIdAndWorkerId(trip.getId(), WORKER)).thenReturn(Optional.of(offer));
        when(offerRepository.declineIfPending(offer.getId(), null, NOW)).thenReturn(1);
        when(offerRepository.existsByTripIdAndStatus(trip.getId(), OfferStatus.PENDING)).thenReturn(true);

        arbiter.respond(trip.getId(), WORKER, OfferDecision.DECLINE, null);

        verify(batchDispatcher, never()).advance(any());
    }

    private void eligibleWorker() {
        when(workerProfileRepository.findById(WORKER)).thenReturn(Optional.of(WorkerProfile.builder()
                .workerId(WORKER)
                .vehicleType(VehicleType.ECONOMY)
                .eligible(true)
                .serviceTypes(Set.of(ServiceType.RIDE))
                .build()));
    }

    private DispatchOffer pendingOffer(String workerId) {
        return DispatchOffer.builder()
                .id(UUID.randomUUID())
                .tripId(trip.getId())
                .workerId(workerId)
                .status(OfferStatus.PENDING)
                .expiresAt(NOW.plusSeconds(10))
                .build();
    }

    private static void assertFails(ThrowingCallable call, ErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getErrorCode())
                .isEqualTo(code);
    }
}

package com.tripdispatch.dispatch.ledger;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.ledger.entity.LedgerEntry;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.model.HoldResult;
import com.tripdispatch.dispatch.trip.model.TripDraft;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.VehicleType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentHoldCoordinatorTest {

    private static final String RIDER = "rider-1";

    @Mock private TripRepository tripRepository;
    @Mock private LedgerService ledgerService;
    @Mock private TripLifecycleService lifecycleService;
    @Mock private TripEventPublisher eventPublisher;

    private PaymentHoldCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new PaymentHoldCoordinator(tripRepository, ledgerService, lifecycleService, eventPublisher,
                new DispatchMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Wallet trip: account touched, balance checked, trip inserted, hold placed and linked")
    void walletTripGetsHold() {
        UUID holdId = UUID.randomUUID();
        stubActiveTripCheck(false);
        when(ledgerService.available(RIDER, "NGN")).thenReturn(new BigDecimal("1000.00"));
        stubInsert();
        when(ledgerService.placeHold(eq(RIDER), any(UUID.class), eq(new BigDecimal("500.00")), eq("NGN")))
                .thenReturn(LedgerEntry.builder().id(holdId).build());
        stubTransition();

        HoldResult result = coordinator.createTripWithHold(RIDER, draft(PaymentMethod.WALLET, null), "key-1");

        assertThat(result.replayed()).isFalse();
        assertThat(result.holdId()).isEqualTo(holdId);
        assertThat(result.trip().getStatus()).isEqualTo(TripStatus.SEARCHING);
        assertThat(result.trip().getHoldEntryId()).isEqualTo(holdId);

        InOrder order = inOrder(ledgerService, tripRepository);
        order.verify(ledgerService).touch(RIDER);
        order.verify(tripRepository).existsByRequesterIdAndStatusIn(RIDER, TripStatus.ACTIVE);
        order.verify(ledgerService).available(RIDER, "NGN");
        order.verify(tripRepository).save(any(Trip.class));
        verify(eventPublisher).tripRequested(result.trip());
    }

    @Test
    @DisplayName("Cash trip skips the balance check and the hold")
    void cashTripHasNoHold() {
        stubActiveTripCheck(false);
        stubInsert();
        stubTransition();

        HoldResult result = coordinator.createTripWithHold(RIDER, draft(PaymentMethod.CASH, null), null);

        assertThat(result.holdId()).isNull();
        verify(ledgerService, never()).available(anyString(), anyString());
        verify(ledgerService, never()).placeHold(anyString(), any(), any(), anyString());
    }

    @Test
    @DisplayName("A scheduled trip lands in SCHEDULED instead of SEARCHING")
    void scheduledTrip() {
        stubActiveTripCheck(false);
        stubInsert();
        stubTransition();

        HoldResult result = coordinator.createTripWithHold(RIDER,
                draft(PaymentMethod.CASH, Instant.parse("2026-03-02T08:00:00Z")), null);

        assertThat(result.trip().getStatus()).isEqualTo(TripStatus.SCHEDULED);
        verify(lifecycleService).transition(any(Trip.class), eq(TripStatus.SCHEDULED), any(), isNull(), isNull(), isNull());
    }

    @Test
    @DisplayName("A known idempotency key replays the stored trip without side effects")
    void idempotentReplay() {
        Trip existing = Trip.builder().id(UUID.randomUUID()).holdEntryId(UUID.randomUUID())
                .status(TripStatus.SEARCHING).build();
        when(tripRepository.findByRequesterIdAndIdempotencyKey(RIDER, "key-1")).thenReturn(Optional.of(existing));

        HoldResult result = coordinator.createTripWithHold(RIDER, draft(PaymentMethod.WALLET, null), "key-1");

        assertThat(result.replayed()).isTrue();
        assertThat(result.trip()).isSameAs(existing);
        assertThat(result.holdId()).isEqualTo(existing.getHoldEntryId());
        verify(ledgerService, never()).touch(anyString());
        verify(tripRepository, never()).save(any());
    }

    @Test
    @DisplayName("A key already used by another requester does not replay their trip")
    void keyFromAnotherRequesterCreatesOwnTrip() {
        when(tripRepository.findByRequesterIdAndIdempotencyKey(RIDER, "shared-key")).thenReturn(Optional.empty());
        stubActiveTripCheck(false);
        stubInsert();
        stubTransition();

        HoldResult result = coordinator.createTripWithHold(RIDER, draft(PaymentMethod.CASH, null), "shared-key");

        assertThat(result.replayed()).isFalse();
        assertThat(result.trip().getRequesterId()).isEqualTo(RIDER);
        assertThat(result.trip().getIdempotencyKey()).isEqualTo("shared-key");
        verify(tripRepository).findByRequesterIdAndIdempotencyKey(RIDER, "shared-key");
        verify(tripRepository).save(any(Trip.class));
    }

    @Test
    @DisplayName("A requester with an active trip is rejected with ACTIVE_TRIP_EXISTS")
    void activeTripExists() {
        stubActiveTripCheck(true);

        assertThatThrownBy(() -> coordinator.createTripWithHold(RIDER, draft(PaymentMethod.WALLET, null), null))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getErrorCode())
                .isEqualTo(ErrorCode.ACTIVE_TRIP_EXISTS);
        verify(tripRepository, never()).save(any());
    }

    @Test
    @DisplayName("A wallet below the estimated fare is rejected with INSUFFICIENT_BALANCE")
    void insufficientBalance() {
        stubActiveTripCheck(false);
        when(ledgerService.available(RIDER, "NGN")).thenReturn(new BigDecimal("499.99"));

        assertThatThrownBy(() -> coordinator.createTripWithHold(RIDER, draft(PaymentMethod.WALLET, null), null))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        verify(tripRepository, never()).save(any());
    }

    private void stubActiveTripCheck(boolean active) {
        when(tripRepository.existsByRequesterIdAndStatusIn(RIDER, TripStatus.ACTIVE)).thenReturn(active);
    }

    private void stubInsert() {
        when(tripRepository.save(any(Trip.class))).thenAnswer(inv -> {
            Trip trip = inv.getArgument(0);
            trip.setId(UUID.randomUUID());
            return trip;
        });
    }

    private void stubTransition() {
        when(lifecycleService.transition(any(Trip.class), any(TripStatus.class), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    Trip trip = inv.getArgument(0);
                    trip.setStatus(inv.getArgument(1));
                    return trip;
                });
    }

    private static TripDraft draft(PaymentMethod method, Instant scheduledAt) {
        return TripDraft.builder()
                .serviceType(ServiceType.RIDE)
                .vehicleType(VehicleType.ECONOMY)
                .pickupLat(6.5244).pickupLng(3.3792).pickupAddress("Marina")
                .dropoffLat(6.6018).dropoffLng(3.3515).dropoffAddress("Ikeja")
                .paymentMethod(method)
                .currency("NGN")
                .scheduledAt(scheduledAt)
                .estimatedDistanceKm(new BigDecimal("9.000"))
                .estimatedDurationMin(18)
                .estimatedFare(new BigDecimal("500.00"))
                .build();
    }
}

package com.tripdispatch.dispatch.ledger;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryType;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TipServiceTest {

    private static final String RIDER = "rider-1";
    private static final String WORKER = "wrk-1";

    @Mock private TripRepository tripRepository;
    @Mock private LedgerService ledgerService;

    private TipService tipService;
    private Trip trip;

    @BeforeEach
    void setUp() {
        tipService = new TipService(tripRepository, ledgerService, new TripPolicyProperties());
        trip = Trip.builder()
                .id(UUID.randomUUID())
                .requesterId(RIDER)
                .workerId(WORKER)
                .status(TripStatus.COMPLETED)
                .currency("NGN")
                .build();
    }

    @Test
    @DisplayName("A tip debits the requester and credits the worker under tip_{tripId}")
    void tipMovesMoney() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        when(ledgerService.available(RIDER, "NGN")).thenReturn(new BigDecimal("1000"));
        when(tripRepository.save(any(Trip.class))).thenAnswer(inv -> inv.getArgument(0));

        Trip tipped = tipService.addTip(trip.getId(), RIDER, new BigDecimal("200"));

        String reference = "tip_" + trip.getId();
        assertThat(tipped.getTipAmount()).isEqualByComparingTo("200.00");
        verify(ledgerService).append(eq(RIDER), eq(trip.getId()), eq(LedgerEntryType.DEBIT),
                eq(new BigDecimal("200.00")), eq("NGN"), eq(reference), isNull(), any());
        verify(ledgerService).append(eq(WORKER), eq(trip.getId()), eq(LedgerEntryType.CREDIT),
                eq(new BigDecimal("200.00")), eq("NGN"), eq(reference), isNull(), any());
    }

    @Test
    @DisplayName("Amounts outside the configured range are rejected before any lookup")
    void outOfRange() {
        assertRejected(() -> tipService.addTip(trip.getId(), RIDER, new BigDecimal("10")), ErrorCode.TIP_REJECTED);
        assertRejected(() -> tipService.addTip(trip.getId(), RIDER, new BigDecimal("50001")), ErrorCode.TIP_REJECTED);
    }

    @Test
    @DisplayName("Only the requester of a completed trip may tip, and only once")
    void eligibility() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));

        assertRejected(() -> tipService.addTip(trip.getId(), "someone-else", new BigDecimal("100")),
                ErrorCode.NOT_TRIP_PARTICIPANT);

        trip.setStatus(TripStatus.IN_PROGRESS);
        assertRejected(() -> tipService.addTip(trip.getId(), RIDER, new BigDecimal("100")), ErrorCode.TIP_REJECTED);

        trip.setStatus(TripStatus.COMPLETED);
        trip.setTipAmount(new BigDecimal("100"));
        assertRejected(() -> tipService.addTip(trip.getId(), RIDER, new BigDecimal("100")), ErrorCode.TIP_REJECTED);
    }

    @Test
    @DisplayName("The wallet must cover the tip")
    void insufficientBalance() {
        when(tripRepository.findById(trip.getId())).thenReturn(Optional.of(trip));
        when(ledgerService.available(RIDER, "NGN")).thenReturn(new BigDecimal("99.99"));

        assertRejected(() -> tipService.addTip(trip.getId(), RIDER, new BigDecimal("100")),
                ErrorCode.INSUFFICIENT_BALANCE);
    }

    private static void assertRejected(ThrowingCallable call, ErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getErrorCode())
                .isEqualTo(code);
    }
}

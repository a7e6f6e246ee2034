package com.tripdispatch.dispatch.ledger;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryType;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Post-trip tips, moved wallet to wallet: a DEBIT on the requester and a
 * CREDIT to the worker, both referenced {@code tip_<tripId>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TipService {

    private final TripRepository tripRepository;
    private final LedgerService ledgerService;
    private final TripPolicyProperties tripPolicyProperties;

    @Retryable(retryFor = ConcurrencyFailureException.class, maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public Trip addTip(UUID tripId, String requesterId, BigDecimal amount) {
        BigDecimal tip = amount.setScale(2, RoundingMode.HALF_UP);
        TripPolicyProperties.Tip limits = tripPolicyProperties.getTip();
        if (tip.compareTo(limits.getMin()) < 0 || tip.compareTo(limits.getMax()) > 0) {
            throw new DispatchException(ErrorCode.TIP_REJECTED,
                    "Tip must be between " + limits.getMin() + " and " + limits.getMax());
        }

        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new DispatchException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found"));
        if (!requesterId.equals(trip.getRequesterId())) {
            throw new DispatchException(ErrorCode.NOT_TRIP_PARTICIPANT,
                    "Only the requester may tip on trip " + tripId);
        }
        if (trip.getStatus() != TripStatus.COMPLETED || trip.getWorkerId() == null) {
            throw new DispatchException(ErrorCode.TIP_REJECTED, "Trip " + tripId + " is not a completed trip");
        }
        String reference = "tip_" + tripId;
        if (trip.getTipAmount() != null
                || ledgerService.hasEntry(requesterId, reference, LedgerEntryType.DEBIT)) {
            throw new DispatchException(ErrorCode.TIP_REJECTED, "Trip " + tripId + " has already been tipped");
        }

        ledgerService.touch(requesterId);
        BigDecimal available = ledgerService.available(requesterId, trip.getCurrency());
        if (available.compareTo(tip) < 0) {
            throw new DispatchException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Wallet balance " + available + " does not cover a tip of " + tip);
        }

        ledgerService.append(requesterId, tripId, LedgerEntryType.DEBIT, tip, trip.getCurrency(),
                reference, null, "Tip for trip");
        ledgerService.append(trip.getWorkerId(), tripId, LedgerEntryType.CREDIT, tip, trip.getCurrency(),
                reference, null, "Tip received");
        trip.setTipAmount(tip);
        Trip saved = tripRepository.save(trip);

        log.info("Tip of {} {} added to trip {} for worker {}", tip, trip.getCurrency(), tripId, trip.getWorkerId());
        return saved;
    }
}

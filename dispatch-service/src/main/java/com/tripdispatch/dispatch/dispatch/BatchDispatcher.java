package com.tripdispatch.dispatch.dispatch;

import com.tripdispatch.dispatch.candidate.CandidateSelector;
import com.tripdispatch.dispatch.candidate.DispatchCandidate;
import com.tripdispatch.dispatch.config.DispatchProperties;
import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.AdvanceOutcome;
import com.tripdispatch.dispatch.dispatch.model.DispatchStats;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.lifecycle.Actor;
import com.tripdispatch.dispatch.lifecycle.TripLifecycleService;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.notification.TripEventPublisher;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drives a searching trip from one offer batch to the next.
 *
 * Dispatch flow for {@link #advance}:
 *  1. Skip unless the trip is SEARCHING with no PENDING offer
 *  2. Exhaust when the search has run past the timeout
 *  3. Ask the selector for unseen candidates, escalating while none qualify
 *  4. Claim the next batch number (compare-and-set on current_batch)
 *  5. Persist one PENDING offer per candidate and notify each worker
 *
 * Exhausted trips are cancelled with reason NO_MATCH and their hold reversed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchDispatcher {

    public static final String NO_MATCH = "NO_MATCH";

    private final TripRepository tripRepository;
    private final DispatchOfferRepository offerRepository;
    private final CandidateSelector candidateSelector;
    private final TripLifecycleService lifecycleService;
    private final TripEventPublisher eventPublisher;
    private final DispatchProperties dispatchProperties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Transactional
    public AdvanceOutcome advance(UUID tripId) {
        Trip trip = tripRepository.findById(tripId).orElse(null);
        if (trip == null || trip.getStatus() != TripStatus.SEARCHING) {
            return AdvanceOutcome.IDLE;
        }
        if (offerRepository.existsByTripIdAndStatus(tripId, OfferStatus.PENDING)) {
            return AdvanceOutcome.AWAITING_RESPONSES;
        }

        Instant now = clock.instant();
        if (trip.getSearchStartedAt() != null
                && now.isAfter(trip.getSearchStartedAt().plus(dispatchProperties.getSearchTimeout()))) {
            log.info("Trip {} searched longer than {}, giving up", tripId, dispatchProperties.getSearchTimeout());
            return exhaust(trip);
        }

        Set<String> alreadyOffered = offerRepository.findOfferedWorkerIds(tripId);
        int level = trip.getEscalationLevel();
        List<List<DispatchCandidate>> batches = candidateSelector.select(trip, level, alreadyOffered);
        while (batches.isEmpty() && level < dispatchProperties.getMaxEscalations()) {
            level++;
            metrics.recordEscalation();
            log.info("Trip {} escalating to level {} (radius {} km)", tripId, level,
                    dispatchProperties.radiusForLevel(level));
            batches = candidateSelector.select(trip, level, alreadyOffered);
        }
        if (batches.isEmpty()) {
            return exhaust(trip);
        }

        int expectedBatch = trip.getCurrentBatch();
        int batchNumber = expectedBatch + 1;
        if (tripRepository.advanceBatch(tripId, expectedBatch, batchNumber, level, now) == 0) {
            log.debug("Batch {} of trip {} claimed elsewhere", batchNumber, tripId);
            return AdvanceOutcome.CONTENDED;
        }
        trip.setCurrentBatch(batchNumber);
        trip.setEscalationLevel(level);

        Instant expiresAt = now.plus(dispatchProperties.getOfferWindow());
        List<DispatchCandidate> batch = batches.get(0);
        for (DispatchCandidate candidate : batch) {
            DispatchOffer offer = offerRepository.save(DispatchOffer.builder()
                    .tripId(tripId)
                    .workerId(candidate.workerId())
                    .status(OfferStatus.PENDING)
                    .batchNumber(batchNumber)
                    .escalationLevel(level)
                    .distanceKm(BigDecimal.valueOf(candidate.distanceKm()).setScale(3, RoundingMode.HALF_UP))
                    .estimatedArrivalMin(candidate.estimatedArrivalMin())
                    .sentAt(now)
                    .expiresAt(expiresAt)
                    .build());
            eventPublisher.offerCreated(trip, offer);
        }
        metrics.recordOffersIssued(batch.size());
        log.info("Trip {} batch {} sent to {} workers at level {}", tripId, batchNumber, batch.size(), level);
        return AdvanceOutcome.BATCH_ISSUED;
    }

    @Transactional(readOnly = true)
    public DispatchStats stats(Trip trip) {
        List<DispatchOffer> offers = offerRepository.findByTripIdOrderByBatchNumberAscSentAtAsc(trip.getId());
        Map<OfferStatus, Long> byStatus = new EnumMap<>(OfferStatus.class);
        byStatus.putAll(offers.stream()
                .collect(Collectors.groupingBy(DispatchOffer::getStatus, Collectors.counting())));

        return DispatchStats.builder()
                .tripId(trip.getId())
                .workersContacted((int) offers.stream().map(DispatchOffer::getWorkerId).distinct().count())
                .batchesIssued(trip.getCurrentBatch())
                .escalationLevel(trip.getEscalationLevel())
                .offersByStatus(byStatus)
                .averageDistanceKm(offers.isEmpty() ? null : offers.stream()
                        .mapToDouble(o -> o.getDistanceKm().doubleValue()).average().orElse(0))
                .averageArrivalMin(offers.isEmpty() ? null : offers.stream()
                        .mapToInt(DispatchOffer::getEstimatedArrivalMin).average().orElse(0))
                .build();
    }

    private AdvanceOutcome exhaust(Trip trip) {
        lifecycleService.cancelTrip(trip, Actor.SYSTEM, NO_MATCH);
        metrics.recordNoMatch();
        log.warn("{}: trip {} found no worker after {} batches", ErrorCode.NO_MATCH_FOUND,
                trip.getId(), trip.getCurrentBatch());
        return AdvanceOutcome.EXHAUSTED;
    }
}

package com.tripdispatch.dispatch.dispatch;

import com.tripdispatch.dispatch.dispatch.entity.DispatchOffer;
import com.tripdispatch.dispatch.dispatch.model.OfferStatus;
import com.tripdispatch.dispatch.dispatch.model.SweepResult;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Periodic offer timeout handling. Expires overdue offers and advances every
 * trip left without a pending offer, which also picks up trips orphaned by a
 * crash. Re-running a sweep over the same state changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferExpirySweeper {

    static final String LOCK_KEY = "lock:dispatch-sweep";
    private static final long LOCK_LEASE_SECONDS = 30;

    private final DispatchOfferRepository offerRepository;
    private final TripRepository tripRepository;
    private final BatchDispatcher batchDispatcher;
    private final RedissonClient redissonClient;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.sweep.interval-ms:5000}",
               initialDelayString = "${dispatch.sweep.initial-delay-ms:5000}")
    public void sweep() {
        RLock lock;
        boolean acquired;
        try {
            lock = redissonClient.getLock(LOCK_KEY);
            acquired = lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring sweep lock");
            return;
        } catch (RuntimeException e) {
            // Sweeps are idempotent, so running unguarded only costs duplicate work.
            log.warn("Sweep lock unavailable, sweeping without it: {}", e.getMessage());
            sweepOnce();
            return;
        }

        if (!acquired) {
            log.debug("Another instance is sweeping");
            return;
        }
        try {
            sweepOnce();
        } finally {
            try {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            } catch (RuntimeException e) {
                log.warn("Failed to release sweep lock: {}", e.getMessage());
            }
        }
    }

    public SweepResult sweepOnce() {
        Instant now = clock.instant();
        Set<UUID> tripIds = new LinkedHashSet<>();
        int expired = 0;
        int failures = 0;

        for (DispatchOffer offer : offerRepository.findDue(OfferStatus.PENDING, now)) {
            if (offerRepository.expireIfPending(offer.getId(), now) == 1) {
                expired++;
                metrics.recordOfferExpired();
                tripIds.add(offer.getTripId());
            }
        }
        tripIds.addAll(tripRepository.findSearchingWithoutPendingOffers(TripStatus.SEARCHING, OfferStatus.PENDING));

        int advanced = 0;
        for (UUID tripId : tripIds) {
            try {
                batchDispatcher.advance(tripId);
                advanced++;
            } catch (RuntimeException e) {
                failures++;
                log.error("Sweep could not advance trip {}: {}", tripId, e.getMessage(), e);
            }
        }

        if (expired > 0 || failures > 0) {
            log.info("Sweep: {} offers expired, {} trips advanced, {} failures", expired, advanced, failures);
        }
        return new SweepResult(expired, advanced, failures);
    }
}

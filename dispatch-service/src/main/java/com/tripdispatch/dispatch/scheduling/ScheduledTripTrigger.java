package com.tripdispatch.dispatch.scheduling;

import com.tripdispatch.dispatch.dispatch.BatchDispatcher;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Promotes scheduled trips whose time has come and hands them to dispatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledTripTrigger {

    static final String LOCK_KEY = "lock:scheduled-trigger";
    private static final long LOCK_LEASE_SECONDS = 120;

    private final TripRepository tripRepository;
    private final ScheduledTripPromoter promoter;
    private final BatchDispatcher batchDispatcher;
    private final RedissonClient redissonClient;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${scheduling.trigger.interval-ms:60000}",
               initialDelayString = "${scheduling.trigger.initial-delay-ms:30000}")
    public void trigger() {
        RLock lock;
        boolean acquired;
        try {
            lock = redissonClient.getLock(LOCK_KEY);
            acquired = lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while acquiring scheduled-trigger lock");
            return;
        } catch (RuntimeException e) {
            log.warn("Scheduled-trigger lock unavailable, running without it: {}", e.getMessage());
            promoteDue();
            return;
        }

        if (!acquired) {
            log.debug("Another instance is promoting scheduled trips");
            return;
        }
        try {
            promoteDue();
        } finally {
            try {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            } catch (RuntimeException e) {
                log.warn("Failed to release scheduled-trigger lock: {}", e.getMessage());
            }
        }
    }

    public Map<PromotionOutcome, Integer> promoteDue() {
        List<UUID> due = tripRepository.findDueScheduled(TripStatus.SCHEDULED, clock.instant());
        Map<PromotionOutcome, Integer> outcomes = new EnumMap<>(PromotionOutcome.class);
        for (UUID tripId : due) {
            try {
                PromotionOutcome outcome = promoter.promote(tripId);
                outcomes.merge(outcome, 1, Integer::sum);
                if (outcome == PromotionOutcome.PROMOTED) {
                    batchDispatcher.advance(tripId);
                }
            } catch (RuntimeException e) {
                log.error("Could not promote scheduled trip {}: {}", tripId, e.getMessage(), e);
            }
        }
        if (!due.isEmpty()) {
            log.info("Scheduled trigger: {} due, outcomes={}", due.size(), outcomes);
        }
        return outcomes;
    }
}

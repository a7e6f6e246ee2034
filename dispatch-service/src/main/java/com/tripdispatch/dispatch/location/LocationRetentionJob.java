package com.tripdispatch.dispatch.location;

import com.tripdispatch.dispatch.config.LocationProperties;
import com.tripdispatch.dispatch.location.repository.WorkerLocationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class LocationRetentionJob {

    private final WorkerLocationRepository locationRepository;
    private final InMemoryLocationIndex localIndex;
    private final LocationProperties locationProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${location.retention-job.interval-ms:3600000}",
               initialDelayString = "${location.retention-job.initial-delay-ms:60000}")
    public void prune() {
        Instant now = clock.instant();
        try {
            int deleted = locationRepository.deleteOlderThan(now.minus(locationProperties.getRetention()));
            int evicted = localIndex.evictOlderThan(now.minus(locationProperties.getLivenessWindow()));
            log.info("Location retention: {} rows deleted, {} stale index entries evicted", deleted, evicted);
        } catch (RuntimeException e) {
            log.error("Location retention run failed: {}", e.getMessage(), e);
        }
    }
}

package com.tripdispatch.dispatch.location;

import com.tripdispatch.dispatch.config.LocationProperties;
import com.tripdispatch.dispatch.location.entity.WorkerLocation;
import com.tripdispatch.dispatch.location.model.LocationReport;
import com.tripdispatch.dispatch.location.model.NearbyWorker;
import com.tripdispatch.dispatch.location.model.WorkerPosition;
import com.tripdispatch.dispatch.location.repository.WorkerLocationRepository;
import com.tripdispatch.shared.events.WorkerLocationReportedEvent;
import com.tripdispatch.shared.util.GeoUtil;
import com.tripdispatch.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Worker positions. Every report is persisted, mirrored into the local H3
 * index and pushed to the Redis GEO set; proximity queries read Redis and
 * fall back to the local index when Redis is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationRegistry {

    static final String GEO_KEY = "workers:geo";
    static final String WORKER_HASH_PREFIX = "worker:";

    private final WorkerLocationRepository locationRepository;
    private final InMemoryLocationIndex localIndex;
    private final StringRedisTemplate redisTemplate;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final LocationProperties locationProperties;
    private final Clock clock;

    public WorkerLocation report(String workerId, LocationReport report) {
        Instant now = clock.instant();
        WorkerLocation location = locationRepository.save(WorkerLocation.builder()
                .workerId(workerId)
                .lat(report.getLatitude())
                .lng(report.getLongitude())
                .heading(report.getHeading())
                .speedKmh(report.getSpeedKmh())
                .accuracyM(report.getAccuracyM())
                .online(report.isOnline())
                .available(report.isAvailable())
                .capturedAt(now)
                .build());

        localIndex.update(new WorkerPosition(workerId, location.getLat(), location.getLng(),
                location.isOnline(), location.isAvailable(), now));
        writeRedis(location);
        publish(location);

        log.debug("Location for worker {} at ({},{}) online={} available={}",
                workerId, location.getLat(), location.getLng(), location.isOnline(), location.isAvailable());
        return location;
    }

    /**
     * Online, available workers reported within the liveness window, within
     * {@code radiusKm} of the point and passing {@code filter}, nearest first.
     * Never fails: a Redis outage degrades to the local index.
     */
    public List<NearbyWorker> near(double lat, double lng, double radiusKm, Predicate<String> filter) {
        Instant freshSince = clock.instant().minus(locationProperties.getLivenessWindow());
        try {
            return nearFromRedis(lat, lng, radiusKm, freshSince, filter);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable for proximity query, serving possibly stale local index: {}", e.getMessage());
            return localIndex.near(lat, lng, radiusKm, freshSince, filter, locationProperties.getNearbyLimit());
        }
    }

    public Optional<WorkerPosition> latest(String workerId) {
        Optional<WorkerPosition> local = localIndex.get(workerId);
        if (local.isPresent()) {
            return local;
        }
        return locationRepository.findFirstByWorkerIdOrderByCapturedAtDesc(workerId)
                .map(l -> new WorkerPosition(l.getWorkerId(), l.getLat(), l.getLng(),
                        l.isOnline(), l.isAvailable(), l.getCapturedAt()));
    }

    private List<NearbyWorker> nearFromRedis(double lat, double lng, double radiusKm, Instant freshSince,
                                             Predicate<String> filter) {
        Circle circle = new Circle(new Point(lng, lat), new Distance(radiusKm, Metrics.KILOMETERS));
        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo().radius(
                GEO_KEY,
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                        .includeDistance()
                        .includeCoordinates()
                        .sortAscending());
        if (results == null) {
            return List.of();
        }

        // the cap applies to workers that pass every check, not to raw GEO members
        int limit = locationProperties.getNearbyLimit();
        List<NearbyWorker> nearby = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : results.getContent()) {
            if (nearby.size() >= limit) {
                break;
            }
            String workerId = result.getContent().getName();
            if (!filter.test(workerId)) {
                continue;
            }
            Map<Object, Object> meta = redisTemplate.opsForHash().entries(WORKER_HASH_PREFIX + workerId);
            if (meta.isEmpty()) {
                // hash TTL lapsed: the worker went silent
                redisTemplate.opsForGeo().remove(GEO_KEY, workerId);
                continue;
            }
            if (!"true".equals(meta.get("online")) || !"true".equals(meta.get("available"))) {
                continue;
            }
            Instant capturedAt = Instant.parse((String) meta.get("capturedAt"));
            if (capturedAt.isBefore(freshSince)) {
                continue;
            }
            Point point = result.getContent().getPoint();
            nearby.add(new NearbyWorker(workerId, point.getY(), point.getX(),
                    result.getDistance().getValue(), capturedAt));
        }
        return nearby;
    }

    private void writeRedis(WorkerLocation location) {
        String hashKey = WORKER_HASH_PREFIX + location.getWorkerId();
        Map<String, String> meta = new HashMap<>();
        meta.put("lat", String.valueOf(location.getLat()));
        meta.put("lng", String.valueOf(location.getLng()));
        meta.put("online", String.valueOf(location.isOnline()));
        meta.put("available", String.valueOf(location.isAvailable()));
        meta.put("capturedAt", location.getCapturedAt().toString());
        try {
            redisTemplate.opsForGeo().add(GEO_KEY, new Point(location.getLng(), location.getLat()),
                    location.getWorkerId());
            redisTemplate.opsForHash().putAll(hashKey, meta);
            redisTemplate.expire(hashKey, locationProperties.getLivenessWindow());
        } catch (DataAccessException e) {
            log.warn("Redis write for worker {} failed, local index still updated: {}",
                    location.getWorkerId(), e.getMessage());
        }
    }

    private void publish(WorkerLocation location) {
        WorkerLocationReportedEvent event = WorkerLocationReportedEvent.builder()
                .workerId(location.getWorkerId())
                .latitude(location.getLat())
                .longitude(location.getLng())
                .geoCell(GeoUtil.locationCell(location.getLat(), location.getLng()))
                .online(location.isOnline())
                .available(location.isAvailable())
                .capturedAt(location.getCapturedAt())
                .build();
        try {
            kafkaTemplate.send(KafkaTopics.WORKER_LOCATION_REPORTED, location.getWorkerId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Location event for worker {} not published: {}",
                                    location.getWorkerId(), ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Location event for worker {} not published: {}", location.getWorkerId(), e.getMessage());
        }
    }
}

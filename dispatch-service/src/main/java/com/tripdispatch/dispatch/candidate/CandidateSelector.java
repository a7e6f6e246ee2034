package com.tripdispatch.dispatch.candidate;

import com.tripdispatch.dispatch.config.DispatchProperties;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.location.LocationRegistry;
import com.tripdispatch.dispatch.location.model.NearbyWorker;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.dispatch.worker.WorkerProfile;
import com.tripdispatch.dispatch.worker.WorkerProfileRepository;
import com.tripdispatch.shared.enums.TripStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the ordered candidate list for one escalation level of a trip's
 * search, split into offer batches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateSelector {

    private final LocationRegistry locationRegistry;
    private final WorkerProfileRepository workerProfileRepository;
    private final TripRepository tripRepository;
    private final DispatchOfferRepository offerRepository;
    private final DispatchProperties dispatchProperties;
    private final Clock clock;

    public List<List<DispatchCandidate>> select(Trip trip, int escalationLevel, Set<String> excludedWorkerIds) {
        RelaxationTier tier = RelaxationTier.forLevel(escalationLevel);
        double radiusKm = dispatchProperties.radiusForLevel(escalationLevel);
        Instant now = clock.instant();

        List<NearbyWorker> nearby = locationRegistry.near(trip.getPickupLat(), trip.getPickupLng(), radiusKm,
                workerId -> !excludedWorkerIds.contains(workerId));
        if (nearby.isEmpty()) {
            log.debug("Trip {} level {}: nobody within {} km", trip.getId(), escalationLevel, radiusKm);
            return List.of();
        }

        Set<String> ids = nearby.stream().map(NearbyWorker::workerId).collect(Collectors.toSet());
        Map<String, WorkerProfile> profiles = workerProfileRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(WorkerProfile::getWorkerId, Function.identity()));
        Set<String> busy = new HashSet<>(tripRepository.findBusyWorkers(ids, TripStatus.ON_TRIP));
        Map<String, Long> openOffers = openOffersByWorker(ids, trip, now);
        int cap = tier.concurrencyCap(dispatchProperties.getMaxConcurrentOffers());

        List<DispatchCandidate> candidates = new ArrayList<>();
        for (NearbyWorker worker : nearby) {
            WorkerProfile profile = profiles.get(worker.workerId());
            if (profile == null || !profile.canTake(trip.getServiceType())) {
                continue;
            }
            if (!tier.vehicleMatches(profile.getVehicleType(), trip.getVehicleType())) {
                continue;
            }
            if (busy.contains(worker.workerId())) {
                continue;
            }
            if (openOffers.getOrDefault(worker.workerId(), 0L) >= cap) {
                continue;
            }
            candidates.add(new DispatchCandidate(worker.workerId(), profile.getVehicleType(),
                    worker.distanceKm(), etaMinutes(worker.distanceKm())));
        }

        log.debug("Trip {} level {} ({}, {} km): {} of {} nearby workers qualify",
                trip.getId(), escalationLevel, tier, radiusKm, candidates.size(), nearby.size());
        return partition(candidates, dispatchProperties.getBatchSize());
    }

    int etaMinutes(double distanceKm) {
        return (int) Math.ceil(distanceKm / dispatchProperties.getAssumedSpeedKmh() * 60);
    }

    private Map<String, Long> openOffersByWorker(Set<String> ids, Trip trip, Instant now) {
        Map<String, Long> counts = new HashMap<>();
        for (Object[] row : offerRepository.countOpenOffersByWorker(ids, trip.getId(), now)) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return batches;
    }
}

package com.tripdispatch.dispatch.location;

import com.tripdispatch.dispatch.location.model.NearbyWorker;
import com.tripdispatch.dispatch.location.model.WorkerPosition;
import com.tripdispatch.shared.util.GeoUtil;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local worker positions bucketed by H3 cell. Serves proximity
 * queries when Redis is unreachable; only sees reports received by this
 * instance.
 */
@Component
public class InMemoryLocationIndex {

    private final Map<String, WorkerPosition> positions = new ConcurrentHashMap<>();
    private final Map<String, String> cellByWorker = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> workersByCell = new ConcurrentHashMap<>();

    public void update(WorkerPosition position) {
        String cell = GeoUtil.locationCell(position.lat(), position.lng());
        String previousCell = cellByWorker.put(position.workerId(), cell);
        if (previousCell != null && !previousCell.equals(cell)) {
            removeFromCell(previousCell, position.workerId());
        }
        workersByCell.computeIfAbsent(cell, k -> ConcurrentHashMap.newKeySet()).add(position.workerId());
        positions.put(position.workerId(), position);
    }

    public void remove(String workerId) {
        positions.remove(workerId);
        String cell = cellByWorker.remove(workerId);
        if (cell != null) {
            removeFromCell(cell, workerId);
        }
    }

    public Optional<WorkerPosition> get(String workerId) {
        return Optional.ofNullable(positions.get(workerId));
    }

    /**
     * Dispatchable workers reported at or after {@code freshSince} within the
     * radius, nearest first.
     */
    public List<NearbyWorker> near(double lat, double lng, double radiusKm, Instant freshSince,
                                   Predicate<String> filter, int limit) {
        String origin = GeoUtil.locationCell(lat, lng);
        List<NearbyWorker> result = new ArrayList<>();
        for (String cell : GeoUtil.kRingCells(origin, GeoUtil.ringsCovering(radiusKm))) {
            for (String workerId : workersByCell.getOrDefault(cell, Set.of())) {
                WorkerPosition p = positions.get(workerId);
                if (p == null || !p.dispatchable() || p.capturedAt().isBefore(freshSince)) {
                    continue;
                }
                double distance = GeoUtil.distanceKm(lat, lng, p.lat(), p.lng());
                if (distance <= radiusKm && filter.test(workerId)) {
                    result.add(new NearbyWorker(workerId, p.lat(), p.lng(), distance, p.capturedAt()));
                }
            }
        }
        result.sort(Comparator.comparingDouble(NearbyWorker::distanceKm));
        return result.size() > limit ? result.subList(0, limit) : result;
    }

    public int evictOlderThan(Instant cutoff) {
        List<String> stale = positions.values().stream()
                .filter(p -> p.capturedAt().isBefore(cutoff))
                .map(WorkerPosition::workerId)
                .toList();
        stale.forEach(this::remove);
        return stale.size();
    }

    public int size() {
        return positions.size();
    }

    private void removeFromCell(String cell, String workerId) {
        workersByCell.computeIfPresent(cell, (c, ids) -> {
            ids.remove(workerId);
            return ids.isEmpty() ? null : ids;
        });
    }
}

package com.tripdispatch.dispatch.candidate;

import com.tripdispatch.dispatch.config.DispatchProperties;
import com.tripdispatch.dispatch.dispatch.repository.DispatchOfferRepository;
import com.tripdispatch.dispatch.location.LocationRegistry;
import com.tripdispatch.dispatch.location.model.NearbyWorker;
import com.tripdispatch.dispatch.trip.entity.Trip;
import com.tripdispatch.dispatch.trip.repository.TripRepository;
import com.tripdispatch.dispatch.worker.WorkerProfile;
import com.tripdispatch.dispatch.worker.WorkerProfileRepository;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.TripStatus;
import com.tripdispatch.shared.enums.VehicleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateSelectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock private LocationRegistry locationRegistry;
    @Mock private WorkerProfileRepository workerProfileRepository;
    @Mock private TripRepository tripRepository;
    @Mock private DispatchOfferRepository offerRepository;

    private DispatchProperties properties;
    private CandidateSelector selector;
    private Trip trip;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        selector = new CandidateSelector(locationRegistry, workerProfileRepository, tripRepository,
                offerRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        trip = Trip.builder()
                .id(UUID.randomUUID())
                .status(TripStatus.SEARCHING)
                .serviceType(ServiceType.RIDE)
                .vehicleType(VehicleType.ECONOMY)
                .pickupLat(6.5244)
                .pickupLng(3.3792)
                .build();
    }

    @Test
    @DisplayName("Strict level keeps exact-vehicle, eligible, free workers in distance order")
    void strictFiltering() {
        nearby("w-ok", 0.5, "w-comfort", 0.8, "w-delivery-only", 1.0, "w-ineligible", 1.2,
                "w-on-trip", 1.4, "w-saturated", 1.6, "w-ok-2", 2.0);
        when(workerProfileRepository.findAllById(anyCollection())).thenReturn(List.of(
                profile("w-ok", VehicleType.ECONOMY, true, ServiceType.RIDE),
                profile("w-comfort", VehicleType.COMFORT, true, ServiceType.RIDE),
                profile("w-delivery-only", VehicleType.ECONOMY, true, ServiceType.DELIVERY),
                profile("w-ineligible", VehicleType.ECONOMY, false, ServiceType.RIDE),
                profile("w-on-trip", VehicleType.ECONOMY, true, ServiceType.RIDE),
                profile("w-saturated", VehicleType.ECONOMY, true, ServiceType.RIDE),
                profile("w-ok-2", VehicleType.ECONOMY, true, ServiceType.RIDE)));
        when(tripRepository.findBusyWorkers(anyCollection(), eq(TripStatus.ON_TRIP)))
                .thenReturn(List.of("w-on-trip"));
        when(offerRepository.countOpenOffersByWorker(anyCollection(), eq(trip.getId()), eq(NOW)))
                .thenReturn(List.<Object[]>of(new Object[]{"w-saturated", 3L}, new Object[]{"w-ok", 2L}));

        List<List<DispatchCandidate>> batches = selector.select(trip, 0, Set.of());

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0)).extracting(DispatchCandidate::workerId).containsExactly("w-ok", "w-ok-2");
    }

    @Test
    @DisplayName("Upgrade level admits higher vehicle classes; relaxed level doubles the offer cap")
    void escalationRelaxesFilters() {
        nearby("w-comfort", 0.8, "w-saturated", 1.6);
        when(workerProfileRepository.findAllById(anyCollection())).thenReturn(List.of(
                profile("w-comfort", VehicleType.COMFORT, true, ServiceType.RIDE),
                profile("w-saturated", VehicleType.ECONOMY, true, ServiceType.RIDE)));
        when(tripRepository.findBusyWorkers(anyCollection(), any())).thenReturn(List.of());
        when(offerRepository.countOpenOffersByWorker(anyCollection(), any(), any()))
                .thenReturn(List.<Object[]>of(new Object[]{"w-saturated", 3L}));

        assertThat(selector.select(trip, 1, Set.of()).get(0))
                .extracting(DispatchCandidate::workerId).containsExactly("w-comfort");
        assertThat(selector.select(trip, 2, Set.of()).get(0))
                .extracting(DispatchCandidate::workerId).containsExactly("w-comfort", "w-saturated");
    }

    @Test
    @DisplayName("Radius grows by the multiplier per level and is capped")
    @SuppressWarnings("unchecked")
    void radiusPerLevel() {
        when(locationRegistry.near(anyDouble(), anyDouble(), anyDouble(), any(Predicate.class))).thenReturn(List.of());

        selector.select(trip, 0, Set.of());
        selector.select(trip, 1, Set.of());
        selector.select(trip, 3, Set.of());

        ArgumentCaptor<Double> radius = ArgumentCaptor.forClass(Double.class);
        verify(locationRegistry, times(3))
                .near(anyDouble(), anyDouble(), radius.capture(), any(Predicate.class));
        assertThat(radius.getAllValues()).containsExactly(5.0, 7.5, 15.0);
    }

    @Test
    @DisplayName("Workers already offered this trip are filtered out of the proximity query")
    @SuppressWarnings("unchecked")
    void excludedWorkersFiltered() {
        ArgumentCaptor<Predicate<String>> filter = ArgumentCaptor.forClass(Predicate.class);
        when(locationRegistry.near(anyDouble(), anyDouble(), anyDouble(), filter.capture())).thenReturn(List.of());

        assertThat(selector.select(trip, 0, Set.of("w-seen"))).isEmpty();
        assertThat(filter.getValue().test("w-seen")).isFalse();
        assertThat(filter.getValue().test("w-new")).isTrue();
    }

    @Test
    @DisplayName("Candidates are split into batches of batch-size with ETA at 30 km/h")
    void batchingAndEta() {
        List<Object> pairs = new ArrayList<>();
        List<WorkerProfile> profiles = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            pairs.add("w" + i);
            pairs.add(1.0 + i);
            profiles.add(profile("w" + i, VehicleType.ECONOMY, true, ServiceType.RIDE));
        }
        nearby(pairs.toArray());
        when(workerProfileRepository.findAllById(anyCollection())).thenReturn(profiles);
        when(tripRepository.findBusyWorkers(anyCollection(), any())).thenReturn(List.of());
        when(offerRepository.countOpenOffersByWorker(anyCollection(), any(), any())).thenReturn(List.of());

        List<List<DispatchCandidate>> batches = selector.select(trip, 0, Set.of());

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0)).hasSize(5);
        assertThat(batches.get(1)).extracting(DispatchCandidate::workerId).containsExactly("w5", "w6");
        // 1 km at 30 km/h = 2 min; 2.1 km -> ceil(4.2) = 5
        assertThat(batches.get(0).get(0).estimatedArrivalMin()).isEqualTo(2);
        assertThat(selector.etaMinutes(2.1)).isEqualTo(5);
    }

    @SuppressWarnings("unchecked")
    private void nearby(Object... idDistancePairs) {
        List<NearbyWorker> workers = new ArrayList<>();
        for (int i = 0; i < idDistancePairs.length; i += 2) {
            workers.add(new NearbyWorker((String) idDistancePairs[i], 6.5244, 3.3792,
                    (Double) idDistancePairs[i + 1], NOW));
        }
        when(locationRegistry.near(anyDouble(), anyDouble(), anyDouble(), any(Predicate.class))).thenReturn(workers);
    }

    private static WorkerProfile profile(String id, VehicleType vehicle, boolean eligible, ServiceType service) {
        return WorkerProfile.builder()
                .workerId(id)
                .vehicleType(vehicle)
                .eligible(eligible)
                .serviceTypes(Set.of(service))
                .build();
    }
}

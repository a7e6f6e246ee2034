package com.tripdispatch.dispatch.integration;

import com.tripdispatch.dispatch.DispatchServiceApplication;
import com.tripdispatch.dispatch.booking.TripOrchestrator;
import com.tripdispatch.dispatch.location.LocationRegistry;
import com.tripdispatch.dispatch.location.model.NearbyWorker;
import com.tripdispatch.dispatch.trip.model.CreateTripRequest;
import com.tripdispatch.dispatch.trip.model.HoldResult;
import com.tripdispatch.dispatch.worker.WorkerProfile;
import com.tripdispatch.dispatch.worker.WorkerProfileRepository;
import com.tripdispatch.shared.enums.PaymentMethod;
import com.tripdispatch.shared.enums.ServiceType;
import com.tripdispatch.shared.enums.VehicleType;
import com.tripdispatch.shared.events.OfferCreatedEvent;
import com.tripdispatch.shared.featureflag.FeatureFlagService;
import com.tripdispatch.shared.util.KafkaTopics;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Integration test: a new trip's first offer reaches Kafka.
 *
 *   Given  worker "kafka-w1" nearby and eligible
 *   When   a cash trip is requested through the orchestrator
 *   Then   trip.offer.created carries that worker and batch 1
 */
@SpringBootTest(classes = {
        DispatchServiceApplication.class,
        TestKafkaConfig.class
})
@ActiveProfiles("test")
@EmbeddedKafka(
        partitions = 1,
        topics = {
                KafkaTopics.TRIP_OFFER_CREATED,
                KafkaTopics.TRIP_REQUESTED
        },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers"
)
@DirtiesContext
class DispatchKafkaIntegrationTest {

    @MockBean private RedissonClient redissonClient;
    @MockBean private FeatureFlagService featureFlagService;
    @MockBean private LocationRegistry locationRegistry;

    @Autowired private TripOrchestrator orchestrator;
    @Autowired private WorkerProfileRepository workerProfileRepository;
    @Autowired private EmbeddedKafkaBroker embeddedKafka;
    @Autowired private ConsumerFactory<String, OfferCreatedEvent> offerConsumerFactory;

    @Test
    @Timeout(30)
    @DisplayName("Given a nearby worker, when a trip is requested, then trip.offer.created is published")
    void offerPublishedToKafka() {
        String workerId = "kafka-w1";
        workerProfileRepository.save(WorkerProfile.builder()
                .workerId(workerId)
                .vehicleType(VehicleType.ECONOMY)
                .serviceTypes(EnumSet.of(ServiceType.RIDE))
                .eligible(true)
                .rating(new BigDecimal("4.90"))
                .build());

        when(featureFlagService.isEnabled(anyString(), anyBoolean())).thenAnswer(inv -> inv.getArgument(1));
        when(locationRegistry.near(anyDouble(), anyDouble(), anyDouble(), any()))
                .thenReturn(List.of(new NearbyWorker(workerId, 12.9716, 77.5946, 0.8, Instant.now())));

        HoldResult result = orchestrator.createTrip("kafka-rider", CreateTripRequest.builder()
                .serviceType(ServiceType.RIDE)
                .vehicleType(VehicleType.ECONOMY)
                .pickupLat(12.9716).pickupLng(77.5946)
                .dropoffLat(12.9352).dropoffLng(77.6245)
                .paymentMethod(PaymentMethod.CASH)
                .build(), "idem-kafka-001");

        try (Consumer<String, OfferCreatedEvent> consumer = offerConsumerFactory.createConsumer()) {
            embeddedKafka.consumeFromAnEmbeddedTopic(consumer, KafkaTopics.TRIP_OFFER_CREATED);
            ConsumerRecord<String, OfferCreatedEvent> record =
                    KafkaTestUtils.getSingleRecord(consumer, KafkaTopics.TRIP_OFFER_CREATED, Duration.ofSeconds(10));

            assertThat(record.key())
                    .as("offers are keyed by trip id")
                    .isEqualTo(result.trip().getId().toString());
            OfferCreatedEvent offer = record.value();
            assertThat(offer.getWorkerId()).isEqualTo(workerId);
            assertThat(offer.getBatchNumber()).isEqualTo(1);
            assertThat(offer.getExpiresAt()).isAfter(offer.getSentAt());
            assertThat(offer.getCurrency()).isEqualTo("NGN");
        }
    }
}

package com.tripdispatch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for trip dispatch.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_trip_requests_total{status="created|rejected|duplicate"}
 *   dispatch_offers_issued_total
 *   dispatch_offer_response_total{outcome="accepted|declined|expired|lost_race"}
 *   dispatch_escalations_total
 *   dispatch_no_match_total
 *   dispatch_kill_switch_rejections_total
 *   dispatch_geo_routing_fallback_total
 *   dispatch_time_to_assign_seconds
 */
@Component
public class DispatchMetrics {

    private final Counter tripCreatedCounter;
    private final Counter tripRejectedCounter;
    private final Counter idempotentReplayCounter;
    private final Counter offersIssuedCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerDeclinedCounter;
    private final Counter offerExpiredCounter;
    private final Counter lostRaceCounter;
    private final Counter escalationCounter;
    private final Counter noMatchCounter;
    private final Counter killSwitchCounter;
    private final Counter routingFallbackCounter;
    private final Timer   timeToAssignTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.tripCreatedCounter = Counter.builder("dispatch.trip.requests")
                .tag("status", "created")
                .description("Trips created with their hold")
                .register(registry);

        this.tripRejectedCounter = Counter.builder("dispatch.trip.requests")
                .tag("status", "rejected")
                .description("Trip requests rejected (balance, active trip, validation)")
                .register(registry);

        this.idempotentReplayCounter = Counter.builder("dispatch.trip.requests")
                .tag("status", "duplicate")
                .description("Idempotent replays of an earlier request")
                .register(registry);

        this.offersIssuedCounter = Counter.builder("dispatch.offers.issued")
                .description("Offers sent to workers across all batches")
                .register(registry);

        this.offerAcceptedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "accepted")
                .register(registry);

        this.offerDeclinedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "declined")
                .register(registry);

        this.offerExpiredCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "expired")
                .register(registry);

        this.lostRaceCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "lost_race")
                .description("Accepts rejected because another worker was bound first")
                .register(registry);

        this.escalationCounter = Counter.builder("dispatch.escalations")
                .description("Radius or filter escalations")
                .register(registry);

        this.noMatchCounter = Counter.builder("dispatch.no_match")
                .description("Trips cancelled after all batches were exhausted")
                .register(registry);

        this.killSwitchCounter = Counter.builder("dispatch.kill_switch_rejections")
                .register(registry);

        this.routingFallbackCounter = Counter.builder("dispatch.geo_routing.fallback")
                .description("Fare estimates computed from straight-line distance")
                .register(registry);

        this.timeToAssignTimer = Timer.builder("dispatch.time_to_assign")
                .description("Time from search start to a worker being bound")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofSeconds(1))
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(registry);
    }

    public void recordTripCreated()          { tripCreatedCounter.increment(); }
    public void recordTripRejected()         { tripRejectedCounter.increment(); }
    public void recordIdempotentReplay()     { idempotentReplayCounter.increment(); }
    public void recordOffersIssued(int n)    { offersIssuedCounter.increment(n); }
    public void recordOfferAccepted()        { offerAcceptedCounter.increment(); }
    public void recordOfferDeclined()        { offerDeclinedCounter.increment(); }
    public void recordOfferExpired()         { offerExpiredCounter.increment(); }
    public void recordLostRace()             { lostRaceCounter.increment(); }
    public void recordEscalation()           { escalationCounter.increment(); }
    public void recordNoMatch()              { noMatchCounter.increment(); }
    public void recordKillSwitchRejection()  { killSwitchCounter.increment(); }
    public void recordRoutingFallback()      { routingFallbackCounter.increment(); }
    public void recordTimeToAssign(Duration d) { timeToAssignTimer.record(d); }
}

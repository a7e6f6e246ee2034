package com.tripdispatch.dispatch.fare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tripdispatch.dispatch.config.DispatchProperties;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.metrics.DispatchMetrics;
import com.tripdispatch.shared.util.GeoUtil;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Road distance and duration from the external routing provider.
 * Resilience4j guards the call; when the provider is unreachable or not
 * configured the estimate falls back to great-circle distance.
 */
@Slf4j
@Component
public class GeoRoutingClient {

    private final RestTemplate restTemplate;
    private final DispatchProperties dispatchProperties;
    private final DispatchMetrics metrics;
    private final String baseUrl;

    public GeoRoutingClient(@Qualifier("geoRoutingRestTemplate") RestTemplate restTemplate,
                            DispatchProperties dispatchProperties,
                            DispatchMetrics metrics,
                            @Value("${geo.routing.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.dispatchProperties = dispatchProperties;
        this.metrics = metrics;
        this.baseUrl = baseUrl;
    }

    @CircuitBreaker(name = "geo-routing", fallbackMethod = "straightLineFallback")
    @Retry(name = "geo-routing")
    public RouteEstimate route(double fromLat, double fromLng, double toLat, double toLng) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return straightLine(fromLat, fromLng, toLat, toLng);
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/route")
                .queryParam("from", fromLat + "," + fromLng)
                .queryParam("to", toLat + "," + toLng)
                .build()
                .toUri();

        RouteResponse response = restTemplate.getForObject(uri, RouteResponse.class);
        if (response == null || response.distanceKm() == null || response.durationMin() == null) {
            throw new IllegalStateException("Routing provider returned an empty route");
        }
        return new RouteEstimate(response.distanceKm(),
                Math.max(1, (int) Math.ceil(response.durationMin())), false);
    }

    public RouteEstimate straightLineFallback(double fromLat, double fromLng, double toLat, double toLng,
                                              Throwable ex) {
        log.warn("{}: routing provider failed, using straight-line estimate: {}",
                ErrorCode.UPSTREAM_UNAVAILABLE, ex.getMessage());
        return straightLine(fromLat, fromLng, toLat, toLng);
    }

    RouteEstimate straightLine(double fromLat, double fromLng, double toLat, double toLng) {
        double distanceKm = GeoUtil.distanceKm(fromLat, fromLng, toLat, toLng);
        int durationMin = (int) Math.max(1, Math.round(distanceKm / dispatchProperties.getAssumedSpeedKmh() * 60));
        metrics.recordRoutingFallback();
        return new RouteEstimate(distanceKm, durationMin, true);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RouteResponse(Double distanceKm, Double durationMin) {
    }
}

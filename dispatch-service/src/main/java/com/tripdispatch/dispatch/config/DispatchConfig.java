package com.tripdispatch.dispatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties({
        DispatchProperties.class,
        LocationProperties.class,
        TripPolicyProperties.class
})
public class DispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate geoRoutingRestTemplate(
            RestTemplateBuilder builder,
            @Value("${geo.routing.connect-timeout-ms:1000}") long connectTimeoutMs,
            @Value("${geo.routing.read-timeout-ms:2000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}

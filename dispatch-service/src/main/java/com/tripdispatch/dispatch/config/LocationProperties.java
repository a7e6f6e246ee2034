package com.tripdispatch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "location")
public class LocationProperties {

    /** Workers silent for longer than this are left out of proximity results. */
    private Duration livenessWindow = Duration.ofMinutes(5);

    private Duration retention = Duration.ofDays(7);

    private int nearbyLimit = 50;
}

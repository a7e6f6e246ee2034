package com.tripdispatch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Batch dispatch tuning. Radius at escalation level L is
 * {@code min(initialRadiusKm * radiusMultiplier^L, maxRadiusKm)}.
 */
@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private Duration offerWindow = Duration.ofSeconds(20);
    private int batchSize = 5;
    private double initialRadiusKm = 5.0;
    private double radiusMultiplier = 1.5;
    private double maxRadiusKm = 15.0;
    private int maxEscalations = 3;
    private int maxConcurrentOffers = 3;
    private Duration searchTimeout = Duration.ofMinutes(10);
    private double assumedSpeedKmh = 30.0;

    public double radiusForLevel(int escalationLevel) {
        double radius = initialRadiusKm * Math.pow(radiusMultiplier, escalationLevel);
        return Math.min(radius, maxRadiusKm);
    }
}

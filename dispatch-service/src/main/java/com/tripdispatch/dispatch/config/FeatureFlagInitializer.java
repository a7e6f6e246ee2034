package com.tripdispatch.dispatch.config;

import com.tripdispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

/**
 * Seeds default feature flags for the "default" tenant on startup.
 * Flags already set in Redis are not overwritten.
 *
 *   redis-cli HSET feature-flags:default dispatch_kill_switch true
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            try {
                featureFlagService.initDefaults(FeatureFlagService.DEFAULT_TENANT);
                log.info("Feature flags initialised for tenant=default");
            } catch (DataAccessException e) {
                log.warn("Could not seed feature flags, defaults apply until Redis is reachable: {}", e.getMessage());
            }
        };
    }
}

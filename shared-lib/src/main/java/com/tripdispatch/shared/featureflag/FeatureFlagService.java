package com.tripdispatch.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{tenantId}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration. Toggle at runtime with:
 *   HSET feature-flags:default dispatch_kill_switch true
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_TENANT   = "global";
    public static final String DEFAULT_TENANT   = "default";

    public static final String DISPATCH_KILL_SWITCH    = "dispatch_kill_switch";
    public static final String SCHEDULED_TRIPS_ENABLED = "scheduled_trips_enabled";
    public static final String TRIP_SHARING_ENABLED    = "trip_sharing_enabled";
    public static final String TIPS_ENABLED            = "tips_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Per-tenant value, then the global override, then {@code defaultValue}.
     * An unreachable Redis resolves to {@code defaultValue}.
     */
    public boolean isEnabled(String tenantId, String flagName, boolean defaultValue) {
        try {
            Object tenantVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + tenantId, flagName);
            if (tenantVal != null) {
                return Boolean.parseBoolean(tenantVal.toString());
            }

            Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_TENANT, flagName);
            if (globalVal != null) {
                return Boolean.parseBoolean(globalVal.toString());
            }
        } catch (DataAccessException e) {
            log.warn("Feature flag store unavailable, '{}' falls back to {}: {}", flagName, defaultValue, e.getMessage());
            return defaultValue;
        }

        log.debug("Feature flag '{}' not found for tenant='{}', using default={}", flagName, tenantId, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_TENANT, flagName, defaultValue);
    }

    public void setFlag(String tenantId, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + tenantId, flagName, String.valueOf(value));
        log.info("Feature flag set: tenant={} flag={} value={}", tenantId, flagName, value);
    }

    /**
     * Seeds flags that are not yet present. Existing values are left alone.
     */
    public void initDefaults(String tenantId) {
        String key = FLAG_KEY_PREFIX + tenantId;
        setIfAbsent(key, DISPATCH_KILL_SWITCH,    "false");
        setIfAbsent(key, SCHEDULED_TRIPS_ENABLED, "true");
        setIfAbsent(key, TRIP_SHARING_ENABLED,    "true");
        setIfAbsent(key, TIPS_ENABLED,            "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    private void setIfAbsent(String key, String field, String value) {
        redisTemplate.opsForHash().putIfAbsent(key, field, value);
    }
}

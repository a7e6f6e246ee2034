package com.tripdispatch.shared.featureflag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureFlagServiceTest {

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private HashOperations<String, Object, Object> hashOps;

    private FeatureFlagService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForHash()).thenReturn(hashOps);
        service = new FeatureFlagService(redisTemplate);
    }

    @Test
    @DisplayName("Tenant value wins over the global override")
    void tenantValueWins() {
        when(hashOps.get("feature-flags:default", FeatureFlagService.DISPATCH_KILL_SWITCH)).thenReturn("true");

        assertThat(service.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)).isTrue();
    }

    @Test
    @DisplayName("Global override applies when the tenant has no value")
    void globalOverrideApplies() {
        when(hashOps.get("feature-flags:acme", FeatureFlagService.TIPS_ENABLED)).thenReturn(null);
        when(hashOps.get("feature-flags:global", FeatureFlagService.TIPS_ENABLED)).thenReturn("false");

        assertThat(service.isEnabled("acme", FeatureFlagService.TIPS_ENABLED, true)).isFalse();
    }

    @Test
    @DisplayName("Unreachable Redis resolves to the caller's default")
    void redisFailureFallsBackToDefault() {
        when(hashOps.get("feature-flags:default", FeatureFlagService.DISPATCH_KILL_SWITCH))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)).isFalse();
    }
}

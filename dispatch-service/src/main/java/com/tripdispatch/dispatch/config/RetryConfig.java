package com.tripdispatch.dispatch.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} for store-conflict retries. The retry advice wraps
 * the transactional advice, so every attempt runs in a fresh transaction.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}

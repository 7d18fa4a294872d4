package me.golemcore.resilience.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Immutable configuration of the resilient tool executor.
 *
 * <p>
 * Built once from {@link #defaults()} plus {@link ExecutorOption} overrides (or
 * from Spring properties). Every numeric and duration field must be positive;
 * {@link #normalized()} replaces offending values with their defaults. The only
 * exception is {@code retryMaxDelay}, where zero means "no cap".
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class ExecutorConfig {

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
    public static final Duration DEFAULT_CIRCUIT_BREAKER_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_INITIAL_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Bulkhead capacity: tool executions allowed to run at the same time.
     */
    @Builder.Default
    int maxConcurrent = DEFAULT_MAX_CONCURRENT;

    /**
     * Consecutive failures of one tool that open its circuit.
     */
    @Builder.Default
    int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;

    /**
     * How long an open circuit rejects calls before admitting a probe.
     */
    @Builder.Default
    Duration circuitBreakerTimeout = DEFAULT_CIRCUIT_BREAKER_TIMEOUT;

    /**
     * Total attempts for an idempotent tool, first attempt included.
     */
    @Builder.Default
    int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;

    /**
     * Backoff before the second attempt.
     */
    @Builder.Default
    Duration retryInitialDelay = DEFAULT_RETRY_INITIAL_DELAY;

    @Builder.Default
    double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;

    /**
     * Upper bound for a single backoff; {@link Duration#ZERO} leaves it uncapped.
     */
    @Builder.Default
    Duration retryMaxDelay = Duration.ZERO;

    /**
     * Deadline of each individual attempt.
     */
    @Builder.Default
    Duration defaultTimeout = DEFAULT_TIMEOUT;

    public static ExecutorConfig defaults() {
        return ExecutorConfig.builder().build();
    }

    /**
     * Returns a copy with the given options applied in order.
     */
    public ExecutorConfig with(ExecutorOption... options) {
        ExecutorConfigBuilder builder = toBuilder();
        for (ExecutorOption option : options) {
            if (option != null) {
                option.apply(builder);
            }
        }
        return builder.build();
    }

    /**
     * Returns a copy in which every non-positive value has been replaced with its
     * default.
     */
    public ExecutorConfig normalized() {
        ExecutorConfigBuilder builder = toBuilder();
        if (maxConcurrent < 1) {
            warnClamped("maxConcurrent", maxConcurrent, DEFAULT_MAX_CONCURRENT);
            builder.maxConcurrent(DEFAULT_MAX_CONCURRENT);
        }
        if (circuitBreakerThreshold < 1) {
            warnClamped("circuitBreakerThreshold", circuitBreakerThreshold, DEFAULT_CIRCUIT_BREAKER_THRESHOLD);
            builder.circuitBreakerThreshold(DEFAULT_CIRCUIT_BREAKER_THRESHOLD);
        }
        if (!isPositive(circuitBreakerTimeout)) {
            warnClamped("circuitBreakerTimeout", circuitBreakerTimeout, DEFAULT_CIRCUIT_BREAKER_TIMEOUT);
            builder.circuitBreakerTimeout(DEFAULT_CIRCUIT_BREAKER_TIMEOUT);
        }
        if (retryMaxAttempts < 1) {
            warnClamped("retryMaxAttempts", retryMaxAttempts, DEFAULT_RETRY_MAX_ATTEMPTS);
            builder.retryMaxAttempts(DEFAULT_RETRY_MAX_ATTEMPTS);
        }
        if (!isPositive(retryInitialDelay)) {
            warnClamped("retryInitialDelay", retryInitialDelay, DEFAULT_RETRY_INITIAL_DELAY);
            builder.retryInitialDelay(DEFAULT_RETRY_INITIAL_DELAY);
        }
        if (!(retryBackoffMultiplier > 0) || Double.isInfinite(retryBackoffMultiplier)) {
            warnClamped("retryBackoffMultiplier", retryBackoffMultiplier, DEFAULT_RETRY_BACKOFF_MULTIPLIER);
            builder.retryBackoffMultiplier(DEFAULT_RETRY_BACKOFF_MULTIPLIER);
        }
        if (retryMaxDelay == null || retryMaxDelay.isNegative()) {
            warnClamped("retryMaxDelay", retryMaxDelay, Duration.ZERO);
            builder.retryMaxDelay(Duration.ZERO);
        }
        if (!isPositive(defaultTimeout)) {
            warnClamped("defaultTimeout", defaultTimeout, DEFAULT_TIMEOUT);
            builder.defaultTimeout(DEFAULT_TIMEOUT);
        }
        return builder.build();
    }

    public boolean hasRetryMaxDelay() {
        return retryMaxDelay != null && !retryMaxDelay.isZero() && !retryMaxDelay.isNegative();
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private static void warnClamped(String field, Object value, Object fallback) {
        log.warn("[Resilience] Invalid {}={}, using {}", field, value, fallback);
    }
}

package me.golemcore.resilience.infrastructure.config;

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

import lombok.Data;
import me.golemcore.resilience.domain.model.ExecutorConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tool executor settings bound from application properties.
 *
 * <p>
 * All keys live under {@code resilience.executor.*}, for example:
 *
 * <pre>
 * resilience.executor.max-concurrent=20
 * resilience.executor.circuit-breaker-threshold=3
 * resilience.executor.circuit-breaker-timeout=1m
 * resilience.executor.retry-max-attempts=4
 * resilience.executor.retry-initial-delay=250ms
 * resilience.executor.default-timeout=15s
 * </pre>
 *
 * <p>
 * Out-of-range values are not rejected at binding time; the executor replaces
 * them with defaults and logs a warning.
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "resilience.executor")
@Data
public class ResilienceProperties {

    private boolean enabled = true;
    private int maxConcurrent = ExecutorConfig.DEFAULT_MAX_CONCURRENT;
    private int circuitBreakerThreshold = ExecutorConfig.DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
    private Duration circuitBreakerTimeout = ExecutorConfig.DEFAULT_CIRCUIT_BREAKER_TIMEOUT;
    private int retryMaxAttempts = ExecutorConfig.DEFAULT_RETRY_MAX_ATTEMPTS;
    private Duration retryInitialDelay = ExecutorConfig.DEFAULT_RETRY_INITIAL_DELAY;
    private double retryBackoffMultiplier = ExecutorConfig.DEFAULT_RETRY_BACKOFF_MULTIPLIER;
    private Duration retryMaxDelay = Duration.ZERO;
    private Duration defaultTimeout = ExecutorConfig.DEFAULT_TIMEOUT;

    public ExecutorConfig toExecutorConfig() {
        return ExecutorConfig.builder()
                .maxConcurrent(maxConcurrent)
                .circuitBreakerThreshold(circuitBreakerThreshold)
                .circuitBreakerTimeout(circuitBreakerTimeout)
                .retryMaxAttempts(retryMaxAttempts)
                .retryInitialDelay(retryInitialDelay)
                .retryBackoffMultiplier(retryBackoffMultiplier)
                .retryMaxDelay(retryMaxDelay)
                .defaultTimeout(defaultTimeout)
                .build();
    }
}

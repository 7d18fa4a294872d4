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

import java.time.Duration;

/**
 * Factories for {@link ExecutorOption}s.
 *
 * <pre>{@code
 * ResilientToolExecutor executor = ResilientToolExecutor.withOptions(
 *         ExecutorOptions.withMaxConcurrent(5),
 *         ExecutorOptions.withRetryAttempts(2),
 *         ExecutorOptions.withTimeout(Duration.ofSeconds(10)));
 * }</pre>
 */
public final class ExecutorOptions {

    private ExecutorOptions() {
    }

    public static ExecutorOption withMaxConcurrent(int maxConcurrent) {
        return builder -> builder.maxConcurrent(maxConcurrent);
    }

    public static ExecutorOption withCircuitBreakerThreshold(int threshold) {
        return builder -> builder.circuitBreakerThreshold(threshold);
    }

    public static ExecutorOption withCircuitBreakerTimeout(Duration timeout) {
        return builder -> builder.circuitBreakerTimeout(timeout);
    }

    public static ExecutorOption withRetryAttempts(int maxAttempts) {
        return builder -> builder.retryMaxAttempts(maxAttempts);
    }

    public static ExecutorOption withRetryDelay(Duration initialDelay) {
        return builder -> builder.retryInitialDelay(initialDelay);
    }

    public static ExecutorOption withRetryBackoffMultiplier(double multiplier) {
        return builder -> builder.retryBackoffMultiplier(multiplier);
    }

    public static ExecutorOption withRetryMaxDelay(Duration maxDelay) {
        return builder -> builder.retryMaxDelay(maxDelay);
    }

    public static ExecutorOption withTimeout(Duration timeout) {
        return builder -> builder.defaultTimeout(timeout);
    }
}

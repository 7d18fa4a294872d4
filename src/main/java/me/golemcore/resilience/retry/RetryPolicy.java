package me.golemcore.resilience.retry;

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

import me.golemcore.resilience.domain.component.ToolComponent;
import me.golemcore.resilience.domain.exception.CircuitOpenException;
import me.golemcore.resilience.domain.exception.ContextCancelledException;
import me.golemcore.resilience.domain.model.ExecutorConfig;

import java.time.Duration;

/**
 * Decides whether a failed tool call gets another attempt, and how long to wait
 * before it.
 *
 * <p>
 * Only tools annotated as idempotent are retried: repeating a destructive write
 * after an ambiguous failure such as a timeout can duplicate its side effects.
 * Backoff grows exponentially,
 * {@code initialDelay * multiplier^(attempt - 1)}, optionally capped.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative: " + initialDelay);
        }
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("multiplier must be positive: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero() ? maxDelay : null;
    }

    public static RetryPolicy from(ExecutorConfig config) {
        return new RetryPolicy(config.getRetryMaxAttempts(), config.getRetryInitialDelay(),
                config.getRetryBackoffMultiplier(), config.getRetryMaxDelay());
    }

    /**
     * Total attempts allowed for the tool, first attempt included.
     */
    public int maxAttempts(ToolComponent tool) {
        return tool.getAnnotations().canRetry() ? maxAttempts : 1;
    }

    /**
     * Backoff after the given 1-based attempt failed.
     */
    public Duration nextDelay(int attemptIndex) {
        if (attemptIndex < 1) {
            throw new IllegalArgumentException("attemptIndex is 1-based: " + attemptIndex);
        }
        double initialNanos = initialDelay.getSeconds() * 1_000_000_000d + initialDelay.getNano();
        double nanos = initialNanos * Math.pow(multiplier, attemptIndex - 1);
        Duration delay = nanos >= Long.MAX_VALUE ? Duration.ofNanos(Long.MAX_VALUE) : Duration.ofNanos((long) nanos);
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }

    /**
     * Whether another attempt could help. The caller's own cancellation or
     * deadline is final; everything else, including a per-attempt timeout, is
     * worth retrying.
     */
    public boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        return !(error instanceof ContextCancelledException) && !(error instanceof CircuitOpenException);
    }
}

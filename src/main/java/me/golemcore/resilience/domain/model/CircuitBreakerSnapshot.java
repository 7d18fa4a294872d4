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

import java.time.Instant;

/**
 * Point-in-time view of one tool's circuit breaker. {@code openedAt} is
 * {@code null} until the breaker first opens.
 */
@Builder
public record CircuitBreakerSnapshot(String toolName, CircuitState state, int consecutiveFailures, Instant openedAt,
        boolean probeInFlight) {

    public static CircuitBreakerSnapshot closed(String toolName) {
        return new CircuitBreakerSnapshot(toolName, CircuitState.CLOSED, 0, null, false);
    }
}

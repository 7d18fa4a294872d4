package me.golemcore.resilience.circuitbreaker;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.resilience.domain.model.CircuitBreakerSnapshot;
import me.golemcore.resilience.domain.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One circuit breaker per tool name.
 *
 * <p>
 * Breakers are created lazily on first reference and live as long as the
 * registry, so the map is bounded by the number of distinct tool names ever
 * invoked. Each {@link CircuitBreakerState} serializes its own transitions;
 * the registry itself holds no lock.
 *
 * <p>
 * Recovery is time driven only: after {@code cooldown} an open breaker admits
 * exactly one probe call, and the outcome of that probe either closes the
 * breaker or reopens it with a fresh cooldown.
 *
 * @since 1.0
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, CircuitBreakerState> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int threshold, Duration cooldown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decides whether a call to the tool may proceed.
     *
     * @return {@code false} when the circuit is open, or half-open with a probe
     *         already outstanding
     */
    public boolean tryAcquire(String toolName) {
        CircuitBreakerState.Admission admission = resolve(toolName).tryAcquire(clock.instant(), cooldown);
        if (admission == CircuitBreakerState.Admission.PROBE) {
            log.info("[Resilience] Circuit half-open for '{}', admitting probe call", toolName);
        }
        return admission != CircuitBreakerState.Admission.REJECTED;
    }

    public void recordSuccess(String toolName) {
        CircuitState previous = resolve(toolName).recordSuccess();
        if (previous != CircuitState.CLOSED) {
            log.info("[Resilience] Circuit closed for '{}' (was {})", toolName, previous);
        }
    }

    public void recordFailure(String toolName) {
        if (resolve(toolName).recordFailure(clock.instant(), threshold)) {
            log.warn("[Resilience] Circuit opened for '{}', rejecting calls for {}ms", toolName,
                    cooldown.toMillis());
        }
    }

    /**
     * Current state of the tool's breaker. A tool that has never been referenced
     * reports {@link CircuitState#CLOSED} without creating state.
     */
    public CircuitBreakerSnapshot getSnapshot(String toolName) {
        CircuitBreakerState state = breakers.get(toolName);
        if (state == null) {
            return CircuitBreakerSnapshot.closed(toolName);
        }
        return state.snapshot();
    }

    /**
     * Snapshots of every breaker created so far, ordered by tool name.
     */
    public Map<String, CircuitBreakerSnapshot> getSnapshots() {
        Map<String, CircuitBreakerSnapshot> snapshots = new TreeMap<>();
        breakers.forEach((name, state) -> snapshots.put(name, state.snapshot()));
        return Collections.unmodifiableMap(snapshots);
    }

    public int size() {
        return breakers.size();
    }

    private CircuitBreakerState resolve(String toolName) {
        Objects.requireNonNull(toolName, "toolName");
        return breakers.computeIfAbsent(toolName, CircuitBreakerState::new);
    }
}

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

import me.golemcore.resilience.domain.model.CircuitBreakerSnapshot;
import me.golemcore.resilience.domain.model.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker state machine of a single tool. Every method is synchronized
 * on the instance, so each tool name has its own lock and a slow tool never
 * blocks bookkeeping for another.
 *
 * <pre>
 * CLOSED --threshold consecutive failures--> OPEN
 * OPEN --cooldown elapsed, one probe admitted--> HALF_OPEN
 * HALF_OPEN --probe succeeds--> CLOSED
 * HALF_OPEN --probe fails--> OPEN
 * </pre>
 */
final class CircuitBreakerState {

    enum Admission {
        ADMITTED, PROBE, REJECTED
    }

    private final String toolName;
    private CircuitState phase = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    CircuitBreakerState(String toolName) {
        this.toolName = toolName;
    }

    synchronized Admission tryAcquire(Instant now, Duration cooldown) {
        switch (phase) {
        case CLOSED:
            return Admission.ADMITTED;
        case OPEN:
            if (Duration.between(openedAt, now).compareTo(cooldown) < 0) {
                return Admission.REJECTED;
            }
            phase = CircuitState.HALF_OPEN;
            consecutiveFailures = 0;
            probeInFlight = true;
            return Admission.PROBE;
        case HALF_OPEN:
        default:
            if (probeInFlight) {
                return Admission.REJECTED;
            }
            probeInFlight = true;
            return Admission.PROBE;
        }
    }

    /**
     * @return the phase before the success was recorded
     */
    synchronized CircuitState recordSuccess() {
        CircuitState previous = phase;
        phase = CircuitState.CLOSED;
        consecutiveFailures = 0;
        probeInFlight = false;
        return previous;
    }

    /**
     * @return {@code true} if this failure opened the circuit
     */
    synchronized boolean recordFailure(Instant now, int threshold) {
        switch (phase) {
        case HALF_OPEN:
            phase = CircuitState.OPEN;
            openedAt = now;
            probeInFlight = false;
            consecutiveFailures++;
            return true;
        case CLOSED:
            consecutiveFailures++;
            if (consecutiveFailures >= threshold) {
                phase = CircuitState.OPEN;
                openedAt = now;
                return true;
            }
            return false;
        case OPEN:
        default:
            // Late failure of a call admitted before the circuit opened; the
            // cooldown is not restarted.
            return false;
        }
    }

    synchronized CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.builder()
                .toolName(toolName)
                .state(phase)
                .consecutiveFailures(consecutiveFailures)
                .openedAt(openedAt)
                .probeInFlight(probeInFlight)
                .build();
    }
}

package me.golemcore.resilience.timeout;

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

import me.golemcore.resilience.domain.context.ToolContext;

import java.time.Duration;
import java.util.Objects;

/**
 * Gives every attempt its own bounded lifetime. The derived context expires at
 * {@code min(parent deadline, now + timeout)} and must be closed when the
 * attempt ends. A timed-out attempt leaves the parent untouched, so the next
 * attempt starts with a fresh budget.
 */
public class TimeoutGuard {

    private final Duration timeout;

    public TimeoutGuard(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    public ToolContext wrap(ToolContext parent) {
        return parent.withTimeout(timeout);
    }

    public Duration getTimeout() {
        return timeout;
    }
}

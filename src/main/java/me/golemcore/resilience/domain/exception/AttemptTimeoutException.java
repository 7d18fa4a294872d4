package me.golemcore.resilience.domain.exception;

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
 * A single attempt outlived its per-attempt deadline while the caller's own
 * context was still live. Counts as an ordinary attempt failure.
 */
public class AttemptTimeoutException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final int attempt;

    public AttemptTimeoutException(String toolName, int attempt, Duration timeout) {
        super("Tool '" + toolName + "' attempt " + attempt + " timed out after " + timeout.toMillis() + "ms");
        this.toolName = toolName;
        this.attempt = attempt;
    }

    public AttemptTimeoutException(String toolName, int attempt, Duration timeout, Throwable cause) {
        super("Tool '" + toolName + "' attempt " + attempt + " timed out after " + timeout.toMillis() + "ms",
                cause);
        this.toolName = toolName;
        this.attempt = attempt;
    }

    public String getToolName() {
        return toolName;
    }

    public int getAttempt() {
        return attempt;
    }
}

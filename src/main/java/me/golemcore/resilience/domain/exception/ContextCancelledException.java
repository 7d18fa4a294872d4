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

/**
 * Raised when a {@link me.golemcore.resilience.domain.context.ToolContext} is
 * done, either because it was cancelled explicitly or because its deadline
 * passed. Retrying never helps, so the executor surfaces it unwrapped.
 */
public class ContextCancelledException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        CANCELLED, DEADLINE_EXCEEDED
    }

    private final Reason reason;

    public ContextCancelledException(Reason reason) {
        super(reason == Reason.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context cancelled");
        this.reason = reason;
    }

    public ContextCancelledException(Reason reason, Throwable cause) {
        super(reason == Reason.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context cancelled", cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == Reason.DEADLINE_EXCEEDED;
    }
}

package me.golemcore.resilience.executor;

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
import me.golemcore.resilience.domain.context.ToolContext;
import me.golemcore.resilience.domain.model.CircuitState;
import me.golemcore.resilience.domain.model.ToolResult;

import java.time.Duration;
import java.util.Map;

/**
 * Entry point the rest of the agent runtime uses to run tools.
 *
 * <p>
 * Callers always get back either a result or exactly one terminal exception:
 * <ul>
 * <li>{@link me.golemcore.resilience.domain.exception.ContextCancelledException}
 * - the caller's context was cancelled or its deadline passed</li>
 * <li>{@link me.golemcore.resilience.domain.exception.CircuitOpenException} -
 * the tool's circuit is open; the tool was not invoked</li>
 * <li>{@link me.golemcore.resilience.domain.exception.ToolExecutionException}
 * - every permitted attempt failed; the cause is the last attempt's error</li>
 * </ul>
 */
public interface ToolExecutorPort {

    /**
     * Runs the tool behind the bulkhead, its circuit breaker, the per-attempt
     * timeout and, for idempotent tools, automatic retry.
     */
    ToolResult execute(ToolContext context, ToolComponent tool, Map<String, Object> input);

    /**
     * Same as {@link #execute} under a caller deadline of at most
     * {@code timeout}.
     */
    ToolResult executeWithTimeout(ToolContext context, ToolComponent tool, Map<String, Object> input,
            Duration timeout);

    /**
     * Runs the tool once without bulkhead, breaker, retry or per-attempt timeout,
     * waiting only as long as the caller's context allows.
     */
    ToolResult executeSimple(ToolContext context, ToolComponent tool, Map<String, Object> input);

    CircuitState getCircuitState(String toolName);

    /**
     * Does nothing. Breakers recover on their own once the cooldown elapses and
     * a probe call succeeds; there is no way to force one closed.
     */
    void reset();
}

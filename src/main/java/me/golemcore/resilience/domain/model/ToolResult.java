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
import lombok.Value;

import java.time.Duration;

/**
 * Result of a tool call. Tools fill {@code output} (and {@code cached} when the
 * value came from a cache); the executor fills {@code duration} and
 * {@code attempts} before handing the result to the caller.
 */
@Value
@Builder(toBuilder = true)
public class ToolResult {

    Object output;
    boolean cached;
    @Builder.Default
    Duration duration = Duration.ZERO;
    int attempts;

    public static ToolResult of(Object output) {
        return ToolResult.builder()
                .output(output)
                .build();
    }

    public static ToolResult cached(Object output) {
        return ToolResult.builder()
                .output(output)
                .cached(true)
                .build();
    }

    public ToolResult withExecution(Duration elapsed, int attemptCount) {
        return toBuilder()
                .duration(elapsed)
                .attempts(attemptCount)
                .build();
    }
}

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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Behavioral annotations a tool declares about itself. The executor only acts
 * on {@link #isIdempotent()}: it decides whether a failed call may be retried
 * automatically. The remaining flags are carried for callers such as approval
 * and caching layers.
 */
@Value
@Builder(toBuilder = true)
public class ToolAnnotations {

    boolean readOnly;
    boolean destructive;
    boolean idempotent;
    boolean cacheable;
    boolean requiresApproval;
    @Builder.Default
    RiskLevel riskLevel = RiskLevel.LOW;
    @Singular
    List<String> tags;

    /**
     * Annotations for a tool that declares nothing: mutating, not retryable, low
     * risk.
     */
    public static ToolAnnotations defaults() {
        return ToolAnnotations.builder().build();
    }

    /**
     * Annotations for a pure lookup: read-only, idempotent, cacheable, no risk.
     */
    public static ToolAnnotations readOnlyPreset() {
        return ToolAnnotations.builder()
                .readOnly(true)
                .idempotent(true)
                .cacheable(true)
                .riskLevel(RiskLevel.NONE)
                .build();
    }

    /**
     * Annotations for a tool with irreversible side effects.
     */
    public static ToolAnnotations destructivePreset() {
        return ToolAnnotations.builder()
                .destructive(true)
                .requiresApproval(true)
                .riskLevel(RiskLevel.HIGH)
                .build();
    }

    /**
     * Whether the executor may repeat a failed call. Only an explicit idempotence
     * declaration allows it; a read-only flag alone does not.
     */
    public boolean canRetry() {
        return idempotent;
    }

    public boolean canCache() {
        return cacheable && (readOnly || idempotent);
    }

    public boolean shouldRequireApproval() {
        return requiresApproval || destructive || riskLevel.isAtLeast(RiskLevel.HIGH);
    }
}

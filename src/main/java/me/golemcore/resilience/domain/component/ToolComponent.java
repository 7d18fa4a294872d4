package me.golemcore.resilience.domain.component;

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
import me.golemcore.resilience.domain.model.ToolAnnotations;
import me.golemcore.resilience.domain.model.ToolDefinition;
import me.golemcore.resilience.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool the agent can invoke: file access, HTTP calls, database
 * queries, SaaS wrappers and so on. Implementations are supplied per call to
 * the resilient executor and are not owned by it.
 *
 * <p>
 * A tool reports failure either by completing its future exceptionally or by
 * throwing from {@link #execute(ToolContext, Map)}. It should stop work once
 * the given context is done; the executor abandons waiting at that point but
 * cannot stop the tool itself.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition: name, description, input schema and
     * behavioral annotations.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters.
     *
     * @param context
     *            cancellation scope of this attempt, carrying its deadline
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool. Circuit breakers are keyed by it.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Returns the behavioral annotations of this tool.
     *
     * @return the annotations, never {@code null}
     */
    default ToolAnnotations getAnnotations() {
        ToolAnnotations annotations = getDefinition().getAnnotations();
        return annotations != null ? annotations : ToolAnnotations.defaults();
    }
}

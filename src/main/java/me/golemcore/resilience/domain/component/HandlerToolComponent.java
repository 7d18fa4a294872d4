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
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link ToolComponent} backed by a definition and a {@link ToolHandler}
 * lambda, for tools that do not warrant their own class.
 *
 * <pre>{@code
 * ToolComponent clock = HandlerToolComponent.of(
 *         ToolDefinition.simple("clock", "Current time", ToolAnnotations.readOnlyPreset()),
 *         params -> Instant.now().toString());
 * }</pre>
 */
public final class HandlerToolComponent implements ToolComponent {

    private final ToolDefinition definition;
    private final ToolHandler handler;

    public HandlerToolComponent(ToolDefinition definition, ToolHandler handler) {
        this.definition = Objects.requireNonNull(definition, "definition");
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Wraps a synchronous function. Its return value becomes the result output;
     * an exception it throws becomes a failed future.
     */
    public static HandlerToolComponent of(ToolDefinition definition, Function<Map<String, Object>, Object> function) {
        Objects.requireNonNull(function, "function");
        return new HandlerToolComponent(definition, (context, parameters) -> {
            try {
                return CompletableFuture.completedFuture(ToolResult.of(function.apply(parameters)));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    public static HandlerToolComponent of(String name, ToolAnnotations annotations, ToolHandler handler) {
        return new HandlerToolComponent(ToolDefinition.simple(name, name, annotations), handler);
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        return handler.handle(context, parameters);
    }

    @Override
    public String toString() {
        return "HandlerToolComponent[" + definition.getName() + "]";
    }
}

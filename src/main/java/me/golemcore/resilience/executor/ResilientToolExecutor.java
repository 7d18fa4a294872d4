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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.resilience.bulkhead.Bulkhead;
import me.golemcore.resilience.circuitbreaker.CircuitBreakerRegistry;
import me.golemcore.resilience.domain.component.ToolComponent;
import me.golemcore.resilience.domain.context.ToolContext;
import me.golemcore.resilience.domain.exception.AttemptTimeoutException;
import me.golemcore.resilience.domain.exception.CircuitOpenException;
import me.golemcore.resilience.domain.exception.ContextCancelledException;
import me.golemcore.resilience.domain.exception.ToolExecutionException;
import me.golemcore.resilience.domain.model.CircuitBreakerSnapshot;
import me.golemcore.resilience.domain.model.CircuitState;
import me.golemcore.resilience.domain.model.ExecutorConfig;
import me.golemcore.resilience.domain.model.ExecutorOption;
import me.golemcore.resilience.domain.model.ToolResult;
import me.golemcore.resilience.retry.RetryPolicy;
import me.golemcore.resilience.timeout.TimeoutGuard;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Resilient tool executor: composes the bulkhead, the per-tool circuit
 * breakers, the retry policy and the per-attempt timeout into one thread-safe
 * call path.
 *
 * <p>
 * Flow of {@link #execute}:
 * <ol>
 * <li>Acquire a bulkhead slot (fails fast when the caller's context ends)</li>
 * <li>Ask the tool's breaker for admission; an open circuit fails fast with
 * {@link CircuitOpenException} without invoking the tool</li>
 * <li>Run up to {@link RetryPolicy#maxAttempts} attempts, each under a fresh
 * {@link TimeoutGuard} context, recording every outcome on the breaker and
 * sleeping the backoff between attempts</li>
 * <li>Release the slot</li>
 * </ol>
 *
 * <p>
 * The executor owns its bulkhead and breaker registry for its whole lifetime.
 * Tools are supplied per call.
 *
 * @since 1.0
 */
@Slf4j
public class ResilientToolExecutor implements ToolExecutorPort {

    private final ExecutorConfig config;
    private final Bulkhead bulkhead;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryPolicy retryPolicy;
    private final TimeoutGuard timeoutGuard;

    public ResilientToolExecutor(ExecutorConfig config) {
        this(config, Clock.systemUTC());
    }

    public ResilientToolExecutor(ExecutorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config").normalized();
        this.bulkhead = new Bulkhead(this.config.getMaxConcurrent());
        this.circuitBreakers = new CircuitBreakerRegistry(this.config.getCircuitBreakerThreshold(),
                this.config.getCircuitBreakerTimeout(), clock);
        this.retryPolicy = RetryPolicy.from(this.config);
        this.timeoutGuard = new TimeoutGuard(this.config.getDefaultTimeout());
    }

    public static ResilientToolExecutor withDefaults() {
        return new ResilientToolExecutor(ExecutorConfig.defaults());
    }

    public static ResilientToolExecutor withOptions(ExecutorOption... options) {
        return new ResilientToolExecutor(ExecutorConfig.defaults().with(options));
    }

    @Override
    public ToolResult execute(ToolContext context, ToolComponent tool, Map<String, Object> input) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(tool, "tool");
        String toolName = tool.getToolName();
        int maxAttempts = retryPolicy.maxAttempts(tool);

        bulkhead.acquire(context);
        try {
            if (!circuitBreakers.tryAcquire(toolName)) {
                log.debug("[Resilience] Circuit open, rejecting call to '{}'", toolName);
                throw new CircuitOpenException(toolName);
            }
            try {
                return runWithRetry(context, tool, toolName, input, maxAttempts);
            } catch (Error e) {
                // An admitted call must leave an outcome, or a half-open probe never ends.
                circuitBreakers.recordFailure(toolName);
                log.error("[Resilience] Tool '{}' raised {}", toolName, e.getClass().getName(), e);
                throw e;
            }
        } finally {
            bulkhead.release();
        }
    }

    @Override
    public ToolResult executeWithTimeout(ToolContext context, ToolComponent tool, Map<String, Object> input,
            Duration timeout) {
        Objects.requireNonNull(context, "context");
        try (ToolContext bounded = context.withTimeout(timeout)) {
            return execute(bounded, tool, input);
        }
    }

    @Override
    public ToolResult executeSimple(ToolContext context, ToolComponent tool, Map<String, Object> input) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(tool, "tool");
        String toolName = tool.getToolName();
        context.throwIfDone();

        long startNanos = System.nanoTime();
        Attempt attempt;
        try (ToolContext scope = context.withCancel()) {
            attempt = runAttempt(context, scope, tool, toolName, input, 1);
        }
        if (attempt.succeeded()) {
            return attempt.result().withExecution(elapsedSince(startNanos), 1);
        }
        throw terminalError(context, toolName, 1, attempt.error());
    }

    @Override
    public CircuitState getCircuitState(String toolName) {
        return circuitBreakers.getSnapshot(toolName).state();
    }

    public CircuitBreakerSnapshot getCircuitBreaker(String toolName) {
        return circuitBreakers.getSnapshot(toolName);
    }

    public Map<String, CircuitBreakerSnapshot> getCircuitBreakers() {
        return circuitBreakers.getSnapshots();
    }

    @Override
    public void reset() {
        log.debug("[Resilience] reset() ignored: circuits recover after their cooldown");
    }

    public ExecutorConfig getConfig() {
        return config;
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public int getInFlight() {
        return bulkhead.getInFlight();
    }

    public int getAvailablePermits() {
        return bulkhead.getAvailablePermits();
    }

    private ToolResult runWithRetry(ToolContext context, ToolComponent tool, String toolName,
            Map<String, Object> input, int maxAttempts) {
        long startNanos = System.nanoTime();

        for (int index = 1;; index++) {
            Attempt attempt;
            try (ToolContext attemptContext = timeoutGuard.wrap(context)) {
                attempt = runAttempt(context, attemptContext, tool, toolName, input, index);
            }

            if (attempt.succeeded()) {
                circuitBreakers.recordSuccess(toolName);
                Duration elapsed = elapsedSince(startNanos);
                log.debug("[Resilience] Tool '{}' succeeded on attempt {}/{} in {}ms", toolName, index,
                        maxAttempts, elapsed.toMillis());
                return attempt.result().withExecution(elapsed, index);
            }

            circuitBreakers.recordFailure(toolName);
            Throwable error = attempt.error();
            log.debug("[Resilience] Tool '{}' attempt {} failed after {}ms", toolName, attempt.index(),
                    attempt.elapsed().toMillis());
            if (index >= maxAttempts || context.isDone() || !retryPolicy.isRetryable(error)) {
                throw terminalError(context, toolName, index, error);
            }

            Duration delay = retryPolicy.nextDelay(index);
            log.warn("[Resilience] Tool '{}' failed (attempt {}/{}), retrying in {}ms: {}", toolName, index,
                    maxAttempts, delay.toMillis(), describe(error));
            context.await(delay);
        }
    }

    private Attempt runAttempt(ToolContext caller, ToolContext scope, ToolComponent tool, String toolName,
            Map<String, Object> input, int index) {
        long startNanos = System.nanoTime();
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(scope, input);
        } catch (RuntimeException e) {
            return Attempt.failed(index, startNanos, classify(caller, scope, toolName, index, e));
        }
        if (future == null) {
            return Attempt.failed(index, startNanos,
                    new IllegalStateException("Tool '" + toolName + "' returned no result future"));
        }

        try {
            CompletableFuture.anyOf(future.handle((result, error) -> null), scope.doneFuture()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Attempt.failed(index, startNanos,
                    new ContextCancelledException(ContextCancelledException.Reason.CANCELLED, e));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while waiting for tool '" + toolName + "'", e);
        }

        if (!future.isDone()) {
            return Attempt.failed(index, startNanos, scopeEnded(caller, toolName, index, null));
        }
        try {
            ToolResult result = future.join();
            return Attempt.succeeded(index, startNanos, result != null ? result : ToolResult.of(null));
        } catch (CompletionException | CancellationException e) {
            return Attempt.failed(index, startNanos, classify(caller, scope, toolName, index, unwrap(e)));
        }
    }

    /**
     * Maps a tool that gave up because its context ended onto the reason the
     * context ended.
     */
    private Throwable classify(ToolContext caller, ToolContext scope, String toolName, int index, Throwable error) {
        if (error instanceof ContextCancelledException && scope.isDone()) {
            return scopeEnded(caller, toolName, index, error);
        }
        return error;
    }

    private Throwable scopeEnded(ToolContext caller, String toolName, int index, Throwable cause) {
        ContextCancelledException callerError = caller.getError();
        if (callerError != null) {
            return new ContextCancelledException(callerError.getReason(), cause);
        }
        return cause != null
                ? new AttemptTimeoutException(toolName, index, timeoutGuard.getTimeout(), cause)
                : new AttemptTimeoutException(toolName, index, timeoutGuard.getTimeout());
    }

    private RuntimeException terminalError(ToolContext context, String toolName, int attempts, Throwable error) {
        if (error instanceof ContextCancelledException cancelled) {
            log.debug("[Resilience] Tool '{}' abandoned after {} attempt(s): {}", toolName, attempts,
                    cancelled.getMessage());
            return cancelled;
        }
        ContextCancelledException callerError = context.getError();
        if (callerError != null) {
            log.debug("[Resilience] Caller context ended during '{}' attempt {}", toolName, attempts);
            return new ContextCancelledException(callerError.getReason(), error);
        }
        log.warn("[Resilience] Tool '{}' failed after {} attempt(s): {}", toolName, attempts, describe(error));
        return new ToolExecutionException(toolName, attempts, error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Outcome of one loop iteration.
     */
    private record Attempt(int index, Duration elapsed, ToolResult result, Throwable error) {

        static Attempt succeeded(int index, long startNanos, ToolResult result) {
            return new Attempt(index, elapsedSince(startNanos), result, null);
        }

        static Attempt failed(int index, long startNanos, Throwable error) {
            return new Attempt(index, elapsedSince(startNanos), null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}

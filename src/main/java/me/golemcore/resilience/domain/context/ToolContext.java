package me.golemcore.resilience.domain.context;

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

import me.golemcore.resilience.domain.exception.ContextCancelledException;
import me.golemcore.resilience.domain.exception.ContextCancelledException.Reason;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation scope for a tool call.
 *
 * <p>
 * A context is either live or done. It becomes done when {@link #cancel()} (or
 * {@link #close()}) is called, when its deadline passes, or when its parent
 * becomes done. Children are derived with {@link #withCancel()} and
 * {@link #withTimeout(Duration)}; a child's deadline never extends past its
 * parent's.
 *
 * <p>
 * Every derived context must be closed once its work is over, which detaches
 * it from the parent and releases its deadline timer:
 *
 * <pre>{@code
 * try (ToolContext attempt = caller.withTimeout(Duration.ofSeconds(5))) {
 *     return tool.execute(attempt, input).get();
 * }
 * }</pre>
 *
 * <p>
 * Tools observe cancellation by polling {@link #isDone()} or by waiting on
 * {@link #doneFuture()}. Nothing is interrupted or killed on their behalf.
 *
 * @since 1.0
 */
public final class ToolContext implements AutoCloseable {

    // Keeps nanoTime arithmetic far away from overflow.
    private static final long MAX_TIMEOUT_NANOS = TimeUnit.DAYS.toNanos(365L * 100);

    private static final ScheduledThreadPoolExecutor DEADLINE_TIMER = createTimer();

    private final ToolContext parent;
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final Set<ToolContext> children = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ContextCancelledException> error = new AtomicReference<>();
    private volatile ScheduledFuture<?> deadlineTask;

    private ToolContext(ToolContext parent, boolean hasDeadline, long deadlineNanos) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a root context with no deadline. It is done only once cancelled.
     */
    public static ToolContext background() {
        return new ToolContext(null, false, 0L);
    }

    /**
     * Derives a child that inherits this context's deadline and can be cancelled
     * on its own.
     */
    public ToolContext withCancel() {
        return derive(hasDeadline, deadlineNanos);
    }

    /**
     * Derives a child whose deadline is the earlier of this context's deadline
     * and {@code now + timeout}.
     */
    public ToolContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long timeoutNanos = timeout.isNegative() ? 0L : saturatedNanos(timeout);
        long candidate = System.nanoTime() + timeoutNanos;
        if (hasDeadline && deadlineNanos - candidate < 0) {
            candidate = deadlineNanos;
        }
        return derive(true, candidate);
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * Time left until the deadline, or empty when the context has none. Never
     * negative.
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
    }

    public boolean isDone() {
        if (done.isDone()) {
            return true;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            finish(Reason.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /**
     * Why the context is done, or {@code null} while it is still live.
     */
    public ContextCancelledException getError() {
        isDone();
        return error.get();
    }

    public void throwIfDone() {
        ContextCancelledException cause = getError();
        if (cause != null) {
            throw new ContextCancelledException(cause.getReason());
        }
    }

    /**
     * Future completed when the context becomes done. Completing or cancelling the
     * returned copy has no effect on the context.
     */
    public CompletableFuture<Void> doneFuture() {
        return done.copy();
    }

    /**
     * Runs {@code action} once the context is done, on the thread that finishes
     * it, or immediately on the calling thread if it already is.
     */
    public void onDone(Runnable action) {
        Objects.requireNonNull(action, "action");
        isDone();
        done.thenRun(action);
    }

    /**
     * Sleeps for {@code duration} unless the context becomes done first.
     *
     * @throws ContextCancelledException
     *             if the context is or becomes done before the duration elapses,
     *             or if the waiting thread is interrupted
     */
    public void await(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        throwIfDone();
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            done.get(saturatedNanos(duration), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(Reason.CANCELLED, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Context completion failed", e);
        }
        throwIfDone();
    }

    /**
     * Marks the context and all of its descendants as cancelled. Idempotent.
     */
    public void cancel() {
        finish(Reason.CANCELLED);
    }

    @Override
    public void close() {
        cancel();
    }

    private ToolContext derive(boolean childHasDeadline, long childDeadlineNanos) {
        ToolContext child = new ToolContext(this, childHasDeadline, childDeadlineNanos);
        children.add(child);
        ContextCancelledException cause = getError();
        if (cause != null) {
            child.finish(cause.getReason());
            return child;
        }
        if (childHasDeadline) {
            child.scheduleDeadline();
        }
        return child;
    }

    private void scheduleDeadline() {
        long delay = deadlineNanos - System.nanoTime();
        if (delay <= 0) {
            finish(Reason.DEADLINE_EXCEEDED);
            return;
        }
        deadlineTask = DEADLINE_TIMER.schedule(() -> finish(Reason.DEADLINE_EXCEEDED), delay,
                TimeUnit.NANOSECONDS);
        if (error.get() != null) {
            deadlineTask.cancel(false);
        }
    }

    private void finish(Reason reason) {
        if (!error.compareAndSet(null, new ContextCancelledException(reason))) {
            return;
        }
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (ToolContext child : children) {
            child.finish(reason);
        }
        children.clear();
        done.complete(null);
    }

    private static long saturatedNanos(Duration duration) {
        if (duration.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0) {
            return MAX_TIMEOUT_NANOS;
        }
        return duration.toNanos();
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        AtomicInteger sequence = new AtomicInteger(1);
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "tool-context-deadline-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}

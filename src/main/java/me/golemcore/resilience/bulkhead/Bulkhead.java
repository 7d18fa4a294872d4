package me.golemcore.resilience.bulkhead;

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
import me.golemcore.resilience.domain.context.ToolContext;
import me.golemcore.resilience.domain.exception.ContextCancelledException;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded concurrency gate shared by every tool execution of one executor.
 *
 * <p>
 * Backed by a fair {@link Semaphore} with {@code maxConcurrent} permits.
 * {@link #acquire(ToolContext)} waits for a permit in short slices so that a
 * cancelled or expired caller context turns the wait into an immediate
 * {@link ContextCancelledException} instead of a parked thread. A waiter
 * re-queues after every slice, so arrival order is not preserved.
 * {@link #release()} never blocks.
 *
 * @since 1.0
 */
@Slf4j
public class Bulkhead {

    private static final long POLL_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(5);

    private final int maxConcurrent;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();

    public Bulkhead(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    /**
     * Blocks until a slot is free or the context is done, whichever comes first.
     *
     * @throws ContextCancelledException
     *             if the context is done before a slot frees up, or the waiting
     *             thread is interrupted
     */
    public void acquire(ToolContext context) {
        context.throwIfDone();
        try {
            while (!permits.tryAcquire(nextWaitNanos(context), TimeUnit.NANOSECONDS)) {
                context.throwIfDone();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.CANCELLED, e);
        }
        int current = inFlight.incrementAndGet();
        log.trace("[Resilience] Bulkhead slot acquired ({}/{})", current, maxConcurrent);
    }

    /**
     * Returns a slot. A release without a matching acquire is ignored.
     */
    public void release() {
        if (inFlight.getAndUpdate(current -> Math.max(0, current - 1)) == 0) {
            log.warn("[Resilience] Bulkhead release without matching acquire ignored");
            return;
        }
        permits.release();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    private static long nextWaitNanos(ToolContext context) {
        long remaining = context.remaining()
                .map(Duration::toNanos)
                .orElse(Long.MAX_VALUE);
        return Math.min(POLL_INTERVAL_NANOS, remaining);
    }
}

package com.questrail.cncsim.runtime;

import com.questrail.cncsim.time.MonotonicClock;
import com.questrail.cncsim.time.WallClock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MetricsAccumulator
 * -----------------------------------------------------------------------------
 * Thread-safe counters behind {@link SimulationMetrics}.
 *
 * <p>Counters are atomics so publish threads and the timer thread can update
 * them without a shared lock. The recent-error list is a bounded ring guarded
 * by its own monitor: once it holds {@value #MAX_RECENT_ERRORS} entries the
 * oldest entry is dropped.</p>
 *
 * <p>Uptime is measured on the monotonic clock and counts only the time spent
 * running: the span of every earlier start/stop pair plus the current run, if
 * any. Counters are never reset, so a restart keeps the rate consistent with
 * the running time behind the total.</p>
 */
public final class MetricsAccumulator
{
    public static final int MAX_RECENT_ERRORS = 10;

    private static final long UNSET = Long.MIN_VALUE;

    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong validationFailures = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong tickSequence = new AtomicLong();
    private final AtomicInteger activeMachines = new AtomicInteger();

    private final Object lifecycleLock = new Object();
    private long runStartedNanos = UNSET;
    private long earlierRunsNanos;

    private final Deque<String> recentErrors = new ArrayDeque<>(MAX_RECENT_ERRORS);

    public MetricsAccumulator(MonotonicClock clock, WallClock wallClock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void markStarted() {
        synchronized (lifecycleLock) {
            if (runStartedNanos == UNSET) {
                runStartedNanos = clock.nowNanos();
            }
        }
    }

    public void markStopped() {
        synchronized (lifecycleLock) {
            if (runStartedNanos != UNSET) {
                earlierRunsNanos += Math.max(0, clock.nowNanos() - runStartedNanos);
                runStartedNanos = UNSET;
            }
        }
    }

    public long nextTickNumber() {
        return tickSequence.incrementAndGet();
    }

    public void recordPublished(int messages) {
        published.addAndGet(messages);
    }

    public void recordBatchSent() {
        batches.incrementAndGet();
    }

    public void recordValidationFailure() {
        validationFailures.incrementAndGet();
    }

    public void recordDeliveryFailure(String error) {
        deliveryFailures.incrementAndGet();
        recordError(error);
    }

    public void recordTickCompleted(int machinesTicked) {
        activeMachines.set(machinesTicked);
        ticks.incrementAndGet();
    }

    /**
     * Appends to the bounded recent-error list, prefixed with the wall-clock
     * time.
     */
    public void recordError(String error) {
        String entry = wallClock.now() + " " + error;
        synchronized (recentErrors) {
            recentErrors.addLast(entry);
            while (recentErrors.size() > MAX_RECENT_ERRORS) {
                recentErrors.removeFirst();
            }
        }
    }

    public SimulationMetrics snapshot() {
        long total = published.get();
        double uptime = uptimeSeconds();
        double rate = uptime > 0 ? Math.round(total / uptime * 100.0) / 100.0 : 0.0;

        ArrayList<String> errors;
        synchronized (recentErrors) {
            errors = new ArrayList<>(recentErrors);
        }

        return new SimulationMetrics(
                total,
                rate,
                activeMachines.get(),
                (long) Math.floor(uptime),
                errors,
                batches.get(),
                validationFailures.get(),
                ticks.get(),
                deliveryFailures.get());
    }

    private double uptimeSeconds() {
        long nanos;
        synchronized (lifecycleLock) {
            nanos = earlierRunsNanos;
            if (runStartedNanos != UNSET) {
                nanos += Math.max(0, clock.nowNanos() - runStartedNanos);
            }
        }
        return nanos / (double) TimeUnit.SECONDS.toNanos(1);
    }
}

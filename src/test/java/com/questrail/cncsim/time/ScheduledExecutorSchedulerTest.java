package com.questrail.cncsim.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time tests of the production timer. Tolerances are generous so a loaded
 * build machine does not fail them.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsTaskAtDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long armedAt = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - armedAt >= TimeUnit.MILLISECONDS.toNanos(45));
    }

    @Test
    void overdueDeadlineRunsImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(3), latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
                () -> ran.set(true));

        assertTrue(handle.cancel());
        Thread.sleep(200);
        assertFalse(ran.get());
    }

    @Test
    void selfReArmingChainKeepsDeadlineOrder() throws InterruptedException {
        List<Integer> fired = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(3);
        long period = TimeUnit.MILLISECONDS.toNanos(20);
        long first = SystemMonotonicClock.INSTANCE.nowNanos() + period;

        Runnable[] step = new Runnable[1];
        step[0] = () -> {
            int n = fired.size() + 1;
            fired.add(n);
            latch.countDown();
            if (n < 3) {
                scheduler.scheduleAtNanos(first + n * period, step[0]);
            }
        };
        scheduler.scheduleAtNanos(first, step[0]);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), fired);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}

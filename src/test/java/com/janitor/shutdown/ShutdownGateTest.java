package com.janitor.shutdown;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for coordinating shutdown with running passes.
 */
class ShutdownGateTest {

    private final ShutdownGate gate = new ShutdownGate();

    @Test
    @DisplayName("Idle gate is safe to exit")
    void idleGateIsSafe() throws Exception {
        assertTrue(gate.isSafeToExit());
        assertFalse(gate.isShutdownRequested());
        assertTrue(gate.awaitSafeToExit(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("Waiting times out while a pass is running")
    void waitTimesOutDuringCleanup() throws Exception {
        gate.enterCleanup();

        assertFalse(gate.isSafeToExit());
        assertFalse(gate.awaitSafeToExit(Duration.ofMillis(50)));
    }

    @Test
    @DisplayName("Waiting returns once the running pass exits")
    void waitReturnsAfterCleanup() throws Exception {
        gate.enterCleanup();
        gate.requestShutdown();
        AtomicBoolean result = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try {
                result.set(gate.awaitSafeToExit(Duration.ofSeconds(5)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();

        Thread.sleep(50);
        assertEquals(1, done.getCount());
        gate.exitCleanup();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(result.get());
    }

    @Test
    @DisplayName("Pause ends early when shutdown is requested")
    void pauseEndsOnShutdown() throws Exception {
        Thread requester = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            gate.requestShutdown();
        });
        requester.start();

        long start = System.nanoTime();
        assertTrue(gate.pause(Duration.ofSeconds(30)));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(10));
    }

    @Test
    @DisplayName("Pause runs its full duration without shutdown")
    void pauseRunsFullDuration() throws Exception {
        assertFalse(gate.pause(Duration.ofMillis(20)));
    }
}

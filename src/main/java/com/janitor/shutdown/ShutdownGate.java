package com.janitor.shutdown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordinates shutdown with running cleanup passes.
 * <p>
 * A shutdown request stops new work from being scheduled; {@link #awaitSafeToExit(Duration)}
 * then blocks until every pass that {@link #enterCleanup() entered} has {@link #exitCleanup() exited},
 * so the process never exits in the middle of a mutating call.
 */
public class ShutdownGate {

    private static final Logger log = LoggerFactory.getLogger(ShutdownGate.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean shutdownRequested;
    private int activeCleanups;

    public void requestShutdown() {
        lock.lock();
        try {
            if (!shutdownRequested) {
                log.info("Shutdown requested{}", activeCleanups > 0 ? ", waiting for cleanup to finish" : "");
            }
            shutdownRequested = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdownRequested() {
        lock.lock();
        try {
            return shutdownRequested;
        } finally {
            lock.unlock();
        }
    }

    public void enterCleanup() {
        lock.lock();
        try {
            activeCleanups++;
        } finally {
            lock.unlock();
        }
    }

    public void exitCleanup() {
        lock.lock();
        try {
            if (activeCleanups > 0) {
                activeCleanups--;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSafeToExit() {
        lock.lock();
        try {
            return activeCleanups == 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until no cleanup is running.
     *
     * @return true if safe to exit, false if the timeout elapsed first
     */
    public boolean awaitSafeToExit(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (activeCleanups > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleep between passes, returning early when shutdown is requested.
     *
     * @return true if shutdown was requested
     */
    public boolean pause(Duration duration) throws InterruptedException {
        long remaining = duration.toNanos();
        lock.lock();
        try {
            while (!shutdownRequested && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return shutdownRequested;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ShutdownGate{shutdownRequested=" + isShutdownRequested() + ", safeToExit=" + isSafeToExit() + "}";
    }
}

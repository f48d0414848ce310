package de.t14d3.clientdb.core;

import de.t14d3.clientdb.exceptions.ClientDbException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-writer section guarding every store mutation. Waiters are admitted in FIFO order.
 *
 * <pre>
 * try (WriteLock.Permit permit = writeLock.acquire()) {
 *     ...
 * }
 * </pre>
 *
 * Releasing a permit twice is a programming error and throws.
 */
public final class WriteLock {
    private final int maxConcurrent;
    private final Semaphore semaphore;
    private final AtomicInteger holders = new AtomicInteger();

    public WriteLock() {
        this(1);
    }

    public WriteLock(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.semaphore = new Semaphore(maxConcurrent, true);
    }

    public Permit acquire() {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientDbException("Interrupted while waiting for the write lock", e);
        }
        holders.incrementAndGet();
        return new Permit();
    }

    public int holders() {
        return holders.get();
    }

    public int queueLength() {
        return semaphore.getQueueLength();
    }

    private void release() {
        int remaining = holders.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("Write lock out of sync. release has been called too many times.");
        }
        if (remaining >= maxConcurrent) {
            throw new IllegalStateException("Write lock out of sync. " + remaining + " holders after release.");
        }
        semaphore.release();
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                throw new IllegalStateException("Write permit already released");
            }
            release();
        }
    }
}

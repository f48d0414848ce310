package de.t14d3.clientdb.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Collections waiting for a full reset, drained on the next scheduling pass.
 *
 * Enqueueing never resets inline: the first enqueue after a pass submits one drain task to the
 * executor and later enqueues coalesce into it. Within a pass each collection is reset at most
 * once, so cascades raised by the pass itself are absorbed and cyclic relations terminate.
 */
public final class InvalidationQueue {
    private static final Logger log = LoggerFactory.getLogger(InvalidationQueue.class);

    private final Set<String> pending = new LinkedHashSet<>();
    private final Object drainLock = new Object();
    private final Executor executor;
    private final Consumer<String> resetCollection;
    private boolean scheduled;

    public InvalidationQueue(Executor executor, Consumer<String> resetCollection) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.resetCollection = Objects.requireNonNull(resetCollection, "resetCollection");
    }

    public void enqueue(String collection) {
        boolean schedule;
        synchronized (this) {
            if (!pending.add(collection)) {
                return;
            }
            schedule = !scheduled;
            scheduled = true;
        }
        if (schedule) {
            try {
                executor.execute(this::drainScheduled);
            } catch (RejectedExecutionException e) {
                synchronized (this) {
                    scheduled = false;
                }
                log.warn("Invalidation executor rejected the cascade pass; {} stays queued", collection, e);
            }
        }
    }

    public synchronized Set<String> pending() {
        return Set.copyOf(pending);
    }

    /**
     * Reset every queued collection, including those queued while the pass runs.
     * The first failure is rethrown after the pass completes.
     *
     * @return the number of collections reset
     */
    public int drain() {
        synchronized (drainLock) {
            Set<String> resetThisPass = new HashSet<>();
            RuntimeException failure = null;
            int count = 0;
            while (true) {
                String next;
                synchronized (this) {
                    Iterator<String> it = pending.iterator();
                    if (!it.hasNext()) {
                        scheduled = false;
                        break;
                    }
                    next = it.next();
                    it.remove();
                }
                if (!resetThisPass.add(next)) {
                    continue;
                }
                try {
                    resetCollection.accept(next);
                    count++;
                } catch (RuntimeException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
            return count;
        }
    }

    private void drainScheduled() {
        try {
            int count = drain();
            log.debug("Cascade pass reset {} collection(s)", count);
        } catch (RuntimeException e) {
            log.error("Cascading invalidation pass failed", e);
        }
    }
}

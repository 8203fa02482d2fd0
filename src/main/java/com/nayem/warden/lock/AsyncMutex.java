package com.nayem.warden.lock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Non-reentrant mutex whose acquisition is a future rather than a blocked
 * thread.
 * <p>
 * Waiters are granted the mutex in FIFO order. Awaiting {@link #acquire()}
 * while already holding the permit never completes.
 * </p>
 */
public final class AsyncMutex {

    private final ReentrantLock state = new ReentrantLock();
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private boolean held;

    /**
     * Returns a future completed with a {@link Permit} once the mutex is free.
     */
    public CompletableFuture<Permit> acquire() {
        state.lock();
        try {
            if (!held) {
                held = true;
                return CompletableFuture.completedFuture(new Permit());
            }
            CompletableFuture<Permit> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            state.unlock();
        }
    }

    public boolean isLocked() {
        state.lock();
        try {
            return held;
        } finally {
            state.unlock();
        }
    }

    public int queueLength() {
        state.lock();
        try {
            return waiters.size();
        } finally {
            state.unlock();
        }
    }

    private void release() {
        while (true) {
            CompletableFuture<Permit> next;
            state.lock();
            try {
                next = waiters.pollFirst();
                if (next == null) {
                    held = false;
                    return;
                }
            } finally {
                state.unlock();
            }
            // skip waiters that gave up (cancelled) while queued
            if (next.complete(new Permit())) {
                return;
            }
        }
    }

    /**
     * Ownership of the mutex. Closing it hands the mutex to the next waiter.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}

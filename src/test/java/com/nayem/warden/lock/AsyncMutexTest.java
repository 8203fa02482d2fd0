package com.nayem.warden.lock;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class AsyncMutexTest {

    @Test
    public void testFreeMutexGrantsImmediately() {
        AsyncMutex mutex = new AsyncMutex();

        CompletableFuture<AsyncMutex.Permit> permit = mutex.acquire();

        assertTrue(permit.isDone());
        assertTrue(mutex.isLocked());
        permit.join().close();
        assertFalse(mutex.isLocked());
    }

    @Test
    public void testWaitersGrantedInFifoOrder() {
        AsyncMutex mutex = new AsyncMutex();
        List<Integer> order = new ArrayList<>();

        AsyncMutex.Permit first = mutex.acquire().join();
        List<CompletableFuture<Void>> waiters = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int id = i;
            waiters.add(mutex.acquire().thenAccept(permit -> {
                order.add(id);
                permit.close();
            }));
        }
        assertEquals(3, mutex.queueLength());

        first.close();

        CompletableFuture.allOf(waiters.toArray(new CompletableFuture[0])).join();
        assertEquals(List.of(0, 1, 2), order);
        assertFalse(mutex.isLocked());
    }

    @Test
    public void testNotReentrant() {
        AsyncMutex mutex = new AsyncMutex();
        AsyncMutex.Permit held = mutex.acquire().join();

        CompletableFuture<AsyncMutex.Permit> nested = mutex.acquire();

        assertFalse(nested.isDone(), "A holder re-acquiring must wait on itself");
        held.close();
        assertTrue(nested.isDone());
    }

    @Test
    public void testCancelledWaiterIsSkipped() {
        AsyncMutex mutex = new AsyncMutex();
        AsyncMutex.Permit held = mutex.acquire().join();

        CompletableFuture<AsyncMutex.Permit> gaveUp = mutex.acquire();
        CompletableFuture<AsyncMutex.Permit> next = mutex.acquire();
        gaveUp.cancel(false);

        held.close();

        assertTrue(next.isDone());
        assertFalse(next.isCompletedExceptionally());
    }

    @Test
    public void testDoubleCloseReleasesOnce() {
        AsyncMutex mutex = new AsyncMutex();
        AsyncMutex.Permit held = mutex.acquire().join();
        CompletableFuture<AsyncMutex.Permit> second = mutex.acquire();
        CompletableFuture<AsyncMutex.Permit> third = mutex.acquire();

        held.close();
        held.close();

        assertTrue(second.isDone());
        assertFalse(third.isDone(), "Closing a permit twice must not grant two waiters");
    }
}

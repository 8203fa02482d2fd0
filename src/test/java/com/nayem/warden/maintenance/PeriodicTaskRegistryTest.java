package com.nayem.warden.maintenance;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PeriodicTaskRegistryTest {

    private final PeriodicTaskRegistry registry = new PeriodicTaskRegistry();

    @AfterEach
    void tearDown() {
        registry.close();
    }

    /**
     * Many callers racing to start the same task must end up with one instance.
     */
    @Test
    public void testConcurrentStartCreatesOneTask() throws Exception {
        AtomicInteger built = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<CoordinatedPeriodicTask>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return registry.startTask("maintenance", () -> {
                        built.incrementAndGet();
                        return CoordinatedPeriodicTask.builder("maintenance").intervalSeconds(3600).build();
                    });
                }, executor));
            }
            go.countDown();

            CoordinatedPeriodicTask first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (CompletableFuture<CoordinatedPeriodicTask> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
            assertTrue(first.isRunning());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, built.get());
        assertEquals(1, registry.statuses().size());
    }

    @Test
    public void testFindAndClose() {
        assertTrue(registry.find("missing").isEmpty());

        CoordinatedPeriodicTask task = registry.startTask("cleanup",
                () -> CoordinatedPeriodicTask.builder("cleanup").intervalSeconds(60).build());
        assertSame(task, registry.find("cleanup").orElseThrow());

        registry.close();

        assertFalse(task.isRunning());
        assertEquals(TaskState.STOPPED, registry.statuses().get(0).state());
    }
}

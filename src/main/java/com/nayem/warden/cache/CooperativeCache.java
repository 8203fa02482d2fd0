package com.nayem.warden.cache;

import com.nayem.warden.lock.AsyncMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-memory {@link AsyncCacheStore} for a single-threaded cooperative
 * scheduler.
 * <p>
 * Every operation first awaits a non-reentrant {@link AsyncMutex}; that wait is
 * its only suspension point. Once granted, the operation runs to completion on
 * the scheduler before the next one starts, so all access is serialized
 * through one logical actor.
 * </p>
 */
public class CooperativeCache implements AsyncCacheStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CooperativeCache.class);

    private final AsyncMutex mutex = new AsyncMutex();
    private final CacheEntries entries;
    private final Executor scheduler;
    private final ExecutorService ownedScheduler;

    /**
     * Creates a cache running on its own single scheduler thread.
     */
    public CooperativeCache(CacheConfiguration configuration) {
        this(configuration, Clock.systemUTC(), CacheMetrics.noOp());
    }

    public CooperativeCache(CacheConfiguration configuration, Clock clock, CacheMetrics metrics) {
        this.ownedScheduler = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "warden-cooperative-cache");
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = ownedScheduler;
        this.entries = new CacheEntries(configuration, clock, metrics);
    }

    /**
     * Creates a cache that runs on a caller-owned scheduler. The scheduler is
     * not shut down by {@link #close()}.
     */
    public CooperativeCache(CacheConfiguration configuration, Executor scheduler, Clock clock, CacheMetrics metrics) {
        this.ownedScheduler = null;
        this.scheduler = scheduler;
        this.entries = new CacheEntries(configuration, clock, metrics);
    }

    @Override
    public CompletableFuture<Optional<CacheValue>> get(String key) {
        return exclusive(e -> e.get(key));
    }

    @Override
    public CompletableFuture<Void> set(String key, CacheValue value) {
        return exclusive(e -> {
            e.put(key, value);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> upsert(String key, CacheValue value) {
        return exclusive(e -> {
            e.upsert(key, value);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        return exclusive(e -> {
            e.remove(key);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> clear() {
        return exclusive(e -> {
            e.clear();
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> contains(String key) {
        return exclusive(e -> e.contains(key));
    }

    public CompletableFuture<Integer> size() {
        return exclusive(CacheEntries::size);
    }

    /**
     * Runs {@code operation} under the mutex on the scheduler. Callers receive a
     * detached copy, so cancelling or timing out their future never skips the
     * stage that releases the permit.
     */
    private <R> CompletableFuture<R> exclusive(Function<CacheEntries, R> operation) {
        CompletableFuture<R> locked = mutex.acquire().thenCompose(permit -> {
            CompletableFuture<R> result;
            try {
                result = CompletableFuture.supplyAsync(() -> operation.apply(entries), scheduler);
            } catch (RejectedExecutionException e) {
                permit.close();
                return CompletableFuture.failedFuture(new CacheException("Cooperative cache scheduler rejected the operation", e));
            }
            return result.whenComplete((value, error) -> permit.close());
        });
        return locked.copy();
    }

    @Override
    public void close() {
        if (ownedScheduler == null) {
            return;
        }
        ownedScheduler.shutdown();
        try {
            if (!ownedScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Cooperative cache scheduler did not terminate in 5 seconds, forcing shutdown");
                ownedScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ownedScheduler.shutdownNow();
        }
    }
}

package com.nayem.warden.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Hit/miss/eviction counters for one cache store.
 */
public class CacheMetrics {

    private final Counter hits;
    private final Counter misses;
    private final Counter evictions;
    private final Counter expirations;

    public CacheMetrics(MeterRegistry registry, String store) {
        if (registry != null) {
            this.hits = Counter.builder("warden.cache.hits")
                    .description("Cache lookups that found a live entry")
                    .tag("store", store)
                    .register(registry);

            this.misses = Counter.builder("warden.cache.misses")
                    .description("Cache lookups that found nothing or an expired entry")
                    .tag("store", store)
                    .register(registry);

            this.evictions = Counter.builder("warden.cache.evictions")
                    .description("Entries removed to stay within max size")
                    .tag("store", store)
                    .register(registry);

            this.expirations = Counter.builder("warden.cache.expirations")
                    .description("Entries purged on access after their time-to-live")
                    .tag("store", store)
                    .register(registry);
        } else {
            this.hits = null;
            this.misses = null;
            this.evictions = null;
            this.expirations = null;
        }
    }

    public void recordHit() {
        if (hits != null) {
            hits.increment();
        }
    }

    public void recordMiss() {
        if (misses != null) {
            misses.increment();
        }
    }

    public void recordEviction() {
        if (evictions != null) {
            evictions.increment();
        }
    }

    public void recordExpiration() {
        if (expirations != null) {
            expirations.increment();
        }
    }

    public static CacheMetrics noOp() {
        return new CacheMetrics(null, "none");
    }
}

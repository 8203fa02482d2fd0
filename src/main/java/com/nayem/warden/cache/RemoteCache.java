package com.nayem.warden.cache;

import com.nayem.warden.cache.codec.CacheValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis-backed {@link CacheStore}.
 * <p>
 * Values are encoded by a pluggable {@link CacheValueCodec} before they leave
 * the process. Expiry is delegated to Redis: the TTL is sent in whole seconds
 * with every write. {@code maxSize} is not enforced here; the server's
 * eviction policy governs memory.
 * </p>
 * <p>
 * Connection failures and command timeouts surface as
 * {@link CacheConnectionException} and are never reported as a miss.
 * </p>
 */
public class RemoteCache implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RemoteCache.class);
    public static final String DEFAULT_KEY_PREFIX = "warden:cache:";
    private static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final CacheValueCodec codec;
    private final CacheConfiguration configuration;
    private final String keyPrefix;
    private final CacheMetrics metrics;

    public RemoteCache(RedisTemplate<String, byte[]> redisTemplate, CacheValueCodec codec,
            CacheConfiguration configuration) {
        this(redisTemplate, codec, configuration, DEFAULT_KEY_PREFIX, CacheMetrics.noOp());
    }

    public RemoteCache(RedisTemplate<String, byte[]> redisTemplate, CacheValueCodec codec,
            CacheConfiguration configuration, String keyPrefix, CacheMetrics metrics) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.configuration = configuration;
        this.keyPrefix = keyPrefix;
        this.metrics = metrics;
    }

    @Override
    public Optional<CacheValue> get(String key) {
        byte[] payload = remote("get " + key, () -> redisTemplate.opsForValue().get(redisKey(key)));
        if (payload == null) {
            metrics.recordMiss();
            return Optional.empty();
        }
        metrics.recordHit();
        return Optional.of(codec.decode(payload));
    }

    @Override
    public void set(String key, CacheValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null");
        }
        byte[] payload = codec.encode(value);
        Duration ttl = configuration.expiration();
        remote("set " + key, () -> {
            if (ttl != null) {
                redisTemplate.opsForValue().set(redisKey(key), payload, ttlSeconds(ttl), TimeUnit.SECONDS);
            } else {
                redisTemplate.opsForValue().set(redisKey(key), payload);
            }
            return null;
        });
    }

    /**
     * Read-merge-write. Not atomic across processes: a concurrent writer
     * between the read and the write is overwritten.
     */
    @Override
    public void upsert(String key, CacheValue value) {
        CacheValue merged = get(key)
                .map(existing -> existing.mergeWith(value))
                .orElse(value);
        set(key, merged);
    }

    @Override
    public void delete(String key) {
        remote("delete " + key, () -> redisTemplate.delete(redisKey(key)));
    }

    /**
     * Deletes every key under this cache's prefix.
     */
    @Override
    public void clear() {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(SCAN_BATCH).build();
        remote("clear", () -> {
            List<String> batch = new ArrayList<>(SCAN_BATCH);
            long cleared = 0;
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext()) {
                    batch.add(cursor.next());
                    if (batch.size() == SCAN_BATCH) {
                        cleared += deleteBatch(batch);
                    }
                }
            }
            cleared += deleteBatch(batch);
            log.debug("Cleared {} keys under {}", cleared, keyPrefix);
            return null;
        });
    }

    @Override
    public boolean contains(String key) {
        return Boolean.TRUE.equals(remote("exists " + key, () -> redisTemplate.hasKey(redisKey(key))));
    }

    /**
     * Pings the server.
     *
     * @return true if the server answered
     */
    public boolean isConnected() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return pong != null;
        } catch (DataAccessException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    private long deleteBatch(List<String> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        List<String> keys = List.copyOf(batch);
        batch.clear();
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0 : deleted;
    }

    String redisKey(String key) {
        return keyPrefix + key;
    }

    static long ttlSeconds(Duration ttl) {
        long seconds = ttl.getSeconds();
        if (ttl.getNano() > 0) {
            seconds++;
        }
        return Math.max(1, seconds);
    }

    private <R> R remote(String operation, Supplier<R> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            log.warn("Redis unreachable during {}: {}", operation, e.getMessage());
            throw new CacheConnectionException("Redis unreachable during " + operation, e);
        }
    }
}

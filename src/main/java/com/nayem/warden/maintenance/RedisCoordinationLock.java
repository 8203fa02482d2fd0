package com.nayem.warden.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordination token stored in Redis with {@code SET NX PX}.
 * <p>
 * The value is a per-acquisition owner id; release deletes the key only if it
 * still carries that id, so a lease that outlived its TTL cannot free a token
 * since taken by another instance.
 * </p>
 */
public class RedisCoordinationLock implements CoordinationLock {

    private static final Logger log = LoggerFactory.getLogger(RedisCoordinationLock.class);
    private static final String LOCK_PREFIX = "warden:coordination:";
    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration leaseDuration;

    /**
     * @param leaseDuration upper bound on how long a crashed holder can keep the
     *                      token; should exceed the longest expected cycle
     */
    public RedisCoordinationLock(StringRedisTemplate redisTemplate, Duration leaseDuration) {
        this.redisTemplate = redisTemplate;
        this.leaseDuration = leaseDuration;
    }

    @Override
    public Optional<CoordinationLease> tryAcquire(String token) {
        String key = LOCK_PREFIX + token;
        String owner = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, owner, leaseDuration);
        if (!Boolean.TRUE.equals(acquired)) {
            return Optional.empty();
        }
        return Optional.of(new RedisLease(token, key, owner));
    }

    private final class RedisLease implements CoordinationLease {
        private final String token;
        private final String key;
        private final String owner;
        private final AtomicBoolean released = new AtomicBoolean();

        RedisLease(String token, String key, String owner) {
            this.token = token;
            this.key = key;
            this.owner = owner;
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), owner);
            if (deleted == null || deleted == 0) {
                log.warn("Coordination token {} had already expired or changed owner before release", token);
            }
        }
    }
}

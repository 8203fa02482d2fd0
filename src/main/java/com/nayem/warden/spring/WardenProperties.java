package com.nayem.warden.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Warden locks, caches and background maintenance.
 * <p>
 * Bound from {@code application.yml} under the {@code warden} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "warden")
@Validated
public class WardenProperties {

    /**
     * Cross-process lock configuration.
     */
    @Valid
    private Lock lock = new Lock();

    /**
     * Cache store configuration.
     */
    @Valid
    private Cache cache = new Cache();

    /**
     * Periodic maintenance configuration.
     */
    @Valid
    private Maintenance maintenance = new Maintenance();

    /** @return the lock configuration */
    public Lock getLock() {
        return lock;
    }

    /** @param lock the lock configuration */
    public void setLock(Lock lock) {
        this.lock = lock;
    }

    /** @return the cache configuration */
    public Cache getCache() {
        return cache;
    }

    /** @param cache the cache configuration */
    public void setCache(Cache cache) {
        this.cache = cache;
    }

    /** @return the maintenance configuration */
    public Maintenance getMaintenance() {
        return maintenance;
    }

    /** @param maintenance the maintenance configuration */
    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    /**
     * Configuration for file-based worker locks.
     */
    public static class Lock {
        /**
         * Directory holding one lock file per key. Every process that should
         * exclude the others must point at the same directory.
         */
        @NotBlank
        private String directory = Path.of(System.getProperty("java.io.tmpdir"), "warden", "locks").toString();

        /** @return the lock file directory */
        public String getDirectory() {
            return directory;
        }

        /** @param directory the lock file directory */
        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    /**
     * Configuration for the cache store bean.
     */
    public static class Cache {
        /**
         * Store implementation: 'thread-safe', 'cooperative' or 'redis'.
         */
        @Pattern(regexp = "thread-safe|cooperative|redis")
        private String type = "thread-safe";

        /**
         * Maximum entries before least-recently-used eviction. Unset means
         * unbounded. Ignored by the redis store.
         */
        @Min(1)
        private Integer maxSize;

        /**
         * Time-to-live of an entry from insertion. Unset means entries never
         * expire.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration expiration;

        /**
         * Redis store settings.
         */
        @Valid
        private Redis redis = new Redis();

        /** @return the store implementation */
        public String getType() {
            return type;
        }

        /** @param type the store implementation */
        public void setType(String type) {
            this.type = type;
        }

        /** @return the maximum number of entries, or null */
        public Integer getMaxSize() {
            return maxSize;
        }

        /** @param maxSize the maximum number of entries */
        public void setMaxSize(Integer maxSize) {
            this.maxSize = maxSize;
        }

        /** @return the entry time-to-live, or null */
        public Duration getExpiration() {
            return expiration;
        }

        /** @param expiration the entry time-to-live */
        public void setExpiration(Duration expiration) {
            this.expiration = expiration;
        }

        /** @return the redis settings */
        public Redis getRedis() {
            return redis;
        }

        /** @param redis the redis settings */
        public void setRedis(Redis redis) {
            this.redis = redis;
        }
    }

    /**
     * Redis cache store settings.
     */
    public static class Redis {
        /**
         * Prefix of every key written by the cache. {@code clear()} deletes
         * keys under this prefix only.
         */
        @NotBlank
        private String keyPrefix = "warden:cache:";

        /**
         * Value codec: 'json' (Jackson) or 'jdk' (Java serialization).
         */
        @Pattern(regexp = "json|jdk")
        private String codec = "json";

        /** @return the key prefix */
        public String getKeyPrefix() {
            return keyPrefix;
        }

        /** @param keyPrefix the key prefix */
        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        /** @return the codec name */
        public String getCodec() {
            return codec;
        }

        /** @param codec the codec name */
        public void setCodec(String codec) {
            this.codec = codec;
        }
    }

    /**
     * Configuration for the coordinated maintenance loop.
     */
    public static class Maintenance {
        /**
         * Whether the maintenance loop starts with the application.
         */
        private boolean enabled = false;

        /**
         * Seconds to sleep between cycles.
         */
        @Min(1)
        private long intervalSeconds = 3600;

        /**
         * Upper bound on a single maintenance unit. A unit exceeding it is
         * cancelled and retried next cycle.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration unitTimeout = Duration.ofSeconds(30);

        /**
         * Maximum time to wait for the loop to acknowledge cancellation on
         * shutdown.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        /**
         * Coordination backend: 'none', 'postgres' (advisory lock) or 'redis'.
         */
        @Pattern(regexp = "none|postgres|redis")
        private String coordination = "none";

        /**
         * Well-known token every instance competes for.
         */
        @NotBlank
        private String coordinationToken = "warden-maintenance";

        /**
         * Expiry of the redis coordination token, bounding how long a crashed
         * holder blocks the others.
         */
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration leaseDuration = Duration.ofMinutes(10);

        /**
         * Orphan cleanup rules, one maintenance unit each.
         */
        @Valid
        private List<OrphanCleanup> orphanCleanup = new ArrayList<>();

        /** @return whether maintenance is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether maintenance is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the cycle interval in seconds */
        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        /** @param intervalSeconds the cycle interval in seconds */
        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        /** @return the per-unit timeout */
        public Duration getUnitTimeout() {
            return unitTimeout;
        }

        /** @param unitTimeout the per-unit timeout */
        public void setUnitTimeout(Duration unitTimeout) {
            this.unitTimeout = unitTimeout;
        }

        /** @return the shutdown timeout */
        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        /** @param shutdownTimeout the shutdown timeout */
        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        /** @return the coordination backend */
        public String getCoordination() {
            return coordination;
        }

        /** @param coordination the coordination backend */
        public void setCoordination(String coordination) {
            this.coordination = coordination;
        }

        /** @return the coordination token */
        public String getCoordinationToken() {
            return coordinationToken;
        }

        /** @param coordinationToken the coordination token */
        public void setCoordinationToken(String coordinationToken) {
            this.coordinationToken = coordinationToken;
        }

        /** @return the redis token expiry */
        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        /** @param leaseDuration the redis token expiry */
        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        /** @return the orphan cleanup rules */
        public List<OrphanCleanup> getOrphanCleanup() {
            return orphanCleanup;
        }

        /** @param orphanCleanup the orphan cleanup rules */
        public void setOrphanCleanup(List<OrphanCleanup> orphanCleanup) {
            this.orphanCleanup = orphanCleanup;
        }
    }

    /**
     * Rows of {@code table} whose {@code column} no longer matches any
     * {@code parentColumn} in {@code parentTable} are deleted.
     */
    public static class OrphanCleanup {
        @NotBlank
        private String table;

        @NotBlank
        private String column;

        @NotBlank
        private String parentTable;

        @NotBlank
        private String parentColumn = "id";

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getColumn() {
            return column;
        }

        public void setColumn(String column) {
            this.column = column;
        }

        public String getParentTable() {
            return parentTable;
        }

        public void setParentTable(String parentTable) {
            this.parentTable = parentTable;
        }

        public String getParentColumn() {
            return parentColumn;
        }

        public void setParentColumn(String parentColumn) {
            this.parentColumn = parentColumn;
        }
    }
}

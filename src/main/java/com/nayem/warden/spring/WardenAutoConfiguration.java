package com.nayem.warden.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.warden.cache.CacheConfiguration;
import com.nayem.warden.cache.CacheMetrics;
import com.nayem.warden.cache.CooperativeCache;
import com.nayem.warden.cache.RemoteCache;
import com.nayem.warden.cache.ThreadSafeCache;
import com.nayem.warden.cache.codec.CacheValueCodec;
import com.nayem.warden.lock.KeyedMemoryLockManager;
import com.nayem.warden.lock.KeyedWorkerLockManager;
import com.nayem.warden.maintenance.CoordinatedPeriodicTask;
import com.nayem.warden.maintenance.CoordinationLock;
import com.nayem.warden.maintenance.MaintenanceMetrics;
import com.nayem.warden.maintenance.MaintenanceUnit;
import com.nayem.warden.maintenance.NoOpCoordinationLock;
import com.nayem.warden.maintenance.OrphanCleanupUnit;
import com.nayem.warden.maintenance.PeriodicTaskRegistry;
import com.nayem.warden.maintenance.PostgresAdvisoryCoordinationLock;
import com.nayem.warden.maintenance.RedisCoordinationLock;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(WardenProperties.class)
public class WardenAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WardenAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public KeyedMemoryLockManager<String> keyedMemoryLockManager() {
        return new KeyedMemoryLockManager<>();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyedWorkerLockManager keyedWorkerLockManager(WardenProperties properties) {
        return new KeyedWorkerLockManager(Path.of(properties.getLock().getDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "warden.cache.type", havingValue = "thread-safe", matchIfMissing = true)
    public ThreadSafeCache threadSafeCache(WardenProperties properties,
            ObjectProvider<MeterRegistry> registryProvider) {
        return new ThreadSafeCache(cacheConfiguration(properties), Clock.systemUTC(),
                new CacheMetrics(registryProvider.getIfAvailable(), "thread-safe"));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "warden.cache.type", havingValue = "cooperative")
    public CooperativeCache cooperativeCache(WardenProperties properties,
            ObjectProvider<MeterRegistry> registryProvider) {
        return new CooperativeCache(cacheConfiguration(properties), Clock.systemUTC(),
                new CacheMetrics(registryProvider.getIfAvailable(), "cooperative"));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "warden.cache.type", havingValue = "redis")
    public RemoteCache remoteCache(WardenProperties properties,
            ObjectProvider<RedisConnectionFactory> connectionFactoryProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<MeterRegistry> registryProvider) {

        RedisConnectionFactory connectionFactory = connectionFactoryProvider.getIfAvailable();
        if (connectionFactory == null) {
            throw new IllegalStateException("A RedisConnectionFactory is required for the redis cache store");
        }
        ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);

        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();

        WardenProperties.Redis redis = properties.getCache().getRedis();
        return new RemoteCache(template,
                CacheValueCodec.forName(redis.getCodec(), mapper),
                cacheConfiguration(properties),
                redis.getKeyPrefix(),
                new CacheMetrics(registryProvider.getIfAvailable(), "redis"));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "warden.maintenance.enabled", havingValue = "true")
    public CoordinationLock coordinationLock(WardenProperties properties,
            ObjectProvider<DataSource> dataSourceProvider,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        String coordination = properties.getMaintenance().getCoordination();
        return switch (coordination.toLowerCase()) {
            case "none" -> new NoOpCoordinationLock();
            case "postgres" -> {
                DataSource dataSource = dataSourceProvider.getIfAvailable();
                if (dataSource == null) {
                    throw new IllegalStateException("A DataSource is required for postgres maintenance coordination");
                }
                yield new PostgresAdvisoryCoordinationLock(dataSource);
            }
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis is required for redis maintenance coordination");
                }
                yield new RedisCoordinationLock(redis, properties.getMaintenance().getLeaseDuration());
            }
            default -> {
                log.warn("Unknown maintenance coordination '{}', running uncoordinated", coordination);
                yield new NoOpCoordinationLock();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceMetrics maintenanceMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new MaintenanceMetrics(registryProvider.getIfAvailable());
    }

    /**
     * Owns the maintenance loop. Units are the configured orphan cleanups
     * followed by any {@link MaintenanceUnit} beans in the context.
     */
    @Bean
    public WardenRegistry wardenRegistry(WardenProperties properties,
            MaintenanceMetrics metrics,
            ObjectProvider<CoordinationLock> coordinationLockProvider,
            ObjectProvider<MaintenanceUnit> unitProvider,
            ObjectProvider<DataSource> dataSourceProvider) {

        PeriodicTaskRegistry tasks = new PeriodicTaskRegistry();
        WardenProperties.Maintenance maintenance = properties.getMaintenance();
        if (!maintenance.isEnabled()) {
            return new WardenRegistry(tasks);
        }

        List<MaintenanceUnit> units = new ArrayList<>();
        if (!maintenance.getOrphanCleanup().isEmpty()) {
            DataSource dataSource = dataSourceProvider.getIfAvailable();
            if (dataSource == null) {
                throw new IllegalStateException("A DataSource is required for orphan cleanup");
            }
            for (WardenProperties.OrphanCleanup rule : maintenance.getOrphanCleanup()) {
                units.add(new OrphanCleanupUnit(dataSource,
                        new OrphanCleanupUnit.Rule(rule.getTable(), rule.getColumn(),
                                rule.getParentTable(), rule.getParentColumn()),
                        maintenance.getUnitTimeout()));
            }
        }
        unitProvider.orderedStream().forEach(units::add);

        CoordinationLock coordinationLock = coordinationLockProvider.getIfAvailable(NoOpCoordinationLock::new);
        tasks.startTask(WardenRegistry.MAINTENANCE_TASK, () -> CoordinatedPeriodicTask
                .builder(WardenRegistry.MAINTENANCE_TASK)
                .intervalSeconds(maintenance.getIntervalSeconds())
                .unitTimeout(maintenance.getUnitTimeout())
                .shutdownTimeout(maintenance.getShutdownTimeout())
                .coordination(coordinationLock, maintenance.getCoordinationToken())
                .units(units)
                .metrics(metrics)
                .build());
        log.info("Started maintenance loop with {} units every {}s", units.size(), maintenance.getIntervalSeconds());
        return new WardenRegistry(tasks);
    }

    private static CacheConfiguration cacheConfiguration(WardenProperties properties) {
        WardenProperties.Cache cache = properties.getCache();
        return new CacheConfiguration(cache.getMaxSize(), cache.getExpiration());
    }
}

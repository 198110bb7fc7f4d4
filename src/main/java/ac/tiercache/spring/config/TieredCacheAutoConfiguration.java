// TieredCacheAutoConfiguration.java
package ac.tiercache.spring.config;

import ac.tiercache.*;
import ac.tiercache.backend.RedissonKeyValueClient;
import ac.tiercache.spring.aspect.TieredCacheAspect;
import ac.tiercache.spring.service.SpringCacheSettings;
import ac.tiercache.spring.service.TieredSpringCacheManager;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@AutoConfiguration
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TieredCacheAutoConfiguration.class);

    /**
     * Lazy so that an unreachable server only surfaces where the L2 tier is built,
     * which decides between failing and running without L2.
     */
    @Bean(destroyMethod = "shutdown")
    @Lazy
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tiered.cache.l2", name = "enabled", havingValue = "true")
    public RedissonClient redissonClient(TieredCacheProperties properties) {
        TieredCacheProperties.RedisProperties redis = properties.getL2();
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redis.getAddress())
                .setConnectionPoolSize(redis.getConnectionPoolSize())
                .setConnectionMinimumIdleSize(redis.getConnectionMinimumIdleSize())
                .setTimeout(redis.getTimeout());

        if (redis.getPassword() != null) {
            config.useSingleServer().setPassword(redis.getPassword());
        }

        return Redisson.create(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ValueSerializer tieredCacheValueSerializer() {
        return new CodecValueSerializer();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public MultiLevelCacheManager multiLevelCacheManager(TieredCacheProperties properties,
                                                         ObjectProvider<RedissonClient> redissonClient,
                                                         ValueSerializer valueSerializer) {
        TierStore l1 = memoryTier(properties.getL1());
        TierStore l2 = redisTier(properties.getL2(), redissonClient, valueSerializer);
        TierStore l3 = diskTier(properties.getL3(), valueSerializer);
        return new MultiLevelCacheManager(l1, l2, l3);
    }

    @Bean
    @ConditionalOnMissingBean
    public TieredCacheAspect tieredCacheAspect(ObjectProvider<MultiLevelCacheManager> cacheManager) {
        return new TieredCacheAspect(cacheManager);
    }

    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    public CacheManager cacheManager(MultiLevelCacheManager multiLevelCacheManager, TieredCacheProperties properties) {
        Map<String, SpringCacheSettings> named = new LinkedHashMap<>();
        properties.getSpringCaches().forEach((name, cache) -> named.put(name, cache.toSettings()));
        return new TieredSpringCacheManager(multiLevelCacheManager, SpringCacheSettings.defaults(), named);
    }

    private TierStore memoryTier(TieredCacheProperties.MemoryProperties l1) {
        if (!l1.isEnabled()) {
            logger.info("L1 disabled by configuration");
            return null;
        }
        return new MemoryTierStore(l1.getCapacity(), l1.getDefaultTtl(), l1.getEvictionPolicy());
    }

    private TierStore redisTier(TieredCacheProperties.RedisProperties l2,
                                ObjectProvider<RedissonClient> redissonClient,
                                ValueSerializer valueSerializer) {
        if (!l2.isEnabled()) {
            logger.info("L2 disabled by configuration");
            return null;
        }
        try {
            RedissonClient client = redissonClient.getIfAvailable();
            if (client == null) {
                throw new IllegalStateException("No RedissonClient available");
            }
            return new RedisTierStore(new RedissonKeyValueClient(client, l2.getOperationTimeout()),
                    valueSerializer, l2.getNamespace(), l2.getDefaultTtl(), l2.getPruneInterval(), Clock.systemUTC());
        } catch (RuntimeException e) {
            if (l2.isRequired()) {
                throw e;
            }
            logger.warn("L2 unavailable at {}, continuing without it: {}", l2.getAddress(), e.getMessage());
            return null;
        }
    }

    private TierStore diskTier(TieredCacheProperties.DiskProperties l3, ValueSerializer valueSerializer) {
        if (!l3.isEnabled()) {
            logger.info("L3 disabled by configuration");
            return null;
        }
        try {
            return new DiskTierStore(Path.of(l3.getDirectory()), l3.getDefaultTtl(), l3.getSweepInterval(),
                    valueSerializer);
        } catch (RuntimeException e) {
            if (l3.isRequired()) {
                throw e;
            }
            logger.warn("L3 unavailable at {}, continuing without it: {}", l3.getDirectory(), e.getMessage());
            return null;
        }
    }
}

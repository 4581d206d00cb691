package com.uniclass.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uniclass.gateway.cache.InMemoryResponseCache;
import com.uniclass.gateway.cache.RedisResponseCache;
import com.uniclass.gateway.cache.ResponseCache;
import com.uniclass.gateway.keystore.InMemoryKeyStore;
import com.uniclass.gateway.keystore.KeyStore;
import com.uniclass.gateway.quota.InMemoryQuotaTracker;
import com.uniclass.gateway.quota.KeyStoreQuotaTracker;
import com.uniclass.gateway.quota.QuotaTracker;
import com.uniclass.gateway.ratelimit.InMemoryRateLimiter;
import com.uniclass.gateway.ratelimit.RateLimiter;
import com.uniclass.gateway.ratelimit.RedisRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 网关模块自动配置。
 * <p>
 * 通过 {@code uniclass.gateway.storage-type} 切换限流与缓存实现：
 * <ul>
 *   <li>{@code memory}（默认）：纯内存，零外部依赖，适合轻量单机部署</li>
 *   <li>{@code redis}：Redis 实现，适合分布式多实例部署</li>
 * </ul>
 * 通过 {@code uniclass.gateway.quota-storage-type} 切换配额实现（memory / keystore），
 * 通过 {@code uniclass.keystore.type=memory} 启用内存 KeyStore。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.uniclass.gateway")
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 检索调用线程池，大小与在途请求上限一致。
     */
    @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(GatewayProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrent()),
                new CustomizableThreadFactory("search-"));
    }

    // ==================== 内存实现（默认） ====================

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.storage-type", havingValue = "memory", matchIfMissing = true)
    public RateLimiter inMemoryRateLimiter(GatewayProperties properties, Clock clock) {
        log.info("使用内存限流器（轻量模式，无需 Redis）");
        return new InMemoryRateLimiter(properties, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.storage-type", havingValue = "memory", matchIfMissing = true)
    public ResponseCache inMemoryResponseCache(GatewayProperties properties, Clock clock) {
        log.info("使用内存结果缓存（上限 {} 条）", properties.getCache().getMaxEntries());
        return new InMemoryResponseCache(properties, clock);
    }

    // ==================== Redis 实现 ====================

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.storage-type", havingValue = "redis")
    public RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, GatewayProperties properties, Clock clock) {
        log.info("使用 Redis 限流器（分布式模式）");
        return new RedisRateLimiter(redisTemplate, properties, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.storage-type", havingValue = "redis")
    public ResponseCache redisResponseCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                            GatewayProperties properties, Clock clock) {
        log.info("使用 Redis 结果缓存（分布式模式）");
        return new RedisResponseCache(redisTemplate, objectMapper, properties, clock);
    }

    // ==================== 配额 ====================

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.quota-storage-type", havingValue = "memory", matchIfMissing = true)
    public QuotaTracker inMemoryQuotaTracker(GatewayProperties properties, Clock clock) {
        log.info("使用内存配额跟踪（重启后用量清零）");
        return new InMemoryQuotaTracker(properties, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "uniclass.gateway.quota-storage-type", havingValue = "keystore")
    public QuotaTracker keyStoreQuotaTracker(ObjectProvider<KeyStore> keyStore, GatewayProperties properties,
                                             Clock clock) {
        KeyStore store = keyStore.getIfAvailable();
        if (store == null) {
            log.warn("quota-storage-type=keystore 但未配置 KeyStore，退回内存配额跟踪");
            return new InMemoryQuotaTracker(properties, clock);
        }
        log.info("使用 KeyStore 配额跟踪（{}，读取失败时{}）", store.getStoreName(),
                properties.getQuota().isFailOpen() ? "放行" : "拒绝");
        return new KeyStoreQuotaTracker(store, properties, clock);
    }

    // ==================== KeyStore ====================

    @Bean
    @ConditionalOnProperty(name = "uniclass.keystore.type", havingValue = "memory")
    public KeyStore inMemoryKeyStore(Clock clock) {
        log.info("使用内存 KeyStore（重启后数据丢失）");
        return new InMemoryKeyStore(clock);
    }
}

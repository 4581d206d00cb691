package com.uniclass.gateway.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 基于 Redis 的检索结果缓存。
 * <p>
 * 值为 JSON：{@code {"results": [...], "cached_at": "...", "query": "...", "top_k": n}}，
 * 以 SET + EX 写入，过期交给 Redis。Redis 异常按未命中处理。
 */
@Slf4j
public class RedisResponseCache implements ResponseCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    public RedisResponseCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                              GatewayProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CacheLookup get(String query, int topK, String tenantId) {
        String key = key(query, topK, tenantId);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return CacheLookup.miss();
            }
            CachedPayload payload = objectMapper.readValue(json, CachedPayload.class);
            return CacheLookup.hit(payload.getResults(), payload.getCachedAt());
        } catch (JsonProcessingException e) {
            log.warn("缓存内容无法解析，按未命中处理: key={}, error={}", key, e.getOriginalMessage());
            return CacheLookup.miss();
        } catch (RuntimeException e) {
            log.warn("Redis 缓存读取失败，按未命中处理: tenant={}, error={}", tenantId, e.getMessage());
            return CacheLookup.miss();
        }
    }

    @Override
    public boolean set(String query, int topK, List<SearchHit> results, String tenantId, PlanTier planTier) {
        String key = key(query, topK, tenantId);
        long ttl = properties.getCache().ttlFor(planTier);
        try {
            String json = objectMapper.writeValueAsString(
                    new CachedPayload(results, clock.instant(), query, topK));
            redisTemplate.opsForValue().set(key, json, Duration.ofSeconds(ttl));
            return true;
        } catch (JsonProcessingException e) {
            log.warn("缓存内容序列化失败: tenant={}, error={}", tenantId, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Redis 缓存写入失败: tenant={}, error={}", tenantId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean delete(String query, int topK, String tenantId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key(query, topK, tenantId)));
        } catch (RuntimeException e) {
            log.warn("Redis 缓存删除失败: tenant={}, error={}", tenantId, e.getMessage());
            return false;
        }
    }

    @Override
    public int clearTenant(String tenantId) {
        try {
            Set<String> keys = redisTemplate.keys(tenantPattern(tenantId));
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            int removed = deleted != null ? deleted.intValue() : 0;
            log.info("清空租户 {} 的缓存，共 {} 条", tenantId, removed);
            return removed;
        } catch (RuntimeException e) {
            log.warn("Redis 缓存清空失败: tenant={}, error={}", tenantId, e.getMessage());
            return 0;
        }
    }

    @Override
    public CacheStats stats(String tenantId) {
        long count;
        try {
            Set<String> keys = redisTemplate.keys(tenantPattern(tenantId));
            count = keys != null ? keys.size() : 0;
        } catch (RuntimeException e) {
            log.warn("Redis 缓存统计失败: tenant={}, error={}", tenantId, e.getMessage());
            count = 0;
        }
        return CacheStats.builder()
                .tenantId(tenantId)
                .cachedQueries(count)
                .backend(getBackendName())
                .build();
    }

    @Override
    public String getBackendName() {
        return "redis";
    }

    private String key(String query, int topK, String tenantId) {
        return CacheKeys.scoped(properties.getCache().getKeyPrefix(), tenantId, query, topK);
    }

    private String tenantPattern(String tenantId) {
        return CacheKeys.tenantPrefix(properties.getCache().getKeyPrefix(), tenantId) + "*";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CachedPayload {

        private List<SearchHit> results;

        @JsonProperty("cached_at")
        private Instant cachedAt;

        private String query;

        @JsonProperty("top_k")
        private int topK;
    }
}

package com.uniclass.gateway.cache;

import com.uniclass.common.dto.SearchHit;
import com.uniclass.common.model.PlanTier;

import java.util.List;

/**
 * 检索结果缓存接口，按 (租户, 归一化查询, top_k) 缓存，TTL 由套餐决定。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryResponseCache}：内存实现，读取时惰性过期，容量有上限
 * - {@link RedisResponseCache}：Redis 实现，依赖 Redis 自身的过期机制
 * <p>
 * 存储异常一律按未命中 / 写入失败处理，不影响检索请求。
 */
public interface ResponseCache {

    CacheLookup get(String query, int topK, String tenantId);

    /**
     * 写入缓存。
     *
     * @return 是否写入成功
     */
    boolean set(String query, int topK, List<SearchHit> results, String tenantId, PlanTier planTier);

    boolean delete(String query, int topK, String tenantId);

    /**
     * 清空某个租户的全部缓存。
     *
     * @return 删除的条目数
     */
    int clearTenant(String tenantId);

    CacheStats stats(String tenantId);

    String getBackendName();
}

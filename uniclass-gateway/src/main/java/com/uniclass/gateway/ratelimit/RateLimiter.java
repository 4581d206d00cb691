package com.uniclass.gateway.ratelimit;

import com.uniclass.common.model.PlanTier;

/**
 * 按租户 + 套餐的滑动窗口限流器接口。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryRateLimiter}：内存实现，适合轻量单机部署
 * - {@link RedisRateLimiter}：Redis 实现，适合分布式多实例部署
 * <p>
 * 时刻 t 的请求当且仅当 (t - window, t] 内已放行的请求数小于上限时才放行。
 */
public interface RateLimiter {

    /**
     * 检查并登记一次请求。
     *
     * @param tenantId 租户 ID
     * @param planTier 租户套餐
     * @param override 单 Key 限流覆盖值，为空或非正数时使用套餐默认值
     * @return 放行/拒绝结果及窗口信息
     */
    RateLimitResult check(String tenantId, PlanTier planTier, Integer override);

    /**
     * 当前窗口内已放行的请求数（不登记新请求）。
     */
    long currentUsage(String tenantId, PlanTier planTier);

    /**
     * 实现名称，用于日志与健康检查。
     */
    String getBackendName();
}

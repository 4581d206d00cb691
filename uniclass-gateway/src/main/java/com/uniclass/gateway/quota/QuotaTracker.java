package com.uniclass.gateway.quota;

import com.uniclass.common.model.PlanTier;

/**
 * 月度查询配额跟踪器接口，按 UTC 自然月计数。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryQuotaTracker}：内存实现，适合轻量单机部署
 * - {@link KeyStoreQuotaTracker}：委托 KeyStore 持久化计数
 * <p>
 * 组件本身不做去重，调用方需保证每个放行的请求只调用一次 {@link #recordUsage}。
 */
public interface QuotaTracker {

    /**
     * 查询当月用量与上限。
     *
     * @throws com.uniclass.common.exception.QuotaUnavailableException 存储不可用且策略为 fail-closed 时
     */
    QuotaStatus checkQuota(String tenantId, PlanTier planTier);

    /**
     * 剩余配额是否足够本次 queryCount 条查询。
     */
    default boolean canProceed(String tenantId, PlanTier planTier, int queryCount) {
        return checkQuota(tenantId, planTier).getRemaining() >= queryCount;
    }

    /**
     * 累加当月用量。
     */
    void recordUsage(String tenantId, int queryCount);

    /**
     * 建议升级到的下一档套餐，已是最高档时返回 null。
     */
    default PlanTier upgradeSuggestion(PlanTier current) {
        return current == null ? PlanTier.STARTER : current.next();
    }

    /**
     * 实现名称，用于日志与健康检查。
     */
    String getBackendName();
}

package com.uniclass.gateway.quota;

import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的月度配额跟踪器。
 * <p>
 * 每个租户只保留当月计数，跨月后首次访问即从 0 开始。
 * 计数更新通过 {@link ConcurrentHashMap#compute} 完成，同一租户的并发累加互斥执行。
 */
@Slf4j
public class InMemoryQuotaTracker implements QuotaTracker {

    private final GatewayProperties properties;
    private final Clock clock;

    /** tenantId -> 当月计数 */
    private final Map<String, MonthlyCount> usage = new ConcurrentHashMap<>();

    public InMemoryQuotaTracker(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public QuotaStatus checkQuota(String tenantId, PlanTier planTier) {
        YearMonth month = QuotaPeriods.currentMonth(clock);
        MonthlyCount count = usage.get(tenantId);
        long used = count != null && count.getMonth().equals(month) ? count.getCount() : 0;
        return QuotaStatus.of(used, properties.getQuota().limitFor(planTier), QuotaPeriods.resetDate(clock));
    }

    @Override
    public void recordUsage(String tenantId, int queryCount) {
        YearMonth month = QuotaPeriods.currentMonth(clock);
        MonthlyCount updated = usage.compute(tenantId, (id, current) ->
                current == null || !current.getMonth().equals(month)
                        ? new MonthlyCount(month, queryCount)
                        : new MonthlyCount(month, current.getCount() + queryCount));
        log.debug("租户 {} 用量 +{}，{} 累计 {}", tenantId, queryCount, month, updated.getCount());
    }

    @Override
    public String getBackendName() {
        return "memory";
    }

    @Value
    private static class MonthlyCount {
        YearMonth month;
        long count;
    }
}

package com.uniclass.gateway.quota;

import com.uniclass.common.exception.QuotaUnavailableException;
import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;
import com.uniclass.gateway.keystore.KeyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.YearMonth;

/**
 * 委托 KeyStore 持久化计数的月度配额跟踪器，多实例共享用量。
 * <p>
 * 读取失败默认拒绝请求（fail-closed），可通过 {@code uniclass.gateway.quota.fail-open} 改为放行。
 * 写入失败只记录日志：此时检索结果已经产生，不回滚。
 */
@Slf4j
public class KeyStoreQuotaTracker implements QuotaTracker {

    private final KeyStore keyStore;
    private final GatewayProperties properties;
    private final Clock clock;

    public KeyStoreQuotaTracker(KeyStore keyStore, GatewayProperties properties, Clock clock) {
        this.keyStore = keyStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public QuotaStatus checkQuota(String tenantId, PlanTier planTier) {
        long limit = properties.getQuota().limitFor(planTier);
        YearMonth month = QuotaPeriods.currentMonth(clock);
        long used;
        try {
            used = keyStore.getMonthlyUsage(tenantId, month);
        } catch (RuntimeException e) {
            if (!properties.getQuota().isFailOpen()) {
                log.error("读取租户 {} 用量失败，拒绝请求: {}", tenantId, e.getMessage());
                throw new QuotaUnavailableException("配额服务暂不可用: " + e.getMessage(), e);
            }
            log.warn("读取租户 {} 用量失败，按 fail-open 策略放行: {}", tenantId, e.getMessage());
            used = 0;
        }
        return QuotaStatus.of(used, limit, QuotaPeriods.resetDate(clock));
    }

    @Override
    public void recordUsage(String tenantId, int queryCount) {
        YearMonth month = QuotaPeriods.currentMonth(clock);
        try {
            long total = keyStore.incrementMonthlyUsage(tenantId, month, queryCount);
            log.debug("租户 {} 用量 +{}，{} 累计 {}", tenantId, queryCount, month, total);
        } catch (RuntimeException e) {
            log.error("记录租户 {} 用量失败（+{}），本次用量未计入", tenantId, queryCount, e);
        }
    }

    @Override
    public String getBackendName() {
        return "keystore";
    }
}

package com.uniclass.gateway.ratelimit;

import com.uniclass.common.model.PlanTier;
import com.uniclass.gateway.config.GatewayProperties;

/**
 * 两种限流实现共用的计算。
 */
public final class RateLimits {

    private RateLimits() {
    }

    public static int effectiveLimit(GatewayProperties properties, PlanTier planTier, Integer override) {
        if (override != null && override > 0) {
            return override;
        }
        return properties.getRateLimit().limitFor(planTier);
    }

    static String slotKey(String tenantId, PlanTier planTier) {
        return tenantId + ":" + planTier.value();
    }

    /** 向上取整到秒，至少 1 秒 */
    static long retryAfterSeconds(long millisUntilFree) {
        return Math.max(1L, (millisUntilFree + 999) / 1000);
    }
}
